package com.manifold.core.synthesis;

import java.util.List;

/**
 * Opposing claims on one topic. Both sides are always reported.
 *
 * @param topic   topic as first written by a worker
 * @param affirms claims asserting the topic
 * @param denies  claims denying it
 * @param leaning side with strictly higher best authority, or {@code null} when undecided
 */
public record Conflict(
    String topic,
    List<ClaimIndex.Entry> affirms,
    List<ClaimIndex.Entry> denies,
    Side leaning
) {

    public enum Side { AFFIRMS, DENIES }

    public Conflict {
        affirms = List.copyOf(affirms);
        denies = List.copyOf(denies);
    }

    public boolean undecided() {
        return leaning == null;
    }
}
