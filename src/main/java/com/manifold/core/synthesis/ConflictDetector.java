package com.manifold.core.synthesis;

import com.manifold.core.model.Stance;

import java.util.ArrayList;
import java.util.List;

/**
 * Finds topics that carry at least one AFFIRMS and one DENIES claim, across or within threads.
 */
public class ConflictDetector {

    public List<Conflict> detect(ClaimIndex index) {
        var conflicts = new ArrayList<Conflict>();
        for (String key : index.topicKeys()) {
            var affirms = new ArrayList<ClaimIndex.Entry>();
            var denies = new ArrayList<ClaimIndex.Entry>();
            for (ClaimIndex.Entry entry : index.entries(key)) {
                if (entry.claim().stance() == Stance.AFFIRMS) {
                    affirms.add(entry);
                } else if (entry.claim().stance() == Stance.DENIES) {
                    denies.add(entry);
                }
            }
            if (!affirms.isEmpty() && !denies.isEmpty()) {
                conflicts.add(new Conflict(index.displayTopic(key), affirms, denies, leaning(affirms, denies)));
            }
        }
        return conflicts;
    }

    private static Conflict.Side leaning(List<ClaimIndex.Entry> affirms, List<ClaimIndex.Entry> denies) {
        int a = best(affirms);
        int d = best(denies);
        if (a > d) {
            return Conflict.Side.AFFIRMS;
        }
        if (d > a) {
            return Conflict.Side.DENIES;
        }
        return null;
    }

    private static int best(List<ClaimIndex.Entry> entries) {
        return entries.stream()
                .mapToInt(e -> SourceAuthority.score(e.claim().source()))
                .max()
                .orElse(0);
    }
}
