package com.manifold.core.model;

import java.io.Serializable;
import java.util.List;

/**
 * The single artifact a research worker produces for its thread. Written exactly once,
 * under the thread's own key, and never rewritten.
 *
 * @param threadId           thread this finding answers
 * @param focus              the thread's focus, copied for self-contained reading
 * @param summary            short curated summary of the evidence
 * @param findings           claims extracted from the evidence
 * @param sourcesConsulted   distinct sources behind the claims
 * @param gaps               documented inabilities to answer (never hidden)
 * @param suggestedFollowUps refined queries that could close the gaps
 * @param searchRounds       number of successful searches the worker issued
 * @param partial            true when the worker gave up on a failing capability
 */
public record Finding(
    String threadId,
    String focus,
    String summary,
    List<Claim> findings,
    List<SourceRef> sourcesConsulted,
    List<String> gaps,
    List<String> suggestedFollowUps,
    int searchRounds,
    boolean partial
) implements Serializable {

    public Finding {
        findings = findings == null ? List.of() : List.copyOf(findings);
        sourcesConsulted = sourcesConsulted == null ? List.of() : List.copyOf(sourcesConsulted);
        gaps = gaps == null ? List.of() : List.copyOf(gaps);
        suggestedFollowUps = suggestedFollowUps == null ? List.of() : List.copyOf(suggestedFollowUps);
    }
}
