package com.manifold.core.model;

import java.io.Serializable;
import java.util.List;

/**
 * The {@code plan} artifact of a run: the classification plus the fixed thread list.
 * <p>
 * Written once before any worker starts and shared read-only afterwards.
 *
 * @param runId          run this plan belongs to
 * @param query          the original query text
 * @param classification classification the plan was sized from
 * @param threads        threads in plan order; size equals {@code classification.workerCount()}
 * @param overflowMerged true when surplus subjects were folded into kept threads
 */
public record ResearchPlan(
    String runId,
    String query,
    Classification classification,
    List<ThreadSpec> threads,
    boolean overflowMerged
) implements Serializable {

    public ResearchPlan {
        threads = threads == null ? List.of() : List.copyOf(threads);
    }

    public List<String> threadIds() {
        return threads.stream().map(ThreadSpec::id).toList();
    }
}
