package com.manifold.core.model;

import java.io.Serializable;
import java.util.List;

/**
 * Result of classifying a research query. Determines how many workers the run gets
 * and which report shape is expected.
 *
 * @param queryType   technical, domain or hybrid vocabulary
 * @param complexity  scope tier
 * @param workerCount number of parallel research threads, always within the tier's range
 * @param formatHint  expected output shape; the synthesizer has the final say
 * @param signals     vocabulary terms that drove the decision (for inspection only)
 */
public record Classification(
    QueryType queryType,
    Complexity complexity,
    int workerCount,
    OutputFormat formatHint,
    List<String> signals
) implements Serializable {

    public static final int MIN_WORKERS = 2;
    public static final int MAX_WORKERS = 6;

    public Classification {
        if (queryType == null || complexity == null || formatHint == null) {
            throw new IllegalArgumentException("queryType, complexity and formatHint are required");
        }
        if (!complexity.allows(workerCount)) {
            throw new IllegalArgumentException("workerCount " + workerCount
                    + " outside range for " + complexity + " ["
                    + complexity.minWorkers() + "," + complexity.maxWorkers() + "]");
        }
        signals = signals == null ? List.of() : List.copyOf(signals);
    }
}
