package com.manifold.core.synthesis;

import com.manifold.core.model.Complexity;
import com.manifold.core.model.OutputFormat;

/**
 * Final output format. The classifier's hint is only advisory: a brief is chosen only when the
 * query was simple, nothing conflicts and every thread delivered.
 */
public final class FormatDecision {

    private FormatDecision() {}

    public static OutputFormat decide(Complexity complexity, boolean conflictsDetected, boolean allThreadsPresent) {
        return complexity == Complexity.SIMPLE && !conflictsDetected && allThreadsPresent
                ? OutputFormat.BRIEF
                : OutputFormat.REPORT;
    }
}
