package com.manifold.core.model;

import java.io.Serializable;
import java.util.List;

/**
 * Terminal artifact of a run, produced exactly once by the synthesizer.
 *
 * @param runId            run this output belongs to
 * @param format           chosen report shape
 * @param body             rendered markdown body
 * @param lowConfidence    true when no finding was available at all
 * @param conflictCount    number of conflicting topics flagged in the body
 * @param missingThreadIds plan threads with no finding at barrier time
 */
public record FinalOutput(
    String runId,
    OutputFormat format,
    String body,
    boolean lowConfidence,
    int conflictCount,
    List<String> missingThreadIds
) implements Serializable {

    public FinalOutput {
        missingThreadIds = missingThreadIds == null ? List.of() : List.copyOf(missingThreadIds);
    }
}
