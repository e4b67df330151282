package com.manifold.core.store;

import com.manifold.core.model.FinalOutput;
import com.manifold.core.model.Finding;
import com.manifold.core.model.ResearchPlan;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Keyed artifact space for research runs. One namespace per run:
 * <pre>
 *   run-{id}/
 *     plan                  Classification + ThreadSpec list
 *     finding-{threadId}    one per thread, 0..N present
 *     final-output          exactly one, produced last
 * </pre>
 * Every key is write-once. Finding keys are assigned by the plan before any worker starts,
 * so concurrent writers never contend for a key and no locking is needed.
 */
public interface RunStore {

    String PLAN = "plan";
    String FINDING_PREFIX = "finding-";
    String FINAL_OUTPUT = "final-output";

    /**
     * @throws StorageException      on I/O failure
     * @throws IllegalStateException when the run already has a plan
     */
    void writePlan(ResearchPlan plan);

    Optional<ResearchPlan> readPlan(String runId);

    /**
     * Writes a thread's finding under {@code finding-{threadId}}.
     *
     * @throws StorageException      on I/O failure
     * @throws IllegalStateException when the key was already written
     */
    void putFinding(String runId, Finding finding);

    Optional<Finding> readFinding(String runId, String threadId);

    /**
     * @throws StorageException      on I/O failure
     * @throws IllegalStateException when the run already has a final output
     */
    void writeFinalOutput(FinalOutput output);

    Optional<FinalOutput> readFinalOutput(String runId);

    List<String> listRunIds();

    boolean exists(String runId);

    /** Human-readable location, for logs and health output. */
    String describe();

    /** Findings present for the given threads, in the given order. */
    default Map<String, Finding> readFindings(String runId, List<String> threadIds) {
        var found = new LinkedHashMap<String, Finding>();
        for (String threadId : threadIds) {
            readFinding(runId, threadId).ifPresent(f -> found.put(threadId, f));
        }
        return found;
    }
}
