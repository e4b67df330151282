package com.manifold.core.events;

import com.manifold.core.model.FinalOutput;
import com.manifold.core.model.Finding;
import com.manifold.core.model.ResearchPlan;

import java.io.Serializable;
import java.time.Instant;
import java.util.Map;
import java.util.Set;

/**
 * An event emitted during a research run, used for CLI watch mode and external pollers.
 *
 * @param eventType event type (e.g. "plan.written", "finding.written", "output.written")
 * @param runId     the run this event belongs to
 * @param threadId  the thread this event relates to (nullable for run-level events)
 * @param payload   arbitrary key-value data associated with the event
 * @param timestamp when the event occurred
 */
public record ResearchEvent(
    String eventType,
    String runId,
    String threadId,
    Map<String, Object> payload,
    Instant timestamp
) implements Serializable {

    public static final String RUN_CREATED = "run.created";
    public static final String PLAN_WRITTEN = "plan.written";
    public static final String WORKER_STARTED = "worker.started";
    public static final String WORKER_STATE = "worker.state";
    public static final String FINDING_WRITTEN = "finding.written";
    public static final String WORKER_TERMINAL = "worker.terminal";
    public static final String OUTPUT_WRITTEN = "output.written";
    public static final String RUN_COMPLETED = "run.completed";
    public static final String RUN_FAILED = "run.failed";

    /** Events announcing that an artifact was written to the run store. */
    public static final Set<String> WRITE_EVENTS = Set.of(PLAN_WRITTEN, FINDING_WRITTEN, OUTPUT_WRITTEN);

    public static ResearchEvent of(String eventType, String runId, String threadId, Map<String, Object> payload) {
        return new ResearchEvent(eventType, runId, threadId, payload == null ? Map.of() : payload, Instant.now());
    }

    public static ResearchEvent planWritten(ResearchPlan plan) {
        return of(PLAN_WRITTEN, plan.runId(), null,
                Map.of("threads", plan.threadIds(), "overflowMerged", plan.overflowMerged()));
    }

    public static ResearchEvent findingWritten(String runId, Finding finding) {
        return of(FINDING_WRITTEN, runId, finding.threadId(),
                Map.of("claims", finding.findings().size(),
                       "gaps", finding.gaps().size(),
                       "partial", finding.partial()));
    }

    public static ResearchEvent outputWritten(FinalOutput output) {
        return of(OUTPUT_WRITTEN, output.runId(), null,
                Map.of("format", output.format().name(),
                       "conflicts", output.conflictCount(),
                       "missing", output.missingThreadIds(),
                       "lowConfidence", output.lowConfidence()));
    }

    /** True for the last event a run publishes. */
    public boolean isTerminal() {
        return RUN_COMPLETED.equals(eventType) || RUN_FAILED.equals(eventType);
    }

    public boolean isWrite() {
        return WRITE_EVENTS.contains(eventType);
    }
}
