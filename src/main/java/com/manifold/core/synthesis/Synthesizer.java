package com.manifold.core.synthesis;

import com.manifold.core.metrics.ResearchMetrics;
import com.manifold.core.model.FinalOutput;
import com.manifold.core.model.Finding;
import com.manifold.core.model.OutputFormat;
import com.manifold.core.model.ResearchPlan;
import com.manifold.core.model.TerminalStatus;
import com.manifold.core.store.RunStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Aggregates the findings of a run into its final output.
 * <p>
 * Called only after the dispatcher has returned a terminal status for every thread. Reads
 * whichever findings exist, flags conflicting topics and names every missing thread.
 * Does not persist the output; the caller owns the write.
 */
@Component
public class Synthesizer {

    private static final Logger log = LoggerFactory.getLogger(Synthesizer.class);

    private final RunStore store;
    private final ConflictDetector conflictDetector;
    private final ReportComposer composer;
    private final ResearchMetrics metrics;

    @Autowired
    public Synthesizer(RunStore store, @Autowired(required = false) ResearchMetrics metrics) {
        this(store, new ConflictDetector(), new ReportComposer(), metrics);
    }

    Synthesizer(RunStore store, ConflictDetector conflictDetector, ReportComposer composer, ResearchMetrics metrics) {
        this.store = store;
        this.conflictDetector = conflictDetector;
        this.composer = composer;
        this.metrics = metrics;
    }

    public FinalOutput synthesize(ResearchPlan plan, Map<String, TerminalStatus> statuses) {
        String runId = plan.runId();
        Map<String, Finding> present = store.readFindings(runId, plan.threadIds());
        List<Finding> findings = List.copyOf(present.values());
        var missing = new ArrayList<String>();
        for (String threadId : plan.threadIds()) {
            if (!present.containsKey(threadId)) {
                missing.add(threadId);
            }
        }
        if (!missing.isEmpty()) {
            log.warn("Run {} synthesizing without findings for {}", runId, missing);
        }

        FinalOutput output;
        if (findings.isEmpty()) {
            output = new FinalOutput(runId, OutputFormat.REPORT, composer.composeGapsOnly(plan, statuses),
                    true, 0, missing);
        } else {
            List<Conflict> conflicts = conflictDetector.detect(ClaimIndex.of(findings));
            OutputFormat format = FormatDecision.decide(plan.classification().complexity(),
                    !conflicts.isEmpty(), missing.isEmpty());
            String body = format == OutputFormat.BRIEF
                    ? composer.composeBrief(plan, findings, missing, statuses)
                    : composer.composeReport(plan, findings, conflicts, missing, statuses);
            output = new FinalOutput(runId, format, body, false, conflicts.size(), missing);
        }

        log.info("Run {} synthesized as {} ({} findings, {} conflicts, {} missing)", runId,
                output.format(), findings.size(), output.conflictCount(), missing.size());
        if (metrics != null) {
            metrics.recordSynthesis(output.format().name(), output.conflictCount(), missing.size());
        }
        return output;
    }
}
