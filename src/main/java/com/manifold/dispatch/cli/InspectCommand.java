package com.manifold.dispatch.cli;

import com.manifold.core.model.ResearchPlan;
import com.manifold.core.model.ThreadSpec;
import com.manifold.core.store.RunStore;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Parameters;

import java.util.concurrent.Callable;

/**
 * CLI command: manifold inspect &lt;run-id&gt; [thread-id]
 * <p>
 * Without a thread id, shows the run's plan and which findings exist. With one, shows that
 * thread's finding in full.
 */
@Command(name = "inspect", mixinStandardHelpOptions = true, description = "Inspect a run or one of its threads")
@Component
public class InspectCommand implements Callable<Integer> {

    @Parameters(index = "0", description = "Run ID")
    private String runId;

    @Parameters(index = "1", arity = "0..1", description = "Thread ID")
    private String threadId;

    private final RunStore runStore;

    public InspectCommand(RunStore runStore) {
        this.runStore = runStore;
    }

    @Override
    public Integer call() {
        ConsoleOutput.printBanner();

        var planOpt = runStore.readPlan(runId);
        if (planOpt.isEmpty()) {
            ConsoleOutput.error("Run not found: " + runId);
            return 1;
        }
        ResearchPlan plan = planOpt.get();

        if (threadId != null) {
            var finding = runStore.readFinding(runId, threadId);
            if (finding.isEmpty()) {
                boolean planned = plan.threadIds().contains(threadId);
                ConsoleOutput.error(planned
                        ? "Thread " + threadId + " produced no finding"
                        : "Thread " + threadId + " not found in run " + runId);
                return 1;
            }
            ConsoleOutput.finding(finding.get());
            return 0;
        }

        var c = plan.classification();
        System.out.println();
        System.out.println("RUN " + runId);
        System.out.println(ConsoleOutput.RULE);
        System.out.println("  Query:       " + plan.query());
        System.out.println("  Type:        " + c.queryType());
        System.out.println("  Complexity:  " + c.complexity());
        System.out.println("  Workers:     " + c.workerCount());
        System.out.println("  Signals:     " + (c.signals().isEmpty() ? "none" : String.join(", ", c.signals())));
        if (plan.overflowMerged()) {
            System.out.println("  Overflow:    subjects merged into kept threads");
        }
        System.out.println();
        System.out.println("  THREADS:");
        var findings = runStore.readFindings(runId, plan.threadIds());
        for (ThreadSpec thread : plan.threads()) {
            boolean present = findings.containsKey(thread.id());
            System.out.printf("    %-40s %-16s %s%n", thread.id(), thread.primaryCapability(),
                    present ? "finding" : "no finding");
        }

        runStore.readFinalOutput(runId).ifPresentOrElse(
                o -> System.out.println("\n  Final output: " + o.format()
                        + (o.lowConfidence() ? " (low confidence)" : "")
                        + ", " + o.conflictCount() + " conflict(s)"),
                () -> System.out.println("\n  Final output: not written"));
        return 0;
    }
}
