package com.manifold.dispatch.cli;

import com.manifold.core.store.RunStore;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

import java.util.List;

/**
 * CLI command: manifold history
 * <p>
 * Lists stored runs as a table: Run ID | Format | Threads | Query (truncated).
 */
@Command(name = "history", mixinStandardHelpOptions = true, description = "List past research runs")
@Component
public class HistoryCommand implements Runnable {

    @Option(names = {"--limit", "-n"}, description = "Number of results", defaultValue = "10")
    private int limit;

    private final RunStore runStore;

    public HistoryCommand(RunStore runStore) {
        this.runStore = runStore;
    }

    @Override
    public void run() {
        ConsoleOutput.printBanner();

        List<String> runIds = runStore.listRunIds();
        if (runIds.isEmpty()) {
            ConsoleOutput.info("No runs found.");
            return;
        }

        List<String> display = runIds.size() > limit
                ? runIds.subList(runIds.size() - limit, runIds.size())
                : runIds;

        ConsoleOutput.info("Runs (" + display.size() + " of " + runIds.size() + "):");
        System.out.println();
        System.out.printf("  %-22s %-8s %-8s %s%n", "RUN ID", "FORMAT", "THREADS", "QUERY");
        System.out.println("  " + "-".repeat(76));

        for (String runId : display) {
            var plan = runStore.readPlan(runId);
            String format = runStore.readFinalOutput(runId).map(o -> o.format().name()).orElse("-");
            if (plan.isPresent()) {
                var findings = runStore.readFindings(runId, plan.get().threadIds());
                String threads = findings.size() + "/" + plan.get().threads().size();
                System.out.printf("  %-22s %-8s %-8s %s%n", runId, format, threads, truncate(plan.get().query(), 36));
            } else {
                System.out.printf("  %-22s %-8s %-8s %s%n", runId, format, "-", "-");
            }
        }
    }

    private static String truncate(String s, int max) {
        if (s == null || s.isEmpty()) return "-";
        return s.length() <= max ? s : s.substring(0, max - 3) + "...";
    }
}
