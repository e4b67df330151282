package com.manifold.dispatch.cli;

import com.manifold.core.engine.ResearchEngine;
import com.manifold.core.events.EventBus;
import com.manifold.core.events.ResearchEvent;
import com.manifold.core.model.RunStatus;
import com.manifold.core.state.ResearchState;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

import java.util.concurrent.Callable;

/**
 * CLI command: manifold research "&lt;query&gt;"
 * <p>
 * Runs the full pipeline (classify, plan, fan out workers, synthesize) and prints the
 * final output. Artifact writes are always echoed; with {@code --watch}, every run event
 * is streamed while workers progress.
 * Engine failures propagate to {@link CliRunner}, which maps them to exit codes.
 */
@Command(name = "research", mixinStandardHelpOptions = true, description = "Research a question")
@Component
public class ResearchCommand implements Callable<Integer> {

    @Parameters(index = "0", description = "The research question")
    private String query;

    @Option(names = {"--watch", "-w"}, description = "Stream all run events, not only artifact writes")
    private boolean watch;

    private final ResearchEngine researchEngine;
    private final EventBus eventBus;

    public ResearchCommand(ResearchEngine researchEngine, EventBus eventBus) {
        this.researchEngine = researchEngine;
        this.eventBus = eventBus;
    }

    @Override
    public Integer call() {
        ConsoleOutput.printBanner();

        String runId = researchEngine.generateRunId();
        EventBus.Subscription subscription = eventBus.subscribe(runId,
                watch ? null : ResearchEvent.WRITE_EVENTS,
                event -> ConsoleOutput.watchEvent(event.eventType(),
                        (event.threadId() != null ? event.threadId() + " " : "") + event.payload()));

        ResearchState finalState;
        try {
            ConsoleOutput.info("Run " + runId + ": classifying query...");
            finalState = researchEngine.research(runId, query);
        } finally {
            subscription.unsubscribe();
        }

        finalState.classification().ifPresent(c ->
                ConsoleOutput.info(String.format("Type: %s | Complexity: %s | Workers: %d",
                        c.queryType(), c.complexity(), c.workerCount())));

        System.out.println();
        System.out.println("THREADS:");
        finalState.statuses().forEach(ConsoleOutput::thread);

        var output = finalState.finalOutput();
        if (output.isEmpty()) {
            ConsoleOutput.error("No final output produced for run " + runId);
            return 1;
        }
        System.out.println();
        System.out.println(ConsoleOutput.RULE);
        System.out.println(output.get().body());
        System.out.println(ConsoleOutput.RULE);

        if (output.get().lowConfidence()) {
            ConsoleOutput.warn("No findings were produced; output is low confidence.");
        } else if (!output.get().missingThreadIds().isEmpty()) {
            ConsoleOutput.warn("Missing threads: " + String.join(", ", output.get().missingThreadIds()));
        }
        if (finalState.status() == RunStatus.COMPLETED) {
            ConsoleOutput.success("Run " + runId + " complete (" + output.get().format() + ").");
        } else {
            ConsoleOutput.info("Run status: " + finalState.status());
        }
        return 0;
    }
}
