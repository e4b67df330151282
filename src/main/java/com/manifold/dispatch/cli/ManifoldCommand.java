package com.manifold.dispatch.cli;

import org.springframework.stereotype.Component;
import picocli.CommandLine;
import picocli.CommandLine.Command;

/**
 * Top-level CLI command for Manifold.
 * Routes to subcommands: research, inspect, history, health.
 */
@Command(
        name = "manifold",
        mixinStandardHelpOptions = true,
        version = "Manifold 0.1.0",
        description = "Multi-agent research orchestrator",
        subcommands = {
                ResearchCommand.class,
                InspectCommand.class,
                HistoryCommand.class,
                HealthCommand.class,
                CommandLine.HelpCommand.class
        }
)
@Component
public class ManifoldCommand implements Runnable {

    @Override
    public void run() {
        ConsoleOutput.printBanner();
        // When no subcommand is given, show usage help
        new CommandLine(this).usage(System.out);
    }
}
