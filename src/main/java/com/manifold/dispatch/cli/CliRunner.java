package com.manifold.dispatch.cli;

import com.manifold.core.classify.ClassificationException;
import com.manifold.core.store.StorageException;
import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.ExitCodeGenerator;
import org.springframework.stereotype.Component;
import picocli.CommandLine;
import picocli.CommandLine.IFactory;

/**
 * Bridges picocli with Spring Boot lifecycle.
 * <p>
 * Failures escaping a subcommand are mapped to distinct exit codes: a rejected query
 * ({@value #EXIT_REJECTED}), a run store failure ({@value #EXIT_STORAGE}) and anything
 * else ({@value #EXIT_FAILURE}).
 */
@Component
public class CliRunner implements CommandLineRunner, ExitCodeGenerator {

    static final int EXIT_FAILURE = 1;
    static final int EXIT_REJECTED = 2;
    static final int EXIT_STORAGE = 3;

    private final ManifoldCommand manifoldCommand;
    private final IFactory factory;
    private int exitCode;

    public CliRunner(ManifoldCommand manifoldCommand, IFactory factory) {
        this.manifoldCommand = manifoldCommand;
        this.factory = factory;
    }

    @Override
    public void run(String... args) {
        exitCode = commandLine(manifoldCommand, factory).execute(args);
    }

    @Override
    public int getExitCode() {
        return exitCode;
    }

    static CommandLine commandLine(ManifoldCommand command, IFactory factory) {
        return new CommandLine(command, factory)
                .setExecutionExceptionHandler((ex, cmd, parseResult) -> {
                    int code = exitCodeFor(ex);
                    String prefix = switch (code) {
                        case EXIT_REJECTED -> "Query rejected: ";
                        case EXIT_STORAGE -> "Run store failure: ";
                        default -> "Command failed: ";
                    };
                    ConsoleOutput.error(prefix + ConsoleOutput.rootCauseMessage(ex));
                    return code;
                });
    }

    static int exitCodeFor(Throwable ex) {
        for (Throwable t = ex; t != null; t = t.getCause() == t ? null : t.getCause()) {
            if (t instanceof ClassificationException) {
                return EXIT_REJECTED;
            }
            if (t instanceof StorageException) {
                return EXIT_STORAGE;
            }
        }
        return EXIT_FAILURE;
    }
}
