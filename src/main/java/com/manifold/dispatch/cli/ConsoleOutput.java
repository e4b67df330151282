package com.manifold.dispatch.cli;

import com.manifold.core.model.Finding;
import com.manifold.core.model.TerminalStatus;
import picocli.CommandLine;

/**
 * ANSI-colored terminal output utilities for the Manifold CLI.
 */
public class ConsoleOutput {

    static final String RULE = "──────────────────────────────────";

    private ConsoleOutput() {
        // utility class
    }

    public static void printBanner() {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|bold,fg(yellow) MANIFOLD v0.1.0|@"));
        System.out.println(RULE);
    }

    public static void info(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(cyan) [MANIFOLD]|@ " + message));
    }

    public static void success(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(green) +|@ " + message));
    }

    public static void warn(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(yellow) !|@ " + message));
    }

    public static void error(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(red) x|@ " + message));
    }

    public static void thread(String threadId, TerminalStatus status) {
        String color = switch (status.kind()) {
            case DONE -> "fg(green)";
            case FAILED -> "fg(red)";
            case TIMED_OUT -> "fg(yellow)";
        };
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "  @|" + color + " " + status.kind() + "|@ " + threadId
                + (status.reason() != null ? " (" + status.reason() + ")" : "")));
    }

    public static void finding(Finding finding) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|bold,fg(blue) [THREAD " + finding.threadId() + "]|@ " + finding.focus()
                + (finding.partial() ? " @|fg(yellow) (partial)|@" : "")));
        System.out.println("  " + finding.summary());
        System.out.println("  Claims: " + finding.findings().size()
                + " | Sources: " + finding.sourcesConsulted().size()
                + " | Searches: " + finding.searchRounds());
        for (var claim : finding.findings()) {
            System.out.println("    - [" + claim.stance() + "] " + claim.statement());
        }
        for (String gap : finding.gaps()) {
            System.out.println(CommandLine.Help.Ansi.AUTO.string("    @|fg(red) gap:|@ " + gap));
        }
        for (String followUp : finding.suggestedFollowUps()) {
            System.out.println("    follow-up: " + followUp);
        }
    }

    public static void watchEvent(String eventType, String data) {
        String prefix = switch (eventType) {
            case "run.created" -> "@|fg(cyan) [RUN]|@";
            case "plan.written" -> "@|bold,fg(yellow) [PLAN]|@";
            case "worker.started", "worker.state" -> "@|fg(blue) [WORKER]|@";
            case "worker.terminal" -> "@|fg(magenta) [WORKER]|@";
            case "finding.written" -> "@|fg(green) [FINDING]|@";
            case "output.written" -> "@|bold,fg(green) [OUTPUT]|@";
            case "run.completed" -> "@|fg(green),bold [COMPLETE]|@";
            case "run.failed" -> "@|fg(red),bold [FAILED]|@";
            default -> "@|fg(white) [" + eventType + "]|@";
        };
        System.out.println(CommandLine.Help.Ansi.AUTO.string(prefix + " " + data));
    }

    static String rootCauseMessage(Throwable t) {
        Throwable cause = t;
        while (cause.getCause() != null && cause.getCause() != cause) {
            cause = cause.getCause();
        }
        return cause.getMessage() != null ? cause.getMessage() : cause.getClass().getSimpleName();
    }
}
