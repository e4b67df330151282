package com.manifold.core.model;

import java.io.Serializable;

/**
 * How a research worker ended, as observed by the dispatcher.
 */
public record TerminalStatus(
    Kind kind,
    String reason
) implements Serializable {

    public enum Kind { DONE, FAILED, TIMED_OUT }

    public static TerminalStatus done() {
        return new TerminalStatus(Kind.DONE, null);
    }

    public static TerminalStatus failed(String reason) {
        return new TerminalStatus(Kind.FAILED, reason);
    }

    public static TerminalStatus timedOut(String reason) {
        return new TerminalStatus(Kind.TIMED_OUT, reason);
    }

    public boolean isDone() {
        return kind == Kind.DONE;
    }

    @Override
    public String toString() {
        return reason == null ? kind.name() : kind.name() + "(" + reason + ")";
    }
}
