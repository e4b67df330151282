package com.manifold.source;

/**
 * Thrown when a retrieval backend cannot answer a query. Caught by the research worker,
 * which retries and eventually records the failure as a gap.
 */
public class SourceToolException extends Exception {

    private final String capability;

    public SourceToolException(String capability, String message) {
        super(message);
        this.capability = capability;
    }

    public SourceToolException(String capability, String message, Throwable cause) {
        super(message, cause);
        this.capability = capability;
    }

    public String getCapability() {
        return capability;
    }
}
