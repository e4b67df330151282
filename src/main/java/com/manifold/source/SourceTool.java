package com.manifold.source;

/**
 * A retrieval backend exposed to research workers under a capability name.
 * <p>
 * The orchestrator only calls and awaits; retry and backoff of the remote call itself
 * belong to the implementation.
 */
public interface SourceTool {

    /** Capability name this tool serves (e.g. "semantic-search", "code-context"). */
    String name();

    /**
     * Runs a single query against the backend.
     *
     * @param query the query text
     * @return the hits, possibly empty
     * @throws SourceToolException when the backend cannot answer
     */
    ResultSet search(String query) throws SourceToolException;
}
