package com.manifold.core.model;

/**
 * Broad nature of a research query, derived from its vocabulary.
 */
public enum QueryType {
    TECHNICAL,
    DOMAIN,
    HYBRID
}
