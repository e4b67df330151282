package com.manifold.core.model;

/**
 * Lifecycle status of a research run.
 */
public enum RunStatus {
    CLASSIFYING,
    PLANNING,
    DISPATCHING,
    SYNTHESIZING,
    COMPLETED,
    FAILED
}
