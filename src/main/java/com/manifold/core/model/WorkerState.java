package com.manifold.core.model;

/**
 * States of the research worker loop. {@link #SEARCHING} is initial, {@link #DONE} terminal.
 */
public enum WorkerState {
    SEARCHING,
    EVALUATING,
    DEEPENING,
    FINALIZING,
    DONE
}
