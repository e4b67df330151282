package com.manifold.core.plan;

/**
 * Signals that route a thread to a capability, in priority order.
 */
public enum CapabilitySignal {
    URL,
    RECENT,
    TUTORIAL,
    CODE,
    CONCEPTUAL
}
