package com.manifold.core.model;

/**
 * Shape of the final research output.
 */
public enum OutputFormat {
    BRIEF,
    REPORT
}
