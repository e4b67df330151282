package com.manifold.core.classify;

/**
 * Thrown when a query is empty, has no words, or is too long to classify.
 * Fatal for the run: no plan is built and no artifact is written.
 */
public class ClassificationException extends RuntimeException {

    public ClassificationException(String message) {
        super(message);
    }
}
