package com.manifold.core.model;

import java.io.Serializable;
import java.util.List;

/**
 * One independently researchable sub-task of a decomposed query.
 *
 * @param id                unique slug within the run (e.g. "t1-core-concepts")
 * @param focus             what this thread investigates
 * @param primaryCapability capability name the worker searches first
 * @param questions         ordered questions the worker tries to answer
 */
public record ThreadSpec(
    String id,
    String focus,
    String primaryCapability,
    List<String> questions
) implements Serializable {

    public ThreadSpec {
        if (id == null || id.isBlank()) {
            throw new IllegalArgumentException("ThreadSpec id is required");
        }
        questions = questions == null ? List.of() : List.copyOf(questions);
    }
}
