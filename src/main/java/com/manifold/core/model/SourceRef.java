package com.manifold.core.model;

import java.io.Serializable;

/**
 * Reference to a consulted source.
 */
public record SourceRef(
    String title,
    String url,
    SourceType sourceType
) implements Serializable {

    public SourceRef {
        sourceType = sourceType == null ? SourceType.UNKNOWN : sourceType;
    }
}
