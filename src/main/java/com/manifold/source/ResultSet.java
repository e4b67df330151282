package com.manifold.source;

import java.util.List;

/**
 * Hits returned by one {@link SourceTool#search} call.
 */
public record ResultSet(
    String capability,
    String query,
    List<SourceHit> hits
) {

    public ResultSet {
        hits = hits == null ? List.of() : List.copyOf(hits);
    }

    public static ResultSet empty(String capability, String query) {
        return new ResultSet(capability, query, List.of());
    }

    public boolean isEmpty() {
        return hits.isEmpty();
    }

    public int size() {
        return hits.size();
    }
}
