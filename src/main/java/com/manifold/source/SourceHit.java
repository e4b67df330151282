package com.manifold.source;

import com.manifold.core.model.SourceRef;
import com.manifold.core.model.SourceType;
import com.manifold.core.model.Stance;

/**
 * A single search hit as returned by a backend.
 *
 * @param title      page or document title
 * @param url        location of the source
 * @param snippet    relevant excerpt
 * @param sourceType kind of source
 * @param topic      sub-question the backend associated with the hit (nullable)
 * @param stance     polarity if the backend reports one (nullable; derived from the snippet otherwise)
 */
public record SourceHit(
    String title,
    String url,
    String snippet,
    SourceType sourceType,
    String topic,
    Stance stance
) {

    public SourceHit(String title, String url, String snippet, SourceType sourceType) {
        this(title, url, snippet, sourceType, null, null);
    }

    public SourceRef toRef() {
        return new SourceRef(title, url, sourceType);
    }
}
