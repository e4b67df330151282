package com.manifold.core.synthesis;

import com.manifold.core.model.SourceRef;

import java.net.URI;
import java.net.URISyntaxException;
import java.util.Arrays;

/**
 * Static authority score for a source: the {@link com.manifold.core.model.SourceType} rank,
 * plus one when the URL points below the site's top level (a specific page rather than a
 * landing page). Only used to mark which side of a conflict leans stronger.
 */
public final class SourceAuthority {

    private SourceAuthority() {}

    public static int score(SourceRef source) {
        if (source == null) {
            return 0;
        }
        return source.sourceType().authority() + (isSpecificPage(source.url()) ? 1 : 0);
    }

    static boolean isSpecificPage(String url) {
        if (url == null || url.isBlank()) {
            return false;
        }
        try {
            String path = new URI(url.trim()).getPath();
            if (path == null) {
                return false;
            }
            long segments = Arrays.stream(path.split("/")).filter(s -> !s.isBlank()).count();
            return segments > 1;
        } catch (URISyntaxException e) {
            return false;
        }
    }
}
