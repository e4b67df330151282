package com.manifold.core.model;

import java.util.Locale;

/**
 * Kind of source a piece of evidence came from, ranked by authority.
 * The rank is only used as a secondary signal when claims conflict.
 */
public enum SourceType {
    PRIMARY_DOCS(5),
    ACADEMIC(4),
    CODE_REPOSITORY(4),
    OFFICIAL_BLOG(3),
    NEWS(3),
    TRANSCRIPT(2),
    COMMUNITY_BLOG(2),
    FORUM(1),
    UNKNOWN(0);

    private final int authority;

    SourceType(int authority) {
        this.authority = authority;
    }

    public int authority() {
        return authority;
    }

    /** Lenient parse used for backend payloads; unknown or blank values map to {@link #UNKNOWN}. */
    public static SourceType fromString(String raw) {
        if (raw == null || raw.isBlank()) {
            return UNKNOWN;
        }
        try {
            return valueOf(raw.trim().toUpperCase(Locale.ROOT).replace('-', '_').replace(' ', '_'));
        } catch (IllegalArgumentException e) {
            return UNKNOWN;
        }
    }
}
