package com.manifold.core.model;

import java.util.Locale;

/**
 * Polarity of a claim with respect to its topic. Only an AFFIRMS/DENIES pair on the same
 * topic counts as a conflict.
 */
public enum Stance {
    AFFIRMS,
    DENIES,
    NEUTRAL;

    public static Stance fromString(String raw) {
        if (raw == null || raw.isBlank()) {
            return null;
        }
        try {
            return valueOf(raw.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            return null;
        }
    }

    public boolean opposes(Stance other) {
        return (this == AFFIRMS && other == DENIES) || (this == DENIES && other == AFFIRMS);
    }
}
