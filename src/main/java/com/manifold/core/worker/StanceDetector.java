package com.manifold.core.worker;

import com.manifold.core.model.Stance;

import java.util.List;
import java.util.Locale;

/**
 * Lexical stance of an evidence snippet, used when the backend reports none.
 */
public final class StanceDetector {

    private static final List<String> DENY_MARKERS = List.of(
            " not ", "n't ", " no longer ", " never ", " cannot ", " unsupported ", " deprecated ",
            " does not ", " is not ", " fails to ", " lacks ", " false ", " no evidence ", " myth "
    );

    private static final List<String> AFFIRM_MARKERS = List.of(
            " supports ", " confirms ", " enables ", " provides ", " is recommended ", " works ",
            " shows that ", " proven ", " does ", " yes ", " true ", " improves "
    );

    private StanceDetector() {}

    public static Stance detect(String text) {
        if (text == null || text.isBlank()) {
            return Stance.NEUTRAL;
        }
        String padded = " " + text.toLowerCase(Locale.ROOT).replaceAll("[^a-z0-9' ]", " ") + " ";
        if (DENY_MARKERS.stream().anyMatch(padded::contains)) {
            return Stance.DENIES;
        }
        if (AFFIRM_MARKERS.stream().anyMatch(padded::contains)) {
            return Stance.AFFIRMS;
        }
        return Stance.NEUTRAL;
    }
}
