package com.manifold.core.model;

import java.io.Serializable;
import java.util.Locale;

/**
 * A single assertion extracted from evidence.
 *
 * @param topic     sub-question the claim addresses
 * @param statement the assertion text
 * @param stance    polarity towards the topic
 * @param source    where the claim came from
 */
public record Claim(
    String topic,
    String statement,
    Stance stance,
    SourceRef source
) implements Serializable {

    public Claim {
        stance = stance == null ? Stance.NEUTRAL : stance;
    }

    /** Case- and punctuation-insensitive key under which claims on the same topic are compared. */
    public static String topicKey(String topic) {
        if (topic == null) {
            return "";
        }
        return topic.toLowerCase(Locale.ROOT).replaceAll("[^a-z0-9]+", " ").strip();
    }
}
