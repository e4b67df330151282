package com.manifold.core.worker;

import com.manifold.core.model.Claim;
import com.manifold.core.model.SourceRef;
import com.manifold.core.model.Stance;
import com.manifold.source.ResultSet;
import com.manifold.source.SourceHit;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Evidence accumulated by one worker across its searches. Confined to the worker's thread;
 * raw hits are reduced to claims and sources here and never leave the worker.
 */
class Evidence {

    private static final int MAX_STATEMENT = 280;

    private final Map<String, Integer> hitsPerTarget = new LinkedHashMap<>();
    private final Map<String, Claim> claims = new LinkedHashMap<>();
    private final Map<String, SourceRef> sources = new LinkedHashMap<>();
    private final List<String> failures = new ArrayList<>();
    private int searchRounds;

    /**
     * Folds one result set into the evidence, attributing every hit to {@code target}
     * (the question or topic the search was issued for).
     */
    void absorb(String target, ResultSet results) {
        searchRounds++;
        hitsPerTarget.merge(target, results.size(), Integer::sum);
        for (SourceHit hit : results.hits()) {
            if (hit.url() != null && !hit.url().isBlank()) {
                sources.putIfAbsent(hit.url(), hit.toRef());
            }
            String statement = statementOf(hit);
            if (statement.isEmpty()) {
                continue;
            }
            String topic = hit.topic() != null && !hit.topic().isBlank() ? hit.topic() : target;
            Stance stance = hit.stance() != null ? hit.stance() : StanceDetector.detect(statement);
            String key = (hit.url() == null ? "" : hit.url()) + "|" + statement.toLowerCase(Locale.ROOT);
            claims.putIfAbsent(key, new Claim(topic, statement, stance, hit.toRef()));
        }
    }

    void recordFailure(String failure) {
        failures.add(failure);
    }

    int hitsFor(String target) {
        return hitsPerTarget.getOrDefault(target, 0);
    }

    List<Claim> claims() {
        return List.copyOf(claims.values());
    }

    List<SourceRef> sources() {
        return List.copyOf(sources.values());
    }

    List<String> failures() {
        return List.copyOf(failures);
    }

    int searchRounds() {
        return searchRounds;
    }

    private static String statementOf(SourceHit hit) {
        String text = hit.snippet() != null && !hit.snippet().isBlank() ? hit.snippet() : hit.title();
        if (text == null) {
            return "";
        }
        text = text.strip().replaceAll("\\s+", " ");
        return text.length() <= MAX_STATEMENT ? text : text.substring(0, MAX_STATEMENT - 3) + "...";
    }
}
