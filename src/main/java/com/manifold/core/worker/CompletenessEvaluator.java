package com.manifold.core.worker;

import com.manifold.core.model.Claim;
import com.manifold.core.model.Stance;
import com.manifold.core.model.ThreadSpec;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Decides whether a worker's evidence is comprehensive and non-conflicting.
 * <p>
 * Comprehensive: every question has at least {@code minHitsPerQuestion} hits and the evidence
 * spans at least {@code minDistinctSources} sources. Non-conflicting: no topic carries both an
 * AFFIRMS and a DENIES claim.
 */
public class CompletenessEvaluator {

    private final int minHitsPerQuestion;
    private final int minDistinctSources;

    public CompletenessEvaluator(int minHitsPerQuestion, int minDistinctSources) {
        this.minHitsPerQuestion = minHitsPerQuestion;
        this.minDistinctSources = minDistinctSources;
    }

    /**
     * @param unansweredQuestions questions below the hit threshold, in thread order
     * @param conflictingTopics   topics with opposing claims
     * @param thinSources         true when too few distinct sources were consulted
     */
    public record Evaluation(
        List<String> unansweredQuestions,
        List<String> conflictingTopics,
        boolean thinSources
    ) {

        public boolean satisfied() {
            return unansweredQuestions.isEmpty() && conflictingTopics.isEmpty() && !thinSources;
        }

        /** What a deepening round should target next, or {@code null} when nothing specific is open. */
        public String nextTarget() {
            if (!unansweredQuestions.isEmpty()) {
                return unansweredQuestions.get(0);
            }
            if (!conflictingTopics.isEmpty()) {
                return conflictingTopics.get(0);
            }
            return null;
        }
    }

    Evaluation evaluate(ThreadSpec thread, Evidence evidence) {
        var unanswered = new ArrayList<String>();
        for (String question : thread.questions()) {
            if (evidence.hitsFor(question) < minHitsPerQuestion) {
                unanswered.add(question);
            }
        }
        List<String> conflicts = conflictingTopics(evidence.claims());
        boolean thin = evidence.sources().size() < minDistinctSources;
        return new Evaluation(List.copyOf(unanswered), conflicts, thin);
    }

    static List<String> conflictingTopics(List<Claim> claims) {
        Map<String, String> displayTopic = new LinkedHashMap<>();
        Map<String, Set<Stance>> stances = new LinkedHashMap<>();
        for (Claim claim : claims) {
            String key = Claim.topicKey(claim.topic());
            displayTopic.putIfAbsent(key, claim.topic());
            stances.computeIfAbsent(key, k -> new LinkedHashSet<>()).add(claim.stance());
        }
        var conflicts = new ArrayList<String>();
        stances.forEach((key, seen) -> {
            if (seen.contains(Stance.AFFIRMS) && seen.contains(Stance.DENIES)) {
                conflicts.add(displayTopic.get(key));
            }
        });
        return List.copyOf(conflicts);
    }
}
