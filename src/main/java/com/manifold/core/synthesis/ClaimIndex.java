package com.manifold.core.synthesis;

import com.manifold.core.model.Claim;
import com.manifold.core.model.Finding;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Claims of all findings grouped by normalized topic, each tagged with the thread it came from.
 * Iteration follows first appearance, so plan order is preserved.
 */
public class ClaimIndex {

    public record Entry(String threadId, Claim claim) {}

    private final Map<String, List<Entry>> byTopic = new LinkedHashMap<>();
    private final Map<String, String> displayTopic = new LinkedHashMap<>();

    public static ClaimIndex of(Collection<Finding> findings) {
        var index = new ClaimIndex();
        for (Finding finding : findings) {
            for (Claim claim : finding.findings()) {
                index.add(finding.threadId(), claim);
            }
        }
        return index;
    }

    void add(String threadId, Claim claim) {
        String key = Claim.topicKey(claim.topic());
        displayTopic.putIfAbsent(key, claim.topic());
        byTopic.computeIfAbsent(key, k -> new ArrayList<>()).add(new Entry(threadId, claim));
    }

    public List<String> topicKeys() {
        return List.copyOf(byTopic.keySet());
    }

    public String displayTopic(String key) {
        return displayTopic.get(key);
    }

    public List<Entry> entries(String key) {
        return byTopic.getOrDefault(key, List.of());
    }

    public int size() {
        return byTopic.size();
    }
}
