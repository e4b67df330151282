package com.manifold.core.plan;

import com.manifold.core.classify.QueryText;
import com.manifold.source.CapabilityProperties;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * Picks a thread's primary capability: detects the strongest {@link CapabilitySignal} in the
 * thread text, then looks the signal up in the configured routing table.
 */
@Component
public class CapabilitySelector {

    private static final Pattern URL = Pattern.compile("https?://\\S+");

    static final List<String> RECENT_TERMS = List.of(
            "latest", "recent", "recently", "news", "announced", "announcement", "release", "releases",
            "this week", "this month", "this year", "today", "2024", "2025", "2026", "new version");
    static final List<String> TUTORIAL_TERMS = List.of(
            "tutorial", "tutorials", "video", "videos", "walkthrough", "how to", "course", "talk",
            "conference", "demo", "screencast", "podcast");
    static final List<String> CODE_TERMS = List.of(
            "api", "apis", "sdk", "code", "library", "libraries", "implementation", "implemented",
            "function", "class", "source code", "repository", "github", "snippet");

    private final Map<String, String> routing;

    @Autowired
    public CapabilitySelector(CapabilityProperties properties) {
        this(properties.getRouting());
    }

    public CapabilitySelector(Map<String, String> routing) {
        this.routing = Map.copyOf(routing);
    }

    public CapabilitySignal detect(String text, boolean allowUrl) {
        if (allowUrl && URL.matcher(text).find()) {
            return CapabilitySignal.URL;
        }
        QueryText q = QueryText.of(text);
        if (!q.matching(RECENT_TERMS).isEmpty()) return CapabilitySignal.RECENT;
        if (!q.matching(TUTORIAL_TERMS).isEmpty()) return CapabilitySignal.TUTORIAL;
        if (!q.matching(CODE_TERMS).isEmpty()) return CapabilitySignal.CODE;
        return CapabilitySignal.CONCEPTUAL;
    }

    public String capabilityFor(CapabilitySignal signal) {
        String capability = routing.get(signal.name());
        if (capability == null) {
            capability = routing.get(signal.name().toLowerCase(Locale.ROOT));
        }
        if (capability == null) {
            capability = routing.getOrDefault(CapabilitySignal.CONCEPTUAL.name(), CapabilityProperties.SEMANTIC_SEARCH);
        }
        return capability;
    }

    public String select(String text, boolean allowUrl) {
        return capabilityFor(detect(text, allowUrl));
    }
}
