package com.manifold.core.classify;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Lexical view of a query: lower-cased tokens, term matching on token boundaries and
 * extraction of explicitly compared subjects. Shared by the classifier and the plan builder.
 */
public final class QueryText {

    private static final Pattern TOKEN_SPLIT = Pattern.compile("[^\\p{L}\\p{Nd}+#]+");
    private static final Pattern VERSUS = Pattern.compile("(?i)\\s+(?:vs\\.?|versus)\\s+");
    private static final Pattern COMPARE_LEAD = Pattern.compile(
            "(?i)^\\s*(?:compare|comparing|comparison of|differences? between|trade-?offs? between)\\s+");
    private static final Pattern LIST_SPLIT = Pattern.compile("(?i)\\s*,\\s*(?:and\\s+|or\\s+)?|\\s+and\\s+|\\s+or\\s+");
    private static final Pattern TRAILING_CONTEXT = Pattern.compile(
            "(?i)\\s+(?:for|in|when|with|on|regarding|as)\\s+.*$");
    private static final int MAX_SUBJECT_WORDS = 5;

    private final String raw;
    private final List<String> tokens;
    private final String normalized;

    private QueryText(String raw) {
        this.raw = raw == null ? "" : raw.trim();
        this.tokens = Arrays.stream(TOKEN_SPLIT.split(this.raw.toLowerCase(Locale.ROOT)))
                .filter(t -> !t.isEmpty())
                .toList();
        this.normalized = " " + String.join(" ", tokens) + " ";
    }

    public static QueryText of(String raw) {
        return new QueryText(raw);
    }

    public String raw() {
        return raw;
    }

    public List<String> tokens() {
        return tokens;
    }

    public boolean hasWords() {
        return !tokens.isEmpty();
    }

    /** True when {@code term} (one or more space-separated words) occurs on token boundaries. */
    public boolean contains(String term) {
        return normalized.contains(" " + term + " ");
    }

    /** Terms from {@code vocabulary} present in this query, in vocabulary order. */
    public List<String> matching(List<String> vocabulary) {
        var matched = new ArrayList<String>();
        for (String term : vocabulary) {
            if (contains(term)) {
                matched.add(term);
            }
        }
        return matched;
    }

    public long questionMarks() {
        return raw.chars().filter(c -> c == '?').count();
    }

    /**
     * The query text without a trailing question mark or period, used as the subject
     * of generated research questions.
     */
    public String subject() {
        String s = raw.replaceAll("[?.!\\s]+$", "");
        return s.isEmpty() ? raw : s;
    }

    /**
     * Subjects the query explicitly compares ("A vs B", "compare A, B and C").
     * Returns an empty list when fewer than two subjects are found.
     */
    public List<String> comparisonSubjects() {
        String text = subject();
        List<String> parts;
        boolean ledByCompare = COMPARE_LEAD.matcher(text).find();
        text = COMPARE_LEAD.matcher(text).replaceFirst("");
        if (VERSUS.matcher(text).find()) {
            parts = new ArrayList<>();
            String[] sides = VERSUS.split(text);
            for (int i = 0; i < sides.length; i++) {
                String side = i == sides.length - 1 ? TRAILING_CONTEXT.matcher(sides[i]).replaceFirst("") : sides[i];
                parts.addAll(Arrays.asList(LIST_SPLIT.split(side)));
            }
        } else if (ledByCompare) {
            text = TRAILING_CONTEXT.matcher(text).replaceFirst("");
            parts = Arrays.asList(LIST_SPLIT.split(text));
        } else {
            return List.of();
        }
        var subjects = new LinkedHashSet<String>();
        for (String part : parts) {
            String s = part.trim();
            if (s.isEmpty() || s.split("\\s+").length > MAX_SUBJECT_WORDS) {
                continue;
            }
            subjects.add(s);
        }
        return subjects.size() >= 2 ? List.copyOf(subjects) : List.of();
    }
}
