package com.manifold.core.classify;

import com.manifold.core.config.ResearchProperties;
import com.manifold.core.model.Classification;
import com.manifold.core.model.Complexity;
import com.manifold.core.model.OutputFormat;
import com.manifold.core.model.QueryType;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Maps a raw query to a {@link Classification} using fixed vocabulary tables.
 * <p>
 * Pure: the same query always yields the same classification. Rules are applied in order:
 * query type, complexity tier, worker count within the tier (lower bound unless the signals
 * are unambiguous), then the format hint.
 */
@Component
public class QueryClassifier {

    static final List<String> TECHNICAL_TERMS = List.of(
            "api", "apis", "sdk", "library", "libraries", "framework", "frameworks", "code", "coding",
            "architecture", "implementation", "implement", "database", "databases", "protocol",
            "algorithm", "algorithms", "compiler", "runtime", "kubernetes", "docker", "java", "python",
            "rust", "javascript", "typescript", "golang", "microservice", "microservices", "latency",
            "throughput", "concurrency", "memory", "cache", "caching", "deploy", "deployment",
            "endpoint", "schema", "function", "class", "configure", "configuration", "bug", "debug",
            "performance", "source code", "open source", "jvm", "sql", "http", "grpc", "rest");

    static final List<String> DOMAIN_TERMS = List.of(
            "market", "markets", "trend", "trends", "industry", "concept", "concepts", "comparison",
            "compare", "versus", "vs", "business", "strategy", "adoption", "pricing", "cost", "costs",
            "competitor", "competitors", "regulation", "regulations", "policy", "economics", "economic",
            "impact", "benefits", "risks", "history", "future", "outlook", "investment", "customers",
            "vendor", "vendors", "revenue", "growth", "forecast", "pros and cons", "landscape");

    static final List<String> BREADTH_MARKERS = List.of(
            "comprehensive", "landscape", "end to end", "in depth", "across", "ecosystem",
            "cross domain", "holistic", "state of the art", "everything");

    private final int maxQueryLength;

    @Autowired
    public QueryClassifier(ResearchProperties properties) {
        this(properties.getMaxQueryLength());
    }

    public QueryClassifier(int maxQueryLength) {
        this.maxQueryLength = maxQueryLength;
    }

    /**
     * Classifies a query.
     *
     * @param query raw query text
     * @return the classification
     * @throws ClassificationException when the query is blank, has no words, or is too long
     */
    public Classification classify(String query) {
        if (query == null || query.isBlank()) {
            throw new ClassificationException("Query is empty");
        }
        if (query.length() > maxQueryLength) {
            throw new ClassificationException("Query exceeds " + maxQueryLength + " characters");
        }
        QueryText text = QueryText.of(query);
        if (!text.hasWords()) {
            throw new ClassificationException("Query contains no words: '" + query.trim() + "'");
        }

        List<String> technical = text.matching(TECHNICAL_TERMS);
        List<String> domain = text.matching(DOMAIN_TERMS);
        List<String> breadth = text.matching(BREADTH_MARKERS);
        List<String> subjects = text.comparisonSubjects();

        QueryType type = queryType(technical, domain);
        int facets = technical.size() + domain.size() + subjects.size()
                + (int) Math.max(0, text.questionMarks() - 1);
        boolean comparison = !subjects.isEmpty() || text.contains("compare") || text.contains("vs")
                || text.contains("versus") || text.contains("comparison");
        Complexity complexity = complexity(type, facets, comparison, !breadth.isEmpty());
        int workerCount = workerCount(complexity, type, facets, comparison, !breadth.isEmpty());
        OutputFormat hint = complexity == Complexity.SIMPLE ? OutputFormat.BRIEF : OutputFormat.REPORT;

        var signals = new ArrayList<String>();
        technical.forEach(t -> signals.add("technical:" + t));
        domain.forEach(t -> signals.add("domain:" + t));
        breadth.forEach(t -> signals.add("breadth:" + t));
        subjects.forEach(s -> signals.add("subject:" + s));

        return new Classification(type, complexity, workerCount, hint, signals);
    }

    static QueryType queryType(List<String> technical, List<String> domain) {
        if (!technical.isEmpty() && !domain.isEmpty()) return QueryType.HYBRID;
        if (!technical.isEmpty()) return QueryType.TECHNICAL;
        return QueryType.DOMAIN;
    }

    static Complexity complexity(QueryType type, int facets, boolean comparison, boolean breadth) {
        if (breadth || facets >= 6 || (type == QueryType.HYBRID && facets >= 4)) {
            return Complexity.COMPLEX;
        }
        if (comparison || facets >= 3) {
            return Complexity.MODERATE;
        }
        return Complexity.SIMPLE;
    }

    static int workerCount(Complexity complexity, QueryType type, int facets, boolean comparison, boolean breadth) {
        boolean upper = switch (complexity) {
            case SIMPLE -> type == QueryType.HYBRID;
            case MODERATE -> facets >= 5 || (type == QueryType.HYBRID && comparison);
            case COMPLEX -> facets >= 8 || (type == QueryType.HYBRID && breadth);
        };
        return upper ? complexity.maxWorkers() : complexity.minWorkers();
    }
}
