package com.manifold.core.nodes;

import com.manifold.core.classify.QueryClassifier;
import com.manifold.core.metrics.ResearchMetrics;
import com.manifold.core.model.Classification;
import com.manifold.core.model.RunStatus;
import com.manifold.core.state.ResearchState;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.util.Map;

/**
 * Classifies the query. A {@link com.manifold.core.classify.ClassificationException} aborts
 * the run here, before any artifact exists.
 */
@Component
public class ClassifyQueryNode {

    private static final Logger log = LoggerFactory.getLogger(ClassifyQueryNode.class);

    private final QueryClassifier classifier;
    private final ResearchMetrics metrics;

    public ClassifyQueryNode(QueryClassifier classifier, @Autowired(required = false) ResearchMetrics metrics) {
        this.classifier = classifier;
        this.metrics = metrics;
    }

    public Map<String, Object> apply(ResearchState state) {
        Classification classification = classifier.classify(state.query());
        log.info("Classified as {}/{} with {} workers, signals {}", classification.queryType(),
                classification.complexity(), classification.workerCount(), classification.signals());
        if (metrics != null) {
            metrics.recordClassification(classification.complexity().name(), classification.workerCount());
        }
        return Map.of(
                "classification", classification,
                "status", RunStatus.PLANNING.name()
        );
    }
}
