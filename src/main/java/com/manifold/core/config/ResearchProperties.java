package com.manifold.core.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

@Component
@ConfigurationProperties(prefix = "manifold")
public class ResearchProperties {

    private Classifier classifier = new Classifier();
    private Dispatch dispatch = new Dispatch();
    private Worker worker = new Worker();
    private Store store = new Store();

    // -- Flattened accessors (delegate to nested) --
    public int getMaxQueryLength() { return classifier.maxQueryLength; }
    public int getDeadlineSeconds() { return dispatch.deadlineSeconds; }
    public int getMaxAttempts() { return worker.maxAttempts; }
    public long getRetryBackoffMs() { return worker.retryBackoffMs; }
    public int getMaxDeepeningRounds() { return worker.maxDeepeningRounds; }
    public int getMinHitsPerQuestion() { return worker.minHitsPerQuestion; }
    public int getMinDistinctSources() { return worker.minDistinctSources; }
    public String getStoreType() { return store.type; }
    public String getStoreRoot() { return store.root; }

    public Classifier getClassifier() { return classifier; }
    public void setClassifier(Classifier classifier) { this.classifier = classifier; }
    public Dispatch getDispatch() { return dispatch; }
    public void setDispatch(Dispatch dispatch) { this.dispatch = dispatch; }
    public Worker getWorker() { return worker; }
    public void setWorker(Worker worker) { this.worker = worker; }
    public Store getStore() { return store; }
    public void setStore(Store store) { this.store = store; }

    public static class Classifier {
        private int maxQueryLength = 4000;

        public int getMaxQueryLength() { return maxQueryLength; }
        public void setMaxQueryLength(int maxQueryLength) { this.maxQueryLength = maxQueryLength; }
    }

    public static class Dispatch {
        private int deadlineSeconds = 300;

        public int getDeadlineSeconds() { return deadlineSeconds; }
        public void setDeadlineSeconds(int deadlineSeconds) { this.deadlineSeconds = deadlineSeconds; }
    }

    public static class Worker {
        private int maxAttempts = 3;
        private long retryBackoffMs = 200;
        private int maxDeepeningRounds = 3;
        private int minHitsPerQuestion = 2;
        private int minDistinctSources = 2;

        public int getMaxAttempts() { return maxAttempts; }
        public void setMaxAttempts(int maxAttempts) { this.maxAttempts = maxAttempts; }
        public long getRetryBackoffMs() { return retryBackoffMs; }
        public void setRetryBackoffMs(long retryBackoffMs) { this.retryBackoffMs = retryBackoffMs; }
        public int getMaxDeepeningRounds() { return maxDeepeningRounds; }
        public void setMaxDeepeningRounds(int maxDeepeningRounds) { this.maxDeepeningRounds = maxDeepeningRounds; }
        public int getMinHitsPerQuestion() { return minHitsPerQuestion; }
        public void setMinHitsPerQuestion(int minHitsPerQuestion) { this.minHitsPerQuestion = minHitsPerQuestion; }
        public int getMinDistinctSources() { return minDistinctSources; }
        public void setMinDistinctSources(int minDistinctSources) { this.minDistinctSources = minDistinctSources; }
    }

    public static class Store {
        private String type = "filesystem";
        private String root = "./runs";

        public String getType() { return type; }
        public void setType(String type) { this.type = type; }
        public String getRoot() { return root; }
        public void setRoot(String root) { this.root = root; }
    }
}
