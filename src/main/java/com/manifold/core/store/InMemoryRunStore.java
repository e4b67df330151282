package com.manifold.core.store;

import com.manifold.core.model.FinalOutput;
import com.manifold.core.model.Finding;
import com.manifold.core.model.ResearchPlan;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * In-memory {@link RunStore}. Artifacts live for the lifetime of the process.
 */
public class InMemoryRunStore implements RunStore {

    private static final Logger log = LoggerFactory.getLogger(InMemoryRunStore.class);

    private final ConcurrentHashMap<String, ConcurrentHashMap<String, Object>> runs = new ConcurrentHashMap<>();

    @Override
    public void writePlan(ResearchPlan plan) {
        putOnce(plan.runId(), PLAN, plan);
    }

    @Override
    public Optional<ResearchPlan> readPlan(String runId) {
        return get(runId, PLAN, ResearchPlan.class);
    }

    @Override
    public void putFinding(String runId, Finding finding) {
        putOnce(runId, FINDING_PREFIX + finding.threadId(), finding);
    }

    @Override
    public Optional<Finding> readFinding(String runId, String threadId) {
        return get(runId, FINDING_PREFIX + threadId, Finding.class);
    }

    @Override
    public void writeFinalOutput(FinalOutput output) {
        putOnce(output.runId(), FINAL_OUTPUT, output);
    }

    @Override
    public Optional<FinalOutput> readFinalOutput(String runId) {
        return get(runId, FINAL_OUTPUT, FinalOutput.class);
    }

    @Override
    public List<String> listRunIds() {
        var ids = new ArrayList<>(runs.keySet());
        ids.sort(null);
        return ids;
    }

    @Override
    public boolean exists(String runId) {
        return runs.containsKey(runId);
    }

    @Override
    public String describe() {
        return "in-memory (" + runs.size() + " runs)";
    }

    private void putOnce(String runId, String key, Object artifact) {
        var artifacts = runs.computeIfAbsent(runId, k -> new ConcurrentHashMap<>());
        if (artifacts.putIfAbsent(key, artifact) != null) {
            throw new IllegalStateException("Artifact " + key + " already written for run " + runId);
        }
        log.debug("Stored {} for run {}", key, runId);
    }

    private <T> Optional<T> get(String runId, String key, Class<T> type) {
        var artifacts = runs.get(runId);
        if (artifacts == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(artifacts.get(key)).map(type::cast);
    }
}
