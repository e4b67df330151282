package com.manifold.core.worker;

import com.manifold.core.config.ResearchProperties;
import com.manifold.core.events.EventBus;
import com.manifold.core.events.ResearchEvent;
import com.manifold.core.logging.MdcContext;
import com.manifold.core.metrics.ResearchMetrics;
import com.manifold.core.model.Finding;
import com.manifold.core.model.ThreadSpec;
import com.manifold.core.model.WorkerState;
import com.manifold.core.store.RunStore;
import com.manifold.core.store.StorageException;
import com.manifold.source.ResultSet;
import com.manifold.source.SourceToolException;
import com.manifold.source.SourceToolRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Researches one thread and writes exactly one {@link Finding} under the thread's own key.
 * <p>
 * Bounded state machine:
 * <pre>
 *   SEARCHING -> EVALUATING -> DEEPENING -> EVALUATING ... -> FINALIZING -> DONE
 *                          \-> FINALIZING -> DONE
 * </pre>
 * A capability that keeps failing after {@code maxAttempts} sends the worker straight to
 * FINALIZING with a partial finding whose gaps record the failure. A capability that returns
 * nothing is replaced by the next one in the configured fallback chain on the following
 * deepening round.
 * <p>
 * The worker holds no state between calls; one instance serves every thread of every run.
 */
@Component
public class ResearchWorker {

    private static final Logger log = LoggerFactory.getLogger(ResearchWorker.class);

    private static final List<String> REFINEMENTS = List.of(
            "in depth", "authoritative sources", "recent evidence", "concrete examples"
    );

    private final SourceToolRegistry tools;
    private final RunStore store;
    private final EventBus eventBus;
    private final ResearchMetrics metrics;
    private final CompletenessEvaluator evaluator;
    private final int maxAttempts;
    private final long retryBackoffMs;
    private final int maxDeepeningRounds;

    @Autowired
    public ResearchWorker(SourceToolRegistry tools, RunStore store, ResearchProperties properties,
                          EventBus eventBus, @Autowired(required = false) ResearchMetrics metrics) {
        this(tools, store, eventBus, metrics,
                new CompletenessEvaluator(properties.getMinHitsPerQuestion(), properties.getMinDistinctSources()),
                properties.getMaxAttempts(), properties.getRetryBackoffMs(), properties.getMaxDeepeningRounds());
    }

    ResearchWorker(SourceToolRegistry tools, RunStore store, EventBus eventBus, ResearchMetrics metrics,
                   CompletenessEvaluator evaluator, int maxAttempts, long retryBackoffMs, int maxDeepeningRounds) {
        this.tools = tools;
        this.store = store;
        this.eventBus = eventBus;
        this.metrics = metrics;
        this.evaluator = evaluator;
        this.maxAttempts = Math.max(1, maxAttempts);
        this.retryBackoffMs = Math.max(0, retryBackoffMs);
        this.maxDeepeningRounds = Math.max(0, maxDeepeningRounds);
    }

    /**
     * Runs the thread to completion and persists its finding.
     *
     * @return the finding that was written
     * @throws InterruptedException when the run deadline cancelled this worker; nothing is written
     * @throws com.manifold.core.store.StorageException when the finding cannot be persisted
     */
    public Finding research(String runId, ThreadSpec thread) throws InterruptedException {
        MdcContext.setThread(runId, thread.id());
        long startMs = System.currentTimeMillis();
        var evidence = new Evidence();
        var visited = new HashSet<String>();
        String capability = thread.primaryCapability();
        visited.add(capability);
        boolean partial = false;
        int rounds = 0;

        transition(runId, thread, WorkerState.SEARCHING, capability);
        String firstQuestion = thread.questions().isEmpty() ? thread.focus() : thread.questions().get(0);
        SearchOutcome outcome = search(capability, initialQuery(thread, firstQuestion));
        if (outcome.failed()) {
            evidence.recordFailure(outcome.failure());
            partial = true;
        } else {
            evidence.absorb(firstQuestion, outcome.results());
        }

        CompletenessEvaluator.Evaluation evaluation = null;
        while (!partial) {
            transition(runId, thread, WorkerState.EVALUATING, capability);
            evaluation = evaluator.evaluate(thread, evidence);
            if (evaluation.satisfied() || rounds >= maxDeepeningRounds) {
                break;
            }

            rounds++;
            if (outcome.results().isEmpty()) {
                String next = nextCapability(capability, visited);
                if (next != null) {
                    log.info("Capability {} came up empty, falling back to {}", capability, next);
                    capability = next;
                    visited.add(next);
                }
            }
            transition(runId, thread, WorkerState.DEEPENING, capability);
            String target = evaluation.nextTarget() != null ? evaluation.nextTarget() : thread.focus();
            outcome = search(capability, refinedQuery(thread, target, rounds));
            if (outcome.failed()) {
                evidence.recordFailure(outcome.failure());
                partial = true;
            } else {
                evidence.absorb(target, outcome.results());
            }
        }

        transition(runId, thread, WorkerState.FINALIZING, capability);
        if (evaluation == null || partial) {
            evaluation = evaluator.evaluate(thread, evidence);
        }
        Finding finding = compose(thread, evidence, evaluation, partial);

        if (Thread.currentThread().isInterrupted()) {
            throw new InterruptedException("Worker " + thread.id() + " cancelled before writing its finding");
        }
        store.putFinding(runId, finding);
        eventBus.publish(ResearchEvent.findingWritten(runId, finding));

        transition(runId, thread, WorkerState.DONE, capability);
        if (metrics != null) {
            metrics.recordWorkerExecution(thread.primaryCapability(), System.currentTimeMillis() - startMs);
            metrics.recordDeepeningRounds(rounds);
        }
        log.info("Thread {} done: {} claims, {} sources, {} gaps{}", thread.id(),
                finding.findings().size(), finding.sourcesConsulted().size(), finding.gaps().size(),
                partial ? " (partial)" : "");
        return finding;
    }

    /**
     * One search step with in-place retries. Never throws for capability errors, checked or
     * unchecked; the last error is returned as a failure description once attempts are exhausted.
     */
    private SearchOutcome search(String capability, String query) throws InterruptedException {
        MdcContext.setCapability(capability);
        String lastError = null;
        for (int attempt = 1; attempt <= maxAttempts; attempt++) {
            try {
                ResultSet results = tools.resolve(capability).search(query);
                log.debug("{} returned {} hits for '{}'", capability, results.size(), query);
                return SearchOutcome.of(results);
            } catch (StorageException e) {
                throw e;
            } catch (SourceToolException | RuntimeException e) {
                lastError = e instanceof SourceToolException ? e.getMessage() : e.toString();
                if (metrics != null) {
                    metrics.recordCapabilityFailure(capability);
                }
                log.warn("Attempt {}/{} on {} failed: {}", attempt, maxAttempts, capability, e.getMessage());
                if (attempt < maxAttempts && retryBackoffMs > 0) {
                    Thread.sleep(retryBackoffMs * attempt);
                }
            }
        }
        return SearchOutcome.failure("Capability '" + capability + "' failed after " + maxAttempts
                + " attempts for query '" + query + "': " + lastError);
    }

    private String nextCapability(String current, Set<String> visited) {
        String next = tools.fallbackFor(current);
        return next != null && !visited.contains(next) ? next : null;
    }

    private Finding compose(ThreadSpec thread, Evidence evidence,
                            CompletenessEvaluator.Evaluation evaluation, boolean partial) {
        var gaps = new ArrayList<String>();
        var followUps = new LinkedHashSet<String>();
        for (String question : evaluation.unansweredQuestions()) {
            gaps.add("Insufficient evidence: " + question);
            followUps.add(refinedQuery(thread, question, 1));
        }
        for (String topic : evaluation.conflictingTopics()) {
            gaps.add("Unresolved conflict within thread on: " + topic);
            followUps.add("Find an authoritative source settling: " + topic);
        }
        if (evaluation.thinSources() && !evidence.sources().isEmpty()) {
            gaps.add("Only " + evidence.sources().size() + " distinct source(s) consulted");
        }
        for (String failure : evidence.failures()) {
            gaps.add(failure);
            followUps.add("Retry '" + thread.focus() + "' against another capability");
        }
        return new Finding(thread.id(), thread.focus(), summarize(thread, evidence, evaluation),
                evidence.claims(), evidence.sources(), gaps, List.copyOf(followUps),
                evidence.searchRounds(), partial);
    }

    private static String summarize(ThreadSpec thread, Evidence evidence,
                                    CompletenessEvaluator.Evaluation evaluation) {
        if (evidence.claims().isEmpty()) {
            return "No usable evidence gathered on " + thread.focus() + ".";
        }
        int total = thread.questions().size();
        int answered = total - evaluation.unansweredQuestions().size();
        return evidence.claims().size() + " claim(s) from " + evidence.sources().size()
                + " source(s) on " + thread.focus() + "; " + answered + "/" + total
                + " question(s) answered. Lead: " + evidence.claims().get(0).statement();
    }

    static String initialQuery(ThreadSpec thread, String question) {
        return question.equals(thread.focus()) ? question : thread.focus() + ": " + question;
    }

    static String refinedQuery(ThreadSpec thread, String target, int round) {
        String refinement = REFINEMENTS.get((round - 1) % REFINEMENTS.size());
        return initialQuery(thread, target) + " " + refinement;
    }

    private void transition(String runId, ThreadSpec thread, WorkerState state, String capability) {
        MdcContext.setCapability(capability);
        log.debug("Thread {} -> {}", thread.id(), state);
        eventBus.publish(ResearchEvent.of(ResearchEvent.WORKER_STATE, runId, thread.id(),
                Map.of("state", state.name(), "capability", capability)));
    }

    private record SearchOutcome(ResultSet results, String failure) {

        static SearchOutcome of(ResultSet results) {
            return new SearchOutcome(results, null);
        }

        static SearchOutcome failure(String failure) {
            return new SearchOutcome(ResultSet.empty(null, null), failure);
        }

        boolean failed() {
            return failure != null;
        }
    }
}
