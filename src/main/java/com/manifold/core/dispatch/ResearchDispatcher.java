package com.manifold.core.dispatch;

import com.manifold.core.config.ResearchProperties;
import com.manifold.core.events.EventBus;
import com.manifold.core.events.ResearchEvent;
import com.manifold.core.logging.MdcContext;
import com.manifold.core.metrics.ResearchMetrics;
import com.manifold.core.model.ResearchPlan;
import com.manifold.core.model.TerminalStatus;
import com.manifold.core.model.ThreadSpec;
import com.manifold.core.store.StorageException;
import com.manifold.core.worker.ResearchWorker;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorCompletionService;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Launches exactly one {@link ResearchWorker} per thread of a plan and waits for all of them.
 * <p>
 * Workers run on a fixed pool with one platform thread per plan thread, so every worker starts
 * immediately and the deadline measures research time only. Workers share nothing but the run store. A worker
 * that throws is reported {@code FAILED} without affecting its siblings; workers still running
 * when the run deadline fires are interrupted and reported {@code TIMED_OUT}. Only a
 * {@link StorageException} stops the fan-out early; it is rethrown to the caller.
 */
@Component
public class ResearchDispatcher {

    private static final Logger log = LoggerFactory.getLogger(ResearchDispatcher.class);

    private final ResearchWorker worker;
    private final long deadlineMs;
    private final EventBus eventBus;
    private final ResearchMetrics metrics;

    @Autowired
    public ResearchDispatcher(ResearchWorker worker, ResearchProperties properties, EventBus eventBus,
                              @Autowired(required = false) ResearchMetrics metrics) {
        this(worker, TimeUnit.SECONDS.toMillis(properties.getDeadlineSeconds()), eventBus, metrics);
    }

    ResearchDispatcher(ResearchWorker worker, long deadlineMs, EventBus eventBus, ResearchMetrics metrics) {
        this.worker = worker;
        this.deadlineMs = deadlineMs;
        this.eventBus = eventBus;
        this.metrics = metrics;
    }

    /**
     * Runs every thread of the plan and returns once all are terminal or the deadline elapsed.
     *
     * @return terminal status per thread id, in plan order
     * @throws StorageException when any worker could not persist its finding
     */
    public Map<String, TerminalStatus> dispatch(String runId, ResearchPlan plan) {
        var threads = plan.threads();
        var statuses = new LinkedHashMap<String, TerminalStatus>();
        if (threads.isEmpty()) {
            return statuses;
        }

        ExecutorService executor = Executors.newFixedThreadPool(threads.size(), workerThreadFactory(runId));
        var completion = new ExecutorCompletionService<String>(executor);
        var futures = new LinkedHashMap<String, Future<String>>();
        var byFuture = new HashMap<Future<String>, String>();
        var results = new HashMap<String, TerminalStatus>();

        log.info("Dispatching {} workers for run {} (deadline {} ms)", threads.size(), runId, deadlineMs);
        try {
            for (ThreadSpec thread : threads) {
                eventBus.publish(ResearchEvent.of(ResearchEvent.WORKER_STARTED, runId, thread.id(),
                        Map.of("focus", thread.focus(), "capability", thread.primaryCapability())));
                Future<String> future = completion.submit(MdcContext.wrap(() -> {
                    worker.research(runId, thread);
                    return thread.id();
                }));
                futures.put(thread.id(), future);
                byFuture.put(future, thread.id());
            }

            long deadline = System.currentTimeMillis() + deadlineMs;
            int pending = threads.size();
            try {
                while (pending > 0) {
                    long remaining = deadline - System.currentTimeMillis();
                    Future<String> done = remaining > 0 ? completion.poll(remaining, TimeUnit.MILLISECONDS) : null;
                    if (done == null) {
                        log.warn("Run {} deadline reached with {} worker(s) still running", runId, pending);
                        break;
                    }
                    pending--;
                    String threadId = byFuture.get(done);
                    TerminalStatus status = terminalStatusOf(done, threadId);
                    results.put(threadId, status);
                    report(runId, threadId, status);
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                log.warn("Dispatch for run {} interrupted", runId);
            }

            for (ThreadSpec thread : threads) {
                if (!results.containsKey(thread.id())) {
                    TerminalStatus status = settleAfterDeadline(futures.get(thread.id()), thread.id(), deadlineMs);
                    results.put(thread.id(), status);
                    report(runId, thread.id(), status);
                }
            }
        } catch (StorageException e) {
            log.error("Storage failure in run {}; cancelling remaining workers", runId, e);
            futures.values().forEach(f -> f.cancel(true));
            throw e;
        } finally {
            executor.shutdownNow();
        }

        for (ThreadSpec thread : threads) {
            statuses.put(thread.id(), results.get(thread.id()));
        }
        return statuses;
    }

    /**
     * Resolves a worker the deadline loop never collected. A worker that completed after the
     * last poll keeps its real outcome, since its finding may already be in the store.
     */
    static TerminalStatus settleAfterDeadline(Future<String> future, String threadId, long deadlineMs) {
        if (future.cancel(true) || !future.isDone()) {
            return TerminalStatus.timedOut("deadline of " + deadlineMs + " ms elapsed");
        }
        try {
            return terminalStatusOf(future, threadId);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return TerminalStatus.timedOut("interrupted");
        }
    }

    private static TerminalStatus terminalStatusOf(Future<String> future, String threadId)
            throws InterruptedException {
        try {
            future.get();
            return TerminalStatus.done();
        } catch (CancellationException e) {
            return TerminalStatus.timedOut("cancelled");
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof StorageException storage) {
                throw storage;
            }
            if (cause instanceof InterruptedException) {
                return TerminalStatus.timedOut("interrupted");
            }
            log.warn("Worker {} failed: {}", threadId, cause.toString());
            return TerminalStatus.failed(cause.getMessage() != null ? cause.getMessage() : cause.getClass().getSimpleName());
        }
    }

    private void report(String runId, String threadId, TerminalStatus status) {
        log.info("Thread {} terminal: {}", threadId, status);
        if (metrics != null) {
            metrics.recordWorkerTerminal(status.kind().name());
        }
        var payload = new LinkedHashMap<String, Object>();
        payload.put("status", status.kind().name());
        if (status.reason() != null) {
            payload.put("reason", status.reason());
        }
        eventBus.publish(ResearchEvent.of(ResearchEvent.WORKER_TERMINAL, runId, threadId, payload));
    }

    private static ThreadFactory workerThreadFactory(String runId) {
        var counter = new AtomicInteger();
        return r -> {
            Thread t = new Thread(r, "research-" + runId + "-" + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        };
    }
}
