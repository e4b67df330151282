package com.manifold.core.engine;

import com.manifold.core.classify.ClassificationException;
import com.manifold.core.events.EventBus;
import com.manifold.core.events.ResearchEvent;
import com.manifold.core.graph.ResearchGraph;
import com.manifold.core.logging.MdcContext;
import com.manifold.core.metrics.ResearchMetrics;
import com.manifold.core.model.RunStatus;
import com.manifold.core.state.ResearchState;
import com.manifold.core.store.StorageException;
import org.bsc.langgraph4j.RunnableConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.util.HashMap;
import java.util.Map;
import java.util.concurrent.ThreadLocalRandom;

/**
 * Runs research queries through the {@link ResearchGraph}.
 * <p>
 * Classification and storage failures reach the caller as {@link ClassificationException} and
 * {@link StorageException}, unwrapped from the graph's execution wrappers. Every other
 * failure stays inside its thread and still yields a final output.
 */
@Service
public class ResearchEngine {

    private static final Logger log = LoggerFactory.getLogger(ResearchEngine.class);
    private static final DateTimeFormatter RUN_ID_TIME = DateTimeFormatter.ofPattern("yyyyMMdd-HHmmss");

    private final ResearchGraph researchGraph;
    private final EventBus eventBus;
    private final ResearchMetrics metrics;

    public ResearchEngine(ResearchGraph researchGraph, EventBus eventBus, ResearchMetrics metrics) {
        this.researchGraph = researchGraph;
        this.eventBus = eventBus;
        this.metrics = metrics;
    }

    /**
     * Runs a query under a newly generated run id.
     */
    public ResearchState research(String query) {
        return research(generateRunId(), query);
    }

    /**
     * Runs the full pipeline for a query.
     *
     * @param runId run id; names the run's namespace in the store
     * @param query the research question
     * @return final graph state, holding the plan, terminal statuses and final output
     * @throws ClassificationException when the query is empty or malformed
     * @throws StorageException        when an artifact could not be persisted
     */
    public ResearchState research(String runId, String query) {
        MdcContext.setRun(runId);
        try {
            log.info("Starting run {}: {}", runId, query);
            eventBus.publish(ResearchEvent.of(ResearchEvent.RUN_CREATED, runId, null,
                    Map.of("query", query == null ? "" : query)));

            var stateMap = new HashMap<String, Object>();
            stateMap.put("runId", runId);
            stateMap.put("query", query == null ? "" : query);
            stateMap.put("status", RunStatus.CLASSIFYING.name());

            var config = RunnableConfig.builder()
                    .threadId(runId)
                    .build();

            ResearchState state;
            try {
                state = researchGraph.getCompiledGraph()
                        .invoke(Map.copyOf(stateMap), config)
                        .orElseThrow(() -> new IllegalStateException("Graph execution returned empty state for run " + runId));
            } catch (RuntimeException e) {
                RuntimeException cause = unwrap(e);
                log.error("Run {} failed: {}", runId, cause.getMessage());
                metrics.recordRunResult(RunStatus.FAILED.name());
                eventBus.publish(ResearchEvent.of(ResearchEvent.RUN_FAILED, runId, null,
                        Map.of("error", String.valueOf(cause.getMessage()),
                               "type", cause.getClass().getSimpleName())));
                throw cause;
            }

            metrics.recordRunResult(state.status().name());
            eventBus.publish(ResearchEvent.of(ResearchEvent.RUN_COMPLETED, runId, null,
                    Map.of("status", state.status().name(),
                           "format", state.finalOutput().map(o -> o.format().name()).orElse("NONE"))));
            log.info("Run {} finished with status {}", runId, state.status());
            return state;
        } finally {
            MdcContext.clear();
        }
    }

    /**
     * Finds the fatal cause inside the graph's wrappers, or returns the exception itself.
     */
    static RuntimeException unwrap(RuntimeException e) {
        Throwable current = e;
        while (current != null) {
            if (current instanceof ClassificationException || current instanceof StorageException) {
                return (RuntimeException) current;
            }
            if (current.getCause() == current) {
                break;
            }
            current = current.getCause();
        }
        return e;
    }

    /**
     * Generates a sortable, collision-resistant run id such as {@code 20260101-120000-3fa2}.
     */
    public String generateRunId() {
        String time = ZonedDateTime.now(ZoneOffset.UTC).format(RUN_ID_TIME);
        return String.format("%s-%04x", time, ThreadLocalRandom.current().nextInt(0x10000));
    }
}
