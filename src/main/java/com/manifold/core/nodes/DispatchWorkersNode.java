package com.manifold.core.nodes;

import com.manifold.core.dispatch.ResearchDispatcher;
import com.manifold.core.model.ResearchPlan;
import com.manifold.core.model.RunStatus;
import com.manifold.core.model.TerminalStatus;
import com.manifold.core.state.ResearchState;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Fans the plan out to one worker per thread and records every terminal status.
 * Non-DONE statuses are also appended to the run's errors.
 */
@Component
public class DispatchWorkersNode {

    private final ResearchDispatcher dispatcher;

    public DispatchWorkersNode(ResearchDispatcher dispatcher) {
        this.dispatcher = dispatcher;
    }

    public Map<String, Object> apply(ResearchState state) {
        ResearchPlan plan = state.plan()
                .orElseThrow(() -> new IllegalStateException("No plan for run " + state.runId()));
        Map<String, TerminalStatus> statuses = dispatcher.dispatch(state.runId(), plan);

        var errors = new ArrayList<String>();
        statuses.forEach((threadId, status) -> {
            if (!status.isDone()) {
                errors.add("Thread " + threadId + ": " + status);
            }
        });
        return Map.of(
                "statuses", new LinkedHashMap<>(statuses),
                "errors", errors,
                "status", RunStatus.SYNTHESIZING.name()
        );
    }
}
