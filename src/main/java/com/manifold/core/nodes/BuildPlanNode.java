package com.manifold.core.nodes;

import com.manifold.core.events.EventBus;
import com.manifold.core.events.ResearchEvent;
import com.manifold.core.model.Classification;
import com.manifold.core.model.ResearchPlan;
import com.manifold.core.model.RunStatus;
import com.manifold.core.plan.PlanBuilder;
import com.manifold.core.state.ResearchState;
import com.manifold.core.store.RunStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.Map;

/**
 * Builds the thread plan and writes it to the run store before any worker starts.
 */
@Component
public class BuildPlanNode {

    private static final Logger log = LoggerFactory.getLogger(BuildPlanNode.class);

    private final PlanBuilder planBuilder;
    private final RunStore store;
    private final EventBus eventBus;

    public BuildPlanNode(PlanBuilder planBuilder, RunStore store, EventBus eventBus) {
        this.planBuilder = planBuilder;
        this.store = store;
        this.eventBus = eventBus;
    }

    public Map<String, Object> apply(ResearchState state) {
        Classification classification = state.classification()
                .orElseThrow(() -> new IllegalStateException("No classification for run " + state.runId()));
        ResearchPlan plan = planBuilder.build(state.runId(), state.query(), classification);
        store.writePlan(plan);
        log.info("Plan written with threads {}", plan.threadIds());
        eventBus.publish(ResearchEvent.planWritten(plan));
        return Map.of(
                "plan", plan,
                "status", RunStatus.DISPATCHING.name()
        );
    }
}
