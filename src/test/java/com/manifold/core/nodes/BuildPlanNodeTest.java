package com.manifold.core.nodes;

import com.manifold.core.events.EventBus;
import com.manifold.core.events.ResearchEvent;
import com.manifold.core.model.Classification;
import com.manifold.core.model.Complexity;
import com.manifold.core.model.OutputFormat;
import com.manifold.core.model.QueryType;
import com.manifold.core.model.ResearchPlan;
import com.manifold.core.model.RunStatus;
import com.manifold.core.plan.CapabilitySelector;
import com.manifold.core.plan.PlanBuilder;
import com.manifold.core.state.ResearchState;
import com.manifold.core.store.InMemoryRunStore;
import com.manifold.source.CapabilityProperties;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class BuildPlanNodeTest {

    @Test
    @DisplayName("writes the plan before dispatch and announces its threads")
    void writesPlan() {
        var store = new InMemoryRunStore();
        var eventBus = new EventBus();
        var events = new ArrayList<ResearchEvent>();
        eventBus.subscribe("R-1", events::add);
        var node = new BuildPlanNode(new PlanBuilder(new CapabilitySelector(new CapabilityProperties())), store, eventBus);
        var classification = new Classification(QueryType.TECHNICAL, Complexity.MODERATE, 3, OutputFormat.REPORT, List.of());
        var state = new ResearchState(Map.of("runId", "R-1", "query", "Kafka vs Pulsar vs RabbitMQ",
                "classification", classification));

        Map<String, Object> result = node.apply(state);

        ResearchPlan plan = (ResearchPlan) result.get("plan");
        assertEquals(plan, store.readPlan("R-1").orElseThrow());
        assertEquals(3, plan.threads().size());
        assertEquals(RunStatus.DISPATCHING.name(), result.get("status"));
        assertEquals(1, events.size());
        assertEquals(ResearchEvent.PLAN_WRITTEN, events.get(0).eventType());
        assertEquals(plan.threadIds(), events.get(0).payload().get("threads"));
    }

    @Test
    @DisplayName("fails without a classification")
    void requiresClassification() {
        var node = new BuildPlanNode(new PlanBuilder(new CapabilitySelector(new CapabilityProperties())),
                new InMemoryRunStore(), new EventBus());
        var state = new ResearchState(Map.of("runId", "R-1", "query", "q"));

        assertThrows(IllegalStateException.class, () -> node.apply(state));
    }
}
