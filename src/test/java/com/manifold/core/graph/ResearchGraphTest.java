package com.manifold.core.graph;

import com.manifold.core.model.RunStatus;
import com.manifold.core.model.TerminalStatus;
import com.manifold.core.nodes.BuildPlanNode;
import com.manifold.core.nodes.ClassifyQueryNode;
import com.manifold.core.nodes.DispatchWorkersNode;
import com.manifold.core.nodes.SynthesizeNode;
import com.manifold.core.state.ResearchState;
import org.bsc.langgraph4j.RunnableConfig;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.mockito.InOrder;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.inOrder;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class ResearchGraphTest {

    private final ClassifyQueryNode classify = mock(ClassifyQueryNode.class);
    private final BuildPlanNode plan = mock(BuildPlanNode.class);
    private final DispatchWorkersNode dispatch = mock(DispatchWorkersNode.class);
    private final SynthesizeNode synthesize = mock(SynthesizeNode.class);

    @Test
    @DisplayName("runs classify, plan, dispatch and synthesize exactly once, in that order")
    void linearPipeline() throws Exception {
        when(classify.apply(any())).thenReturn(Map.of("status", RunStatus.PLANNING.name()));
        when(plan.apply(any())).thenReturn(Map.of("status", RunStatus.DISPATCHING.name()));
        when(dispatch.apply(any())).thenReturn(Map.of(
                "status", RunStatus.SYNTHESIZING.name(),
                "statuses", Map.of("t1-a", TerminalStatus.failed("boom")),
                "errors", List.of("Thread t1-a: FAILED(boom)")));
        when(synthesize.apply(any())).thenReturn(Map.of("status", RunStatus.COMPLETED.name()));

        var graph = new ResearchGraph(classify, plan, dispatch, synthesize);
        ResearchState state = graph.getCompiledGraph()
                .invoke(Map.of("runId", "R-1", "query", "q"), RunnableConfig.builder().threadId("R-1").build())
                .orElseThrow();

        InOrder order = inOrder(classify, plan, dispatch, synthesize);
        order.verify(classify).apply(any());
        order.verify(plan).apply(any());
        order.verify(dispatch).apply(any());
        order.verify(synthesize).apply(any());
        assertEquals(RunStatus.COMPLETED, state.status());
        assertEquals(List.of("Thread t1-a: FAILED(boom)"), state.errors());
        assertEquals(TerminalStatus.failed("boom"), state.statuses().get("t1-a"));
    }

    @Test
    @DisplayName("a failing classification stops the graph before planning")
    void classificationFailureStops() throws Exception {
        when(classify.apply(any())).thenThrow(new IllegalArgumentException("bad query"));

        var graph = new ResearchGraph(classify, plan, dispatch, synthesize);

        assertThrows(RuntimeException.class, () -> graph.getCompiledGraph()
                .invoke(Map.of("runId", "R-1", "query", ""), RunnableConfig.builder().threadId("R-1").build()));
        verify(plan, never()).apply(any());
    }
}
