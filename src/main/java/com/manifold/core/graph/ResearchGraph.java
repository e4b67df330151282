package com.manifold.core.graph;

import com.manifold.core.nodes.BuildPlanNode;
import com.manifold.core.nodes.ClassifyQueryNode;
import com.manifold.core.nodes.DispatchWorkersNode;
import com.manifold.core.nodes.SynthesizeNode;
import com.manifold.core.state.ResearchState;
import org.bsc.langgraph4j.CompileConfig;
import org.bsc.langgraph4j.CompiledGraph;
import org.bsc.langgraph4j.StateGraph;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import static org.bsc.langgraph4j.StateGraph.END;
import static org.bsc.langgraph4j.StateGraph.START;
import static org.bsc.langgraph4j.action.AsyncNodeAction.node_async;

/**
 * Builds and holds the compiled LangGraph4j {@link StateGraph} of a research run.
 * <pre>
 *   START -> classify_query -> build_plan -> dispatch_workers -> synthesize -> END
 * </pre>
 * dispatch_workers is the barrier: it returns only when every worker is terminal or the run
 * deadline has elapsed.
 */
@Component
public class ResearchGraph {

    private static final Logger log = LoggerFactory.getLogger(ResearchGraph.class);

    private final CompiledGraph<ResearchState> compiledGraph;

    public ResearchGraph(ClassifyQueryNode classifyNode,
                         BuildPlanNode planNode,
                         DispatchWorkersNode dispatchNode,
                         SynthesizeNode synthesizeNode) throws Exception {

        var graph = new StateGraph<>(ResearchState.SCHEMA, ResearchState::new)
                .addNode("classify_query", node_async(classifyNode::apply))
                .addNode("build_plan", node_async(planNode::apply))
                .addNode("dispatch_workers", node_async(dispatchNode::apply))
                .addNode("synthesize", node_async(synthesizeNode::apply))
                .addEdge(START, "classify_query")
                .addEdge("classify_query", "build_plan")
                .addEdge("build_plan", "dispatch_workers")
                .addEdge("dispatch_workers", "synthesize")
                .addEdge("synthesize", END);

        this.compiledGraph = graph.compile(CompileConfig.builder().build());
        log.info("Research graph compiled");
    }

    public CompiledGraph<ResearchState> getCompiledGraph() {
        return compiledGraph;
    }
}
