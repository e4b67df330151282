package com.manifold.core.state;

import com.manifold.core.model.Classification;
import com.manifold.core.model.FinalOutput;
import com.manifold.core.model.ResearchPlan;
import com.manifold.core.model.RunStatus;
import com.manifold.core.model.TerminalStatus;
import org.bsc.langgraph4j.state.AgentState;
import org.bsc.langgraph4j.state.Channel;
import org.bsc.langgraph4j.state.Channels;
import org.bsc.langgraph4j.state.Reducer;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Supplier;

/**
 * Graph state of one research run.
 * <p>
 * Holds only the small curated artifacts (classification, plan, terminal statuses, final
 * output); raw search results never enter the state.
 */
public class ResearchState extends AgentState {

    public static final Map<String, Channel<?>> SCHEMA = Map.ofEntries(
        Map.entry("runId",          Channels.base(() -> "")),
        Map.entry("query",          Channels.base(() -> "")),
        Map.entry("status",         Channels.base(() -> RunStatus.CLASSIFYING.name())),
        Map.entry("classification", Channels.base((Reducer<Classification>) null)),
        Map.entry("plan",           Channels.base((Reducer<ResearchPlan>) null)),
        Map.entry("statuses",       Channels.base((Supplier<Map<String, TerminalStatus>>) LinkedHashMap::new)),
        Map.entry("finalOutput",    Channels.base((Reducer<FinalOutput>) null)),
        Map.entry("errors",         Channels.appender(ArrayList::new))
    );

    public ResearchState(Map<String, Object> initData) {
        super(initData);
    }

    public String runId() {
        return this.<String>value("runId").orElse("");
    }

    public String query() {
        return this.<String>value("query").orElse("");
    }

    public RunStatus status() {
        String raw = this.<String>value("status").orElse(RunStatus.CLASSIFYING.name());
        return RunStatus.valueOf(raw);
    }

    public Optional<Classification> classification() {
        return this.value("classification");
    }

    public Optional<ResearchPlan> plan() {
        return this.value("plan");
    }

    public Map<String, TerminalStatus> statuses() {
        return this.<Map<String, TerminalStatus>>value("statuses").orElse(Map.of());
    }

    public Optional<FinalOutput> finalOutput() {
        return this.value("finalOutput");
    }

    public List<String> errors() {
        return this.<List<String>>value("errors").orElse(List.of());
    }
}
