package com.manifold.core.nodes;

import com.manifold.core.events.EventBus;
import com.manifold.core.events.ResearchEvent;
import com.manifold.core.model.FinalOutput;
import com.manifold.core.model.ResearchPlan;
import com.manifold.core.model.RunStatus;
import com.manifold.core.state.ResearchState;
import com.manifold.core.store.RunStore;
import com.manifold.core.synthesis.Synthesizer;
import org.springframework.stereotype.Component;

import java.util.Map;

/**
 * Synthesizes the final output once every worker is terminal and writes it as the run's last artifact.
 */
@Component
public class SynthesizeNode {

    private final Synthesizer synthesizer;
    private final RunStore store;
    private final EventBus eventBus;

    public SynthesizeNode(Synthesizer synthesizer, RunStore store, EventBus eventBus) {
        this.synthesizer = synthesizer;
        this.store = store;
        this.eventBus = eventBus;
    }

    public Map<String, Object> apply(ResearchState state) {
        ResearchPlan plan = state.plan()
                .orElseThrow(() -> new IllegalStateException("No plan for run " + state.runId()));
        FinalOutput output = synthesizer.synthesize(plan, state.statuses());
        store.writeFinalOutput(output);
        eventBus.publish(ResearchEvent.outputWritten(output));
        return Map.of(
                "finalOutput", output,
                "status", RunStatus.COMPLETED.name()
        );
    }
}
