package com.manifold.core.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Service;

import java.time.Duration;

/**
 * Centralised Micrometer metrics for research runs.
 */
@Service
public class ResearchMetrics {

    private final MeterRegistry registry;

    public ResearchMetrics(MeterRegistry registry) {
        this.registry = registry;
    }

    public void recordClassification(String complexity, int workerCount) {
        Counter.builder("manifold.classifications.total")
                .tag("complexity", complexity)
                .register(registry)
                .increment();
        DistributionSummary.builder("manifold.plan.worker_count")
                .register(registry)
                .record(workerCount);
    }

    public void recordWorkerExecution(String capability, long ms) {
        Timer.builder("manifold.worker.duration")
                .tag("capability", capability)
                .register(registry)
                .record(Duration.ofMillis(ms));
    }

    public void recordWorkerTerminal(String kind) {
        Counter.builder("manifold.worker.terminal")
                .tag("status", kind)
                .register(registry)
                .increment();
    }

    public void recordDeepeningRounds(int rounds) {
        DistributionSummary.builder("manifold.worker.deepening_rounds")
                .register(registry)
                .record(rounds);
    }

    public void recordCapabilityFailure(String capability) {
        Counter.builder("manifold.capability.failures")
                .tag("capability", capability)
                .register(registry)
                .increment();
    }

    /**
     * Records the synthesis outcome for one run.
     *
     * @param format    "BRIEF" or "REPORT"
     * @param conflicts number of conflicting topics flagged
     * @param missing   number of threads without a finding
     */
    public void recordSynthesis(String format, int conflicts, int missing) {
        Counter.builder("manifold.synthesis.total")
                .tag("format", format)
                .register(registry)
                .increment();
        DistributionSummary.builder("manifold.synthesis.conflicts")
                .register(registry)
                .record(conflicts);
        DistributionSummary.builder("manifold.synthesis.missing_threads")
                .register(registry)
                .record(missing);
    }

    public void recordRunResult(String status) {
        Counter.builder("manifold.runs.total")
                .tag("status", status)
                .register(registry)
                .increment();
    }
}
