package com.manifold.core.health;

import com.manifold.core.graph.ResearchGraph;
import com.manifold.core.store.RunStore;
import com.manifold.source.CapabilityProperties;
import com.manifold.source.SourceToolRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;

@Service
public class HealthCheckService {

    private static final Logger log = LoggerFactory.getLogger(HealthCheckService.class);

    private final ResearchGraph researchGraph;
    private final RunStore runStore;
    private final SourceToolRegistry toolRegistry;
    private final CapabilityProperties capabilities;

    public HealthCheckService(
            @Autowired(required = false) ResearchGraph researchGraph,
            @Autowired(required = false) RunStore runStore,
            @Autowired(required = false) SourceToolRegistry toolRegistry,
            @Autowired(required = false) CapabilityProperties capabilities) {
        this.researchGraph = researchGraph;
        this.runStore = runStore;
        this.toolRegistry = toolRegistry;
        this.capabilities = capabilities;
    }

    public List<HealthStatus> checkAll() {
        var results = new ArrayList<HealthStatus>();
        results.add(checkGraph());
        results.add(checkStore());
        results.add(checkCapabilities());
        return results;
    }

    private HealthStatus checkGraph() {
        if (researchGraph != null) {
            return HealthStatus.up("graph", "Graph compiled and available");
        }
        return HealthStatus.down("graph", "Graph not available");
    }

    private HealthStatus checkStore() {
        if (runStore == null) {
            return HealthStatus.down("store", "No run store configured");
        }
        try {
            int runs = runStore.listRunIds().size();
            return new HealthStatus("store", HealthStatus.Status.UP,
                    runStore.describe(), Map.of("runs", String.valueOf(runs)));
        } catch (RuntimeException e) {
            log.warn("Run store health check failed: {}", e.getMessage());
            return HealthStatus.down("store", "Store error: " + e.getMessage());
        }
    }

    /**
     * UP when every routed capability has a backend, DEGRADED when some do (workers record the
     * unbound ones as gaps), DOWN when none do.
     */
    private HealthStatus checkCapabilities() {
        if (toolRegistry == null || capabilities == null) {
            return HealthStatus.down("capabilities", "No source tool registry configured");
        }
        var routed = new LinkedHashSet<>(capabilities.getRouting().values());
        var metadata = new LinkedHashMap<String, String>();
        int bound = 0;
        for (String capability : routed) {
            boolean isBound = toolRegistry.isBound(capability);
            metadata.put(capability, isBound ? "bound" : "unbound");
            if (isBound) {
                bound++;
            }
        }
        return new HealthStatus("capabilities", HealthStatus.ofCoverage(bound, routed.size()),
                bound + " of " + routed.size() + " routed capabilities bound", metadata);
    }
}
