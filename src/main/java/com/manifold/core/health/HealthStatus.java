package com.manifold.core.health;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Health of one component (graph, store, capabilities), with optional per-item metadata
 * such as the binding state of each capability.
 */
public record HealthStatus(
    String component,
    Status status,
    String detail,
    Map<String, String> metadata
) {
    /** Ordered from best to worst. */
    public enum Status { UP, DEGRADED, DOWN }

    public HealthStatus {
        Objects.requireNonNull(component, "component");
        Objects.requireNonNull(status, "status");
        metadata = metadata == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(metadata));
    }

    public static HealthStatus up(String component, String detail) {
        return new HealthStatus(component, Status.UP, detail, Map.of());
    }

    public static HealthStatus down(String component, String detail) {
        return new HealthStatus(component, Status.DOWN, detail, Map.of());
    }

    /**
     * UP when every item is available, DOWN when none is, DEGRADED in between.
     */
    public static Status ofCoverage(int available, int total) {
        if (available >= total) {
            return Status.UP;
        }
        return available == 0 ? Status.DOWN : Status.DEGRADED;
    }

    /** The worst status among the given components; UP for an empty list. */
    public static Status overall(List<HealthStatus> checks) {
        Status worst = Status.UP;
        for (HealthStatus check : checks) {
            if (check.status().compareTo(worst) > 0) {
                worst = check.status();
            }
        }
        return worst;
    }
}
