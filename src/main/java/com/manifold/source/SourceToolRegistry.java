package com.manifold.source;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Resolves capability names to {@link SourceTool} backends.
 * <p>
 * A capability with no bound backend resolves to a tool that always fails, so the
 * worker records the missing backend as a gap instead of crashing.
 */
public class SourceToolRegistry {

    private static final Logger log = LoggerFactory.getLogger(SourceToolRegistry.class);

    private final Map<String, SourceTool> tools = new LinkedHashMap<>();
    private final Map<String, String> fallback;

    public SourceToolRegistry(Collection<? extends SourceTool> tools, Map<String, String> fallback) {
        for (SourceTool tool : tools) {
            SourceTool previous = this.tools.put(tool.name(), tool);
            if (previous != null) {
                log.warn("Capability {} bound twice; {} replaces {}", tool.name(),
                        tool.getClass().getSimpleName(), previous.getClass().getSimpleName());
            }
        }
        this.fallback = fallback == null ? Map.of() : Map.copyOf(fallback);
        log.info("Source tools registered: {}", this.tools.keySet());
    }

    public SourceToolRegistry(List<? extends SourceTool> tools) {
        this(tools, Map.of());
    }

    public SourceTool resolve(String capability) {
        SourceTool tool = tools.get(capability);
        return tool != null ? tool : new UnboundSourceTool(capability);
    }

    public boolean isBound(String capability) {
        return tools.containsKey(capability);
    }

    public Set<String> capabilities() {
        return tools.keySet();
    }

    /**
     * Next capability to try after {@code capability} came up empty, or {@code null}
     * when the chain ends. Cycles in the configured chain are the caller's to bound.
     */
    public String fallbackFor(String capability) {
        return fallback.get(capability);
    }

    private record UnboundSourceTool(String name) implements SourceTool {
        @Override
        public ResultSet search(String query) throws SourceToolException {
            throw new SourceToolException(name, "No backend bound for capability '" + name + "'");
        }
    }
}
