package com.manifold.core.logging;

import org.slf4j.MDC;

import java.util.Map;
import java.util.concurrent.Callable;

/**
 * Utility for managing Manifold-specific MDC keys for structured logging.
 */
public final class MdcContext {

    private MdcContext() {}

    public static void setRun(String runId) {
        MDC.put("runId", runId);
    }

    public static void setThread(String runId, String threadId) {
        MDC.put("runId", runId);
        MDC.put("threadId", threadId);
    }

    public static void setCapability(String capability) {
        MDC.put("capability", capability);
    }

    public static void clear() {
        MDC.remove("runId");
        MDC.remove("threadId");
        MDC.remove("capability");
    }

    /**
     * Wraps a task so it runs with the caller's MDC context on whichever pool thread picks it up.
     */
    public static <T> Callable<T> wrap(Callable<T> task) {
        Map<String, String> parent = MDC.getCopyOfContextMap();
        return () -> {
            Map<String, String> previous = MDC.getCopyOfContextMap();
            if (parent != null) {
                MDC.setContextMap(parent);
            } else {
                MDC.clear();
            }
            try {
                return task.call();
            } finally {
                if (previous != null) {
                    MDC.setContextMap(previous);
                } else {
                    MDC.clear();
                }
            }
        };
    }
}
