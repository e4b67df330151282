package com.manifold.dispatch.cli;

import com.manifold.core.health.HealthCheckService;
import com.manifold.core.health.HealthStatus;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;

import java.util.concurrent.Callable;

/**
 * CLI command: manifold health
 * <p>
 * Checks the graph, the run store and the capability bindings, and exits non-zero when any
 * component is down.
 */
@Command(name = "health", mixinStandardHelpOptions = true, description = "Check system health")
@Component
public class HealthCommand implements Callable<Integer> {

    private final HealthCheckService healthCheckService;

    public HealthCommand(@Autowired(required = false) HealthCheckService healthCheckService) {
        this.healthCheckService = healthCheckService;
    }

    @Override
    public Integer call() {
        ConsoleOutput.printBanner();

        if (healthCheckService == null) {
            ConsoleOutput.error("Health check service not available");
            return 1;
        }

        var checks = healthCheckService.checkAll();
        for (var check : checks) {
            String label = check.component() + ": " + check.detail();
            switch (check.status()) {
                case UP -> ConsoleOutput.success(label);
                case DEGRADED -> ConsoleOutput.warn(label);
                case DOWN -> ConsoleOutput.error(label);
            }
            check.metadata().forEach((k, v) -> System.out.println("    " + k + ": " + v));
        }

        System.out.println(ConsoleOutput.RULE);
        HealthStatus.Status overall = HealthStatus.overall(checks);
        switch (overall) {
            case UP -> ConsoleOutput.success("Overall: all systems operational");
            case DEGRADED -> ConsoleOutput.warn("Overall: degraded, unbound capabilities will be reported as gaps");
            case DOWN -> ConsoleOutput.error("Overall: one or more components down");
        }
        return overall == HealthStatus.Status.DOWN ? 1 : 0;
    }
}
