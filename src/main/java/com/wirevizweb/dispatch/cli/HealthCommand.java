package com.wirevizweb.dispatch.cli;

import com.wirevizweb.core.health.HealthCheckService;
import com.wirevizweb.core.health.HealthStatus;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;

import java.util.List;
import java.util.concurrent.Callable;

/**
 * CLI command: wireviz-web health
 * <p>
 * Checks that the rendering engine can be found and the work root is usable.
 * Exits 1 when a component is DOWN (or nothing can be checked), so the
 * command works as a container health probe. DEGRADED still exits 0.
 */
@Command(name = "health", mixinStandardHelpOptions = true, description = "Check rendering engine and work root")
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

        List<HealthStatus> checks = healthCheckService.checkAll();
        boolean anyDown = false;
        boolean anyDegraded = false;

        for (HealthStatus check : checks) {
            String label = check.component() + ": " + check.detail();
            switch (check.status()) {
                case UP -> ConsoleOutput.success(label);
                case DEGRADED -> {
                    ConsoleOutput.info(label + " (degraded)");
                    anyDegraded = true;
                }
                case DOWN -> {
                    ConsoleOutput.error(label);
                    anyDown = true;
                }
            }
        }

        System.out.println("──────────────────────────────────");
        if (anyDown) {
            ConsoleOutput.error("Overall: DOWN, renders will fail");
            return 1;
        }
        if (anyDegraded) {
            ConsoleOutput.info("Overall: UP with warnings");
        } else {
            ConsoleOutput.success("Overall: UP");
        }
        return 0;
    }
}
