package com.testfleet.dispatch.cli;

import com.testfleet.core.health.HealthCheckService;
import com.testfleet.core.health.HealthStatus;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;

import java.util.concurrent.Callable;

/**
 * CLI command: testfleet health
 * <p>
 * Runs the preflight checks and exits non-zero if any component is down.
 */
@Command(name = "health", mixinStandardHelpOptions = true, description = "Check that a run can start")
@Component
public class HealthCommand implements Callable<Integer> {

    private final HealthCheckService healthCheckService;

    public HealthCommand(HealthCheckService healthCheckService) {
        this.healthCheckService = healthCheckService;
    }

    @Override
    public Integer call() {
        ConsoleOutput.printBanner();

        boolean anyDown = false;
        boolean anyDegraded = false;
        for (HealthStatus check : healthCheckService.checkAll()) {
            String label = check.component() + ": " + check.detail();
            switch (check.status()) {
                case UP -> ConsoleOutput.success(label);
                case DOWN -> {
                    ConsoleOutput.error(label);
                    anyDown = true;
                }
                case DEGRADED -> {
                    ConsoleOutput.warn(label);
                    anyDegraded = true;
                }
            }
        }

        System.out.println(ConsoleOutput.RULE);
        if (anyDown) {
            ConsoleOutput.error("Overall: a run cannot start");
            return 1;
        }
        if (anyDegraded) {
            ConsoleOutput.warn("Overall: a run can start, with warnings");
        } else {
            ConsoleOutput.success("Overall: ready to run");
        }
        return 0;
    }
}
