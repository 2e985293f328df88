package com.testfleet.dispatch.cli;

import com.testfleet.core.model.PhaseSpec;
import com.testfleet.core.model.ServiceSpec;
import com.testfleet.core.registry.PhasePlan;
import com.testfleet.core.registry.ServiceRegistry;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;

/**
 * CLI command: testfleet services
 * <p>
 * Prints the validated service registry and phase plan without starting anything.
 */
@Command(name = "services", mixinStandardHelpOptions = true,
        description = "List the configured services and phases")
@Component
public class ServicesCommand implements Runnable {

    private final ServiceRegistry registry;
    private final PhasePlan plan;

    public ServicesCommand(ServiceRegistry registry, PhasePlan plan) {
        this.registry = registry;
        this.plan = plan;
    }

    @Override
    public void run() {
        ConsoleOutput.printBanner();

        System.out.println("SERVICES (" + registry.size() + "):");
        for (ServiceSpec spec : registry.specs()) {
            System.out.printf("  %-10s %-45s restart=%-6s ports=%s%n",
                    spec.name(), spec.image(), spec.restartPolicy().name().toLowerCase(), spec.ports());
            var readiness = spec.readiness();
            String probe = switch (readiness.type()) {
                case TCP -> "tcp port " + readiness.port();
                case EXEC -> "exec " + String.join(" ", readiness.command());
                case NONE -> "none";
            };
            System.out.printf("  %-10s readiness: %s (every %ss, %d attempts)%n",
                    "", probe, readiness.interval().toSeconds(), readiness.maxAttempts());
        }

        System.out.println();
        System.out.println("PHASES (" + plan.phases().size() + "):");
        int index = 1;
        for (PhaseSpec phase : plan.phases()) {
            System.out.printf("  %d. %-12s%s%s%s%n", index++, phase.name(),
                    phase.filterExpression().map(f -> " filter=" + f).orElse(""),
                    phase.producesCoverage() ? " coverage=" + phase.coverageArtifact() : "",
                    phase.blocking() ? " blocking" : "");
            for (String command : phase.commands()) {
                System.out.println("       $ " + command);
            }
        }
    }
}
