package com.testfleet.dispatch.cli;

import org.springframework.stereotype.Component;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Spec;

/**
 * Top-level CLI command for testfleet.
 * Routes to subcommands: run, services, identity, health.
 */
@Command(
        name = "testfleet",
        mixinStandardHelpOptions = true,
        version = "testfleet 0.1.0",
        description = "Provisions database backends and runs phased test suites against them",
        subcommands = {
                RunCommand.class,
                ServicesCommand.class,
                IdentityCommand.class,
                HealthCommand.class,
                CommandLine.HelpCommand.class
        }
)
@Component
public class TestfleetCommand implements Runnable {

    @Spec
    private CommandSpec spec;

    @Override
    public void run() {
        ConsoleOutput.printBanner();
        // When no subcommand is given, show usage help
        spec.commandLine().usage(System.out);
    }
}
