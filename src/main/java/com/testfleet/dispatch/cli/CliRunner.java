package com.testfleet.dispatch.cli;

import com.testfleet.core.engine.ExitCodes;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.ExitCodeGenerator;
import org.springframework.stereotype.Component;
import picocli.CommandLine;
import picocli.CommandLine.IFactory;

/**
 * Bridges picocli with Spring Boot lifecycle.
 * Parses CLI arguments and delegates to the appropriate command; the command's
 * return value becomes the process exit code.
 */
@Component
public class CliRunner implements CommandLineRunner, ExitCodeGenerator {

    private static final Logger log = LoggerFactory.getLogger(CliRunner.class);

    private final TestfleetCommand testfleetCommand;
    private final IFactory factory;
    private int exitCode;

    public CliRunner(TestfleetCommand testfleetCommand, IFactory factory) {
        this.testfleetCommand = testfleetCommand;
        this.factory = factory;
    }

    @Override
    public void run(String... args) {
        exitCode = newCommandLine().execute(args);
    }

    CommandLine newCommandLine() {
        return new CommandLine(testfleetCommand, factory)
                .setExecutionExceptionHandler(CliRunner::handleCrash);
    }

    // Exit code 1 means "some phase failed"; a crash must not look like that.
    private static int handleCrash(Exception e, CommandLine commandLine, CommandLine.ParseResult parseResult) {
        log.error("Command {} failed", commandLine.getCommandName(), e);
        ConsoleOutput.error(e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName());
        return ExitCodes.ABORTED;
    }

    @Override
    public int getExitCode() {
        return exitCode;
    }
}
