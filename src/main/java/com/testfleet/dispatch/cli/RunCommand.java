package com.testfleet.dispatch.cli;

import com.testfleet.core.engine.ExitCodes;
import com.testfleet.core.engine.PipelineOrchestrator;
import com.testfleet.core.events.EventBus;
import com.testfleet.core.model.PipelineRun;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

import java.time.Duration;
import java.util.concurrent.Callable;

/**
 * CLI command: testfleet run
 * <p>
 * Executes one full pipeline run: resolve the build identity, provision the
 * services, run every phase, tear down and report. Ctrl-C requests an abort;
 * the phase in flight finishes and the services are still torn down.
 * <p>
 * Exit codes: 0 success, 1 some phase failed, 3 aborted, 4 tests passed but
 * the result could not be reported.
 */
@Command(name = "run", mixinStandardHelpOptions = true,
        description = "Provision the services, run all phases and report the result")
@Component
public class RunCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(RunCommand.class);
    private static final Duration SHUTDOWN_WAIT = Duration.ofMinutes(5);

    @Option(names = {"--quiet", "-q"}, description = "Only print the final summary")
    private boolean quiet;

    private final ObjectProvider<PipelineOrchestrator> orchestrators;
    private final EventBus eventBus;

    public RunCommand(ObjectProvider<PipelineOrchestrator> orchestrators, EventBus eventBus) {
        this.orchestrators = orchestrators;
        this.eventBus = eventBus;
    }

    @Override
    public Integer call() {
        ConsoleOutput.printBanner();

        var orchestrator = orchestrators.getObject();
        String runId = orchestrator.run().runId();
        ConsoleOutput.info("Run " + runId);

        EventBus.Subscription subscription = quiet ? null : eventBus.subscribe(runId, ConsoleOutput::event);
        Thread shutdownHook = new Thread(() -> abortAndWait(orchestrator), "testfleet-abort");
        Runtime.getRuntime().addShutdownHook(shutdownHook);

        PipelineRun run;
        try {
            run = orchestrator.execute();
        } finally {
            if (subscription != null) {
                subscription.unsubscribe();
            }
            removeHook(shutdownHook);
        }

        ConsoleOutput.summary(run);
        return ExitCodes.of(run);
    }

    private static void abortAndWait(PipelineOrchestrator orchestrator) {
        orchestrator.requestAbort("interrupted by signal");
        try {
            if (!orchestrator.awaitCompletion(SHUTDOWN_WAIT)) {
                log.error("Run {} did not finish within {}; containers may be left running",
                        orchestrator.run().runId(), SHUTDOWN_WAIT);
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    private static void removeHook(Thread hook) {
        try {
            Runtime.getRuntime().removeShutdownHook(hook);
        } catch (IllegalStateException e) {
            log.debug("JVM already shutting down, abort hook stays registered");
        }
    }
}
