package com.testfleet.core.engine;

import com.testfleet.core.events.EventBus;
import com.testfleet.core.events.PipelineEvent;
import com.testfleet.core.identity.BuildIdentityResolver;
import com.testfleet.core.identity.IdentityException;
import com.testfleet.core.logging.MdcContext;
import com.testfleet.core.metrics.PipelineMetrics;
import com.testfleet.core.model.BuildIdentity;
import com.testfleet.core.model.BuildNumberSource;
import com.testfleet.core.model.FinalizationOutcome;
import com.testfleet.core.model.OverallStatus;
import com.testfleet.core.model.PhaseResult;
import com.testfleet.core.model.PhaseSpec;
import com.testfleet.core.model.PhaseStatus;
import com.testfleet.core.model.PipelineRun;
import com.testfleet.core.model.PipelineState;
import com.testfleet.core.model.ServiceInstance;
import com.testfleet.core.registry.PhasePlan;
import com.testfleet.core.registry.ServiceRegistry;
import com.testfleet.phase.PhaseRunner;
import com.testfleet.report.FinalizationException;
import com.testfleet.report.ResultFinalizer;
import com.testfleet.report.RunReportWriter;
import com.testfleet.supervisor.ProvisionException;
import com.testfleet.supervisor.ServiceSupervisor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Drives one pipeline run through its states:
 * <pre>
 * IDLE -> RESOLVING_IDENTITY -> PROVISIONING -> RUNNING_PHASES -> TEARING_DOWN -> FINALIZING -> COMPLETED
 *                  |                  |                                                  |
 *                  +------------------+--------------------> ABORTED <-------------------+
 * </pre>
 *
 * <p>Guarantees:
 * <ul>
 *   <li>Services are torn down whenever provisioning succeeded, whatever the phases did.</li>
 *   <li>A failed phase does not stop later phases unless it is declared blocking.</li>
 *   <li>The reporting service is called exactly once when the phases were reached, and never
 *       when the run aborted before that (no identity, no services).</li>
 *   <li>A reporting failure changes the terminal state, never the overall test status.</li>
 * </ul>
 *
 * <p>An instance runs once. Create a new one per run.
 */
public class PipelineOrchestrator {

    private static final Logger log = LoggerFactory.getLogger(PipelineOrchestrator.class);
    private static final AtomicInteger RUN_COUNTER = new AtomicInteger(0);
    private static final DateTimeFormatter RUN_ID_TIME =
            DateTimeFormatter.ofPattern("yyyyMMdd-HHmmss").withZone(ZoneOffset.UTC);

    private final BuildIdentityResolver identityResolver;
    private final ServiceRegistry registry;
    private final PhasePlan plan;
    private final ServiceSupervisor supervisor;
    private final PhaseRunner phaseRunner;
    private final PhaseEnvironment environment;
    private final ResultFinalizer finalizer;
    private final RunReportWriter reportWriter;
    private final BuildNumberSource buildNumberSource;
    private final EventBus eventBus;
    private final PipelineMetrics metrics;

    private final PipelineRun run;
    private final AtomicBoolean started = new AtomicBoolean(false);
    private final AtomicBoolean abortRequested = new AtomicBoolean(false);
    private final CountDownLatch finished = new CountDownLatch(1);
    private volatile String abortReason;

    /**
     * @param finalizer    reporting client, or {@code null} when reporting is disabled
     * @param reportWriter run summary writer, or {@code null} to skip the summary file
     */
    public PipelineOrchestrator(BuildIdentityResolver identityResolver, ServiceRegistry registry, PhasePlan plan,
                                ServiceSupervisor supervisor, PhaseRunner phaseRunner, PhaseEnvironment environment,
                                ResultFinalizer finalizer, RunReportWriter reportWriter,
                                BuildNumberSource buildNumberSource, EventBus eventBus, PipelineMetrics metrics) {
        this.identityResolver = identityResolver;
        this.registry = registry;
        this.plan = plan;
        this.supervisor = supervisor;
        this.phaseRunner = phaseRunner;
        this.environment = environment;
        this.finalizer = finalizer;
        this.reportWriter = reportWriter;
        this.buildNumberSource = buildNumberSource;
        this.eventBus = eventBus;
        this.metrics = metrics;
        this.run = new PipelineRun(generateRunId(), Instant.now());
    }

    public PipelineRun run() {
        return run;
    }

    /**
     * Executes the whole run on the calling thread and returns the finished run.
     *
     * @throws IllegalStateException if this orchestrator already executed
     */
    public PipelineRun execute() {
        if (!started.compareAndSet(false, true)) {
            throw new IllegalStateException("Run " + run.runId() + " was already executed");
        }
        String runId = run.runId();
        MdcContext.setRun(runId);
        try {
            log.info("Starting run {}: {} services, phases {}", runId, registry.size(), plan.names());
            publish("run.started", null, Map.of("services", registry.size(), "phases", plan.names()));

            run.transitionTo(PipelineState.RESOLVING_IDENTITY);
            BuildIdentity identity;
            try {
                identity = identityResolver.resolve();
            } catch (IdentityException e) {
                abortEarly("build identity unavailable: " + e.getMessage());
                return run;
            }
            run.setIdentity(identity);
            log.info("Build identity {}", identity);
            if (abortRequested.get()) {
                abortEarly("aborted before provisioning: " + abortReason);
                return run;
            }

            run.transitionTo(PipelineState.PROVISIONING);
            Map<String, ServiceInstance> instances;
            try {
                instances = supervisor.start(runId, registry.specs());
            } catch (ProvisionException e) {
                abortEarly(e.getMessage());
                return run;
            }
            run.addServices(instances.values().stream().toList());

            try {
                run.transitionTo(PipelineState.RUNNING_PHASES);
                runPhases(identity, instances);
            } finally {
                run.transitionTo(PipelineState.TEARING_DOWN);
                log.info("Tearing down {} services", instances.size());
                supervisor.stop(runId, instances);
            }

            run.setOverallStatus(aggregate());
            if (abortRequested.get()) {
                run.setAbortReason(abortReason);
            }
            run.transitionTo(PipelineState.FINALIZING);
            var outcome = finalizeRun(identity, run.overallStatus());
            run.setFinalization(outcome);
            run.transitionTo(outcome.acknowledged() || !outcome.attempted()
                    ? PipelineState.COMPLETED
                    : PipelineState.ABORTED);
            return run;
        } finally {
            log.info("Run {} ended in state {} with status {}", runId, run.state(), run.overallStatus());
            if (metrics != null) {
                metrics.recordRunResult(run.overallStatus().name());
            }
            if (reportWriter != null) {
                reportWriter.write(run);
            }
            publish("run.completed", null, Map.of(
                    "state", run.state().name(),
                    "overallStatus", run.overallStatus().name()));
            MdcContext.clear();
            finished.countDown();
        }
    }

    /**
     * Asks the run to stop at the next phase boundary. The phase in flight
     * finishes; the rest are skipped, services are torn down and the run is
     * still reported, as aborted.
     */
    public void requestAbort(String reason) {
        if (abortRequested.compareAndSet(false, true)) {
            abortReason = reason;
            log.warn("Abort requested for run {}: {}", run.runId(), reason);
        }
    }

    public boolean isAbortRequested() {
        return abortRequested.get();
    }

    /**
     * Waits until {@link #execute()} has returned. Returns immediately when it was never called.
     */
    public boolean awaitCompletion(Duration timeout) throws InterruptedException {
        if (!started.get()) {
            return true;
        }
        return finished.await(timeout.toMillis(), TimeUnit.MILLISECONDS);
    }

    private void runPhases(BuildIdentity identity, Map<String, ServiceInstance> instances) {
        var env = environment.build(identity, identity.buildNumber(buildNumberSource), instances);
        String skipReason = null;

        for (PhaseSpec phase : plan.phases()) {
            if (skipReason == null && abortRequested.get()) {
                skipReason = "run aborted: " + abortReason;
            }
            if (skipReason != null) {
                log.info("Skipping phase {} ({})", phase.name(), skipReason);
                record(PhaseResult.skipped(phase, skipReason));
                continue;
            }

            MdcContext.setPhase(run.runId(), phase.name());
            PhaseResult result;
            try {
                publish("phase.started", phase.name(), Map.of());
                result = phaseRunner.run(run.runId(), phase, env);
            } catch (RuntimeException e) {
                log.error("Phase {} crashed", phase.name(), e);
                result = new PhaseResult(phase, PhaseStatus.FAILURE, -1, null,
                        "unexpected error: " + e.getMessage(), Optional.empty(), null, null);
            } finally {
                MdcContext.clearPhase();
            }
            record(result);

            if (!result.succeeded() && phase.blocking()) {
                skipReason = "blocking phase " + phase.name() + " failed";
            }
        }
    }

    private void record(PhaseResult result) {
        run.addPhaseResult(result);
        if (metrics != null) {
            metrics.recordPhase(result.phase().name(), result.status().name(), result.duration());
        }
        var payload = new LinkedHashMap<String, Object>();
        payload.put("status", result.status().name());
        payload.put("durationMs", result.duration().toMillis());
        if (result.failureReason() != null) {
            payload.put("reason", result.failureReason());
        }
        if (result.logRef() != null) {
            payload.put("log", result.logRef().toString());
        }
        publish("phase.completed", result.phase().name(), payload);
    }

    /** SUCCESS only if every phase passed; an abort overrides everything. */
    OverallStatus aggregate() {
        if (abortRequested.get()) {
            return OverallStatus.ABORTED;
        }
        boolean allPassed = run.phaseResults().stream().allMatch(PhaseResult::succeeded);
        return allPassed ? OverallStatus.SUCCESS : OverallStatus.PARTIAL_FAILURE;
    }

    private FinalizationOutcome finalizeRun(BuildIdentity identity, OverallStatus status) {
        if (finalizer == null) {
            log.info("Reporting disabled; run {} not finalized", run.runId());
            return FinalizationOutcome.notAttempted("reporting disabled");
        }
        FinalizationOutcome outcome;
        try {
            var ack = finalizer.finalize(identity, status);
            outcome = new FinalizationOutcome(true, true, ack.attempts(), ack.httpStatus(), ack.body());
        } catch (FinalizationException e) {
            log.error("Finalization failed: {}", e.getMessage());
            outcome = new FinalizationOutcome(true, false, e.attempts(), e.httpStatus(), e.getMessage());
        }
        if (metrics != null) {
            metrics.recordFinalization(outcome.acknowledged(), outcome.attempts());
        }
        publish(outcome.acknowledged() ? "run.finalized" : "run.finalization_failed", null,
                Map.of("attempts", outcome.attempts(), "httpStatus", outcome.httpStatus()));
        return outcome;
    }

    private void abortEarly(String reason) {
        log.error("Run {} aborted: {}", run.runId(), reason);
        run.setAbortReason(reason);
        run.setOverallStatus(OverallStatus.ABORTED);
        run.setFinalization(FinalizationOutcome.notAttempted("run aborted before phases: " + reason));
        run.transitionTo(PipelineState.ABORTED);
    }

    private void publish(String type, String subject, Map<String, Object> payload) {
        if (eventBus != null) {
            eventBus.publish(PipelineEvent.of(type, run.runId(), subject, payload));
        }
    }

    static String generateRunId() {
        return String.format("run-%s-%04d", RUN_ID_TIME.format(Instant.now()), RUN_COUNTER.incrementAndGet());
    }
}
