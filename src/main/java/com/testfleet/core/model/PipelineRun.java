package com.testfleet.core.model;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Aggregate root for one pipeline run.
 *
 * <p>Holds the resolved identity, the service instances that were provisioned,
 * one {@link PhaseResult} per declared phase, the aggregate status and the
 * outcome of the reporting call. Only the orchestrator mutates it; readers get
 * unmodifiable views.
 */
public class PipelineRun {

    private final String runId;
    private final Instant startedAt;
    private final List<ServiceInstance> services = new ArrayList<>();
    private final List<PhaseResult> phaseResults = new ArrayList<>();

    private volatile PipelineState state = PipelineState.IDLE;
    private volatile OverallStatus overallStatus = OverallStatus.PENDING;
    private BuildIdentity identity;
    private FinalizationOutcome finalization = FinalizationOutcome.notAttempted("run not finished");
    private String abortReason;
    private Instant finishedAt;

    public PipelineRun(String runId, Instant startedAt) {
        this.runId = runId;
        this.startedAt = startedAt;
    }

    public String runId() { return runId; }
    public Instant startedAt() { return startedAt; }
    public Instant finishedAt() { return finishedAt; }
    public PipelineState state() { return state; }
    public OverallStatus overallStatus() { return overallStatus; }
    public BuildIdentity identity() { return identity; }
    public FinalizationOutcome finalization() { return finalization; }
    public String abortReason() { return abortReason; }

    public synchronized List<ServiceInstance> services() {
        return Collections.unmodifiableList(new ArrayList<>(services));
    }

    public synchronized List<PhaseResult> phaseResults() {
        return Collections.unmodifiableList(new ArrayList<>(phaseResults));
    }

    public void transitionTo(PipelineState next) {
        if (state.isTerminal()) {
            throw new IllegalStateException("Run " + runId + " already ended in " + state);
        }
        state = next;
        if (next.isTerminal()) {
            finishedAt = Instant.now();
        }
    }

    public void setIdentity(BuildIdentity identity) {
        this.identity = identity;
    }

    public synchronized void addServices(List<ServiceInstance> instances) {
        services.addAll(instances);
    }

    public synchronized void addPhaseResult(PhaseResult result) {
        phaseResults.add(result);
    }

    public void setOverallStatus(OverallStatus overallStatus) {
        this.overallStatus = overallStatus;
    }

    public void setFinalization(FinalizationOutcome finalization) {
        this.finalization = finalization;
    }

    public void setAbortReason(String abortReason) {
        this.abortReason = abortReason;
    }

    public long failedPhaseCount() {
        return phaseResults().stream().filter(r -> r.status() == PhaseStatus.FAILURE).count();
    }
}
