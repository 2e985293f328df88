package com.testfleet.core.model;

/**
 * States of the pipeline orchestrator. COMPLETED and ABORTED are terminal.
 */
public enum PipelineState {
    IDLE,
    RESOLVING_IDENTITY,
    PROVISIONING,
    RUNNING_PHASES,
    TEARING_DOWN,
    FINALIZING,
    COMPLETED,
    ABORTED;

    public boolean isTerminal() {
        return this == COMPLETED || this == ABORTED;
    }
}
