package com.testfleet.phase;

/**
 * A phase could not run to a clean result: a command failed to launch,
 * its log could not be written, or its output was incomplete. Recorded as
 * a failed phase, never propagated to sibling phases.
 */
public class PhaseExecutionException extends RuntimeException {

    private final String phaseName;

    public PhaseExecutionException(String phaseName, String message) {
        super(message);
        this.phaseName = phaseName;
    }

    public PhaseExecutionException(String phaseName, String message, Throwable cause) {
        super(message, cause);
        this.phaseName = phaseName;
    }

    public String phaseName() {
        return phaseName;
    }
}
