package com.testfleet.report;

/**
 * The reporting service did not acknowledge the run. Carries the last HTTP
 * status seen, or 0 when no response was received at all.
 */
public class FinalizationException extends RuntimeException {

    private final int httpStatus;
    private final int attempts;

    public FinalizationException(String message, int httpStatus, int attempts) {
        super(message);
        this.httpStatus = httpStatus;
        this.attempts = attempts;
    }

    public FinalizationException(String message, int httpStatus, int attempts, Throwable cause) {
        super(message, cause);
        this.httpStatus = httpStatus;
        this.attempts = attempts;
    }

    public int httpStatus() {
        return httpStatus;
    }

    public int attempts() {
        return attempts;
    }
}
