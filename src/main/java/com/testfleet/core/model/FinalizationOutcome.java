package com.testfleet.core.model;

/**
 * What happened to the reporting call of a run.
 *
 * @param attempted    whether finalization was invoked at all
 * @param acknowledged whether the endpoint accepted the report
 * @param attempts     HTTP attempts made (retries included)
 * @param httpStatus   last HTTP status seen, 0 if none
 * @param message      acknowledgement body or failure reason
 */
public record FinalizationOutcome(
    boolean attempted,
    boolean acknowledged,
    int attempts,
    int httpStatus,
    String message
) {

    public static FinalizationOutcome notAttempted(String reason) {
        return new FinalizationOutcome(false, false, 0, 0, reason);
    }
}
