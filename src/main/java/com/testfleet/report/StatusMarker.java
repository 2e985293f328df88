package com.testfleet.report;

import com.testfleet.core.model.OverallStatus;

/**
 * Maps an overall run status to the marker the reporting webhook understands.
 */
public final class StatusMarker {

    public static final String DONE = "done";
    public static final String FAILED = "failed";
    public static final String ABORTED = "aborted";

    private StatusMarker() {
    }

    public static String of(OverallStatus status) {
        return switch (status) {
            case SUCCESS -> DONE;
            case PARTIAL_FAILURE -> FAILED;
            case ABORTED -> ABORTED;
            case PENDING -> throw new IllegalArgumentException("Cannot report a run that is still pending");
        };
    }
}
