package com.testfleet.core.engine;

import com.testfleet.core.model.PipelineRun;

/**
 * Process exit codes of the {@code run} command.
 */
public final class ExitCodes {

    public static final int SUCCESS = 0;
    public static final int PARTIAL_FAILURE = 1;
    public static final int USAGE = 2;
    public static final int ABORTED = 3;
    public static final int FINALIZATION_FAILED = 4;

    private ExitCodes() {
    }

    public static int of(PipelineRun run) {
        return switch (run.overallStatus()) {
            case SUCCESS -> run.finalization().attempted() && !run.finalization().acknowledged()
                    ? FINALIZATION_FAILED
                    : SUCCESS;
            case PARTIAL_FAILURE -> PARTIAL_FAILURE;
            case ABORTED, PENDING -> ABORTED;
        };
    }
}
