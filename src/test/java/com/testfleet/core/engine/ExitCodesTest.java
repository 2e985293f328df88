package com.testfleet.core.engine;

import com.testfleet.core.model.FinalizationOutcome;
import com.testfleet.core.model.OverallStatus;
import com.testfleet.core.model.PipelineRun;
import org.junit.jupiter.api.Test;

import java.time.Instant;

import static org.junit.jupiter.api.Assertions.assertEquals;

class ExitCodesTest {

    private static PipelineRun run(OverallStatus status, FinalizationOutcome finalization) {
        var run = new PipelineRun("run-1", Instant.now());
        run.setOverallStatus(status);
        run.setFinalization(finalization);
        return run;
    }

    private static final FinalizationOutcome ACKED = new FinalizationOutcome(true, true, 1, 200, "ok");
    private static final FinalizationOutcome REJECTED = new FinalizationOutcome(true, false, 2, 503, "down");

    @Test
    void mapsStatusAndFinalization() {
        assertEquals(0, ExitCodes.of(run(OverallStatus.SUCCESS, ACKED)));
        assertEquals(0, ExitCodes.of(run(OverallStatus.SUCCESS, FinalizationOutcome.notAttempted("disabled"))));
        assertEquals(4, ExitCodes.of(run(OverallStatus.SUCCESS, REJECTED)));
        assertEquals(1, ExitCodes.of(run(OverallStatus.PARTIAL_FAILURE, ACKED)));
        assertEquals(1, ExitCodes.of(run(OverallStatus.PARTIAL_FAILURE, REJECTED)));
        assertEquals(3, ExitCodes.of(run(OverallStatus.ABORTED, ACKED)));
        assertEquals(3, ExitCodes.of(run(OverallStatus.PENDING, FinalizationOutcome.notAttempted("x"))));
    }
}
