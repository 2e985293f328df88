package com.testfleet.core.logging;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.slf4j.MDC;

import static org.junit.jupiter.api.Assertions.*;

class MdcContextTest {

    @AfterEach
    void tearDown() {
        MDC.clear();
    }

    @Test
    void phaseKeysAreScopedWithinRun() {
        MdcContext.setPhase("run-1", "unit");
        assertEquals("run-1", MDC.get("runId"));
        assertEquals("unit", MDC.get("phase"));

        MdcContext.clearPhase();
        assertNull(MDC.get("phase"));
        assertEquals("run-1", MDC.get("runId"));
    }

    @Test
    void clearRemovesOnlyTestfleetKeys() {
        MDC.put("other", "kept");
        MdcContext.setService("run-1", "postgres");

        MdcContext.clear();

        assertNull(MDC.get("runId"));
        assertNull(MDC.get("service"));
        assertEquals("kept", MDC.get("other"));
    }
}
