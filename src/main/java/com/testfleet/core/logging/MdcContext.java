package com.testfleet.core.logging;

import org.slf4j.MDC;

/**
 * Utility for managing testfleet MDC keys for structured logging.
 */
public final class MdcContext {

    private MdcContext() {}

    public static void setRun(String runId) {
        MDC.put("runId", runId);
    }

    public static void setService(String runId, String serviceName) {
        MDC.put("runId", runId);
        MDC.put("service", serviceName);
    }

    public static void setPhase(String runId, String phaseName) {
        MDC.put("runId", runId);
        MDC.put("phase", phaseName);
    }

    public static void clearPhase() {
        MDC.remove("phase");
    }

    public static void clear() {
        MDC.remove("runId");
        MDC.remove("service");
        MDC.remove("phase");
    }
}
