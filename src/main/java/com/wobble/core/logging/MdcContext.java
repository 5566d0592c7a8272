package com.wobble.core.logging;

import org.slf4j.MDC;

/**
 * Utility for managing wobble-specific MDC keys for structured logging.
 */
public final class MdcContext {

    private MdcContext() {}

    public static void setRun(String runId) {
        MDC.put("runId", runId);
    }

    public static void setUnit(String runId, String unitId) {
        MDC.put("runId", runId);
        MDC.put("unitId", unitId);
    }

    public static void clearUnit() {
        MDC.remove("unitId");
    }

    public static void clear() {
        MDC.remove("runId");
        MDC.remove("unitId");
    }
}
