package com.wobble.core.logging;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.slf4j.MDC;

import static org.junit.jupiter.api.Assertions.*;

class MdcContextTest {

    @AfterEach
    void tearDown() {
        MdcContext.clear();
    }

    @Test
    @DisplayName("setRun puts runId in MDC")
    void setRun() {
        MdcContext.setRun("a1b2c3d4");
        assertEquals("a1b2c3d4", MDC.get("runId"));
    }

    @Test
    @DisplayName("setUnit puts runId and unitId in MDC")
    void setUnit() {
        MdcContext.setUnit("a1b2c3d4", "com.acme.BillingCheck#charges");
        assertEquals("a1b2c3d4", MDC.get("runId"));
        assertEquals("com.acme.BillingCheck#charges", MDC.get("unitId"));
    }

    @Test
    @DisplayName("clearUnit keeps the run")
    void clearUnit() {
        MdcContext.setUnit("a1b2c3d4", "com.acme.BillingCheck#charges");
        MdcContext.clearUnit();
        assertEquals("a1b2c3d4", MDC.get("runId"));
        assertNull(MDC.get("unitId"));
    }

    @Test
    @DisplayName("clear removes all wobble MDC keys")
    void clear() {
        MdcContext.setUnit("a1b2c3d4", "com.acme.BillingCheck#charges");
        MdcContext.clear();
        assertNull(MDC.get("runId"));
        assertNull(MDC.get("unitId"));
    }
}
