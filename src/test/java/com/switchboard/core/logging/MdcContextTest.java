package com.switchboard.core.logging;

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
    @DisplayName("setUnit puts unitId and traceId in MDC")
    void setUnit() {
        MdcContext.setUnit("EMAIL_CHANNEL", "sequence_welcome_lead-1");
        assertEquals("EMAIL_CHANNEL", MDC.get("unitId"));
        assertEquals("sequence_welcome_lead-1", MDC.get("traceId"));
    }

    @Test
    @DisplayName("setUnit without a trace keeps the previous trace")
    void setUnitWithoutTrace() {
        MdcContext.setUnit("OUTREACH_MANAGER", "trace-1");
        MdcContext.setUnit("SMS_CHANNEL", null);
        assertEquals("SMS_CHANNEL", MDC.get("unitId"));
        assertEquals("trace-1", MDC.get("traceId"));
    }

    @Test
    @DisplayName("clearSequence removes only the sequence keys")
    void clearSequence() {
        MdcContext.setUnit("OUTREACH_MANAGER", "trace-1");
        MdcContext.setSequence("welcome", "lead-1");
        assertEquals("lead-1", MDC.get("leadId"));

        MdcContext.clearSequence();
        assertNull(MDC.get("sequenceId"));
        assertNull(MDC.get("leadId"));
        assertEquals("OUTREACH_MANAGER", MDC.get("unitId"));
    }

    @Test
    @DisplayName("clear removes all switchboard MDC keys")
    void clear() {
        MdcContext.setUnit("OUTREACH_MANAGER", "trace-1");
        MdcContext.setSequence("welcome", "lead-1");
        MdcContext.clear();
        assertNull(MDC.get("unitId"));
        assertNull(MDC.get("traceId"));
        assertNull(MDC.get("sequenceId"));
        assertNull(MDC.get("leadId"));
    }
}
