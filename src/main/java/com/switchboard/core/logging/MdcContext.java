package com.switchboard.core.logging;

import org.slf4j.MDC;

/**
 * Utility for managing Switchboard-specific MDC keys for structured logging.
 */
public final class MdcContext {

    private MdcContext() {}

    public static void setUnit(String unitId, String traceId) {
        MDC.put("unitId", unitId);
        if (traceId != null) {
            MDC.put("traceId", traceId);
        }
    }

    public static void setSequence(String sequenceId, String leadId) {
        MDC.put("sequenceId", sequenceId);
        MDC.put("leadId", leadId);
    }

    public static void clearSequence() {
        MDC.remove("sequenceId");
        MDC.remove("leadId");
    }

    public static void clear() {
        MDC.remove("unitId");
        MDC.remove("traceId");
        MDC.remove("sequenceId");
        MDC.remove("leadId");
    }
}
