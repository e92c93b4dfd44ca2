package com.switchboard.core.outreach;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Per-sequence compliance overrides. Null caps and quiet hours fall back to the engine's current
 * {@link OutreachParameters}.
 */
public record ComplianceSettings(
    @JsonProperty("respectDNC") Boolean respectDnc,
    Integer maxContactsPerDay,
    Integer maxContactsPerWeek,
    Integer quietHoursStart,
    Integer quietHoursEnd
) {

    public static ComplianceSettings defaults() {
        return new ComplianceSettings(true, null, null, null, null);
    }

    public boolean respectsDnc() {
        return !Boolean.FALSE.equals(respectDnc);
    }
}
