package com.switchboard.core.outreach;

import java.util.List;

/**
 * Result of a compliance check; {@link #reasons} lists every failing condition.
 */
public record ComplianceDecision(boolean allowed, List<String> reasons) {

    public ComplianceDecision {
        reasons = reasons != null ? List.copyOf(reasons) : List.of();
    }

    public static ComplianceDecision of(List<String> reasons) {
        return new ComplianceDecision(reasons.isEmpty(), reasons);
    }
}
