package com.switchboard.core.outreach;

import java.util.List;

/**
 * A sequence document. Read-only once execution starts.
 */
public record SequenceDefinition(
    String sequenceId,
    List<SequenceStep> steps,
    ComplianceSettings complianceSettings
) {

    public SequenceDefinition {
        steps = steps != null ? List.copyOf(steps) : List.of();
        complianceSettings = complianceSettings != null ? complianceSettings : ComplianceSettings.defaults();
    }
}
