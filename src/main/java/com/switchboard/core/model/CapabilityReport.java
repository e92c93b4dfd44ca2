package com.switchboard.core.model;

import java.util.List;

/**
 * Honest assessment of a supervisor and the units it owns.
 */
public record CapabilityReport(
    String supervisor,
    UnitStatus status,
    List<UnitCapability> units,
    boolean actuallyWorks,
    List<String> blockedBy
) {

    public record UnitCapability(String id, UnitStatus status, boolean hasRealLogic) {}
}
