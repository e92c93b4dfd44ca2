package com.switchboard.core.unit;

/**
 * A unit that owns other units, i.e. a supervisor. The registry calls {@link #registerUnit}
 * once per owned unit at startup.
 */
public interface UnitOwner extends CapabilityUnit {

    void registerUnit(CapabilityUnit unit);
}
