package com.switchboard.core.model;

/**
 * Capability-readiness level of a unit.
 * <p>
 * Only {@link #OPERATIONAL} and {@link #VERIFIED} units may receive work. Supervisors check
 * {@link #isExecutable()} before delegating and never call into a unit that fails it.
 */
public enum UnitStatus {
    UNIMPLEMENTED,
    STUB,
    OPERATIONAL,
    VERIFIED;

    public boolean isExecutable() {
        return this == OPERATIONAL || this == VERIFIED;
    }
}
