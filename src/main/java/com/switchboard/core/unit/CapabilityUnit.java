package com.switchboard.core.unit;

import com.switchboard.core.model.Report;
import com.switchboard.core.model.SelfAssessment;
import com.switchboard.core.model.Signal;
import com.switchboard.core.model.UnitIdentity;
import com.switchboard.core.model.UnitMessage;
import com.switchboard.core.model.UnitStatus;

/**
 * Contract implemented by every task handler, leaf or supervisor.
 * <p>
 * Implementations never let an exception escape {@link #execute} or {@link #handleSignal}; failures
 * come back as FAILED reports. Status gating is the caller's job: a supervisor checks
 * {@link UnitStatus#isExecutable()} before delegating.
 */
public interface CapabilityUnit {

    UnitIdentity identity();

    default String id() {
        return identity().id();
    }

    default UnitStatus status() {
        return identity().status();
    }

    /**
     * Idempotent setup; safe to call any number of times.
     */
    void initialize();

    Report execute(UnitMessage message);

    Report handleSignal(Signal signal);

    SelfAssessment selfReport();
}
