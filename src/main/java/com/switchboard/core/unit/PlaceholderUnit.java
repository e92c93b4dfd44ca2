package com.switchboard.core.unit;

import com.switchboard.core.model.Report;
import com.switchboard.core.model.UnitIdentity;
import com.switchboard.core.model.UnitMessage;
import com.switchboard.core.model.UnitStatus;

/**
 * A registered unit with no logic behind it, in status {@link UnitStatus#STUB} or
 * {@link UnitStatus#UNIMPLEMENTED}. Supervisors report it as BLOCKED instead of calling it.
 */
public class PlaceholderUnit extends AbstractCapabilityUnit {

    public PlaceholderUnit(UnitIdentity identity) {
        super(identity);
        if (identity.status().isExecutable()) {
            throw new IllegalArgumentException("Placeholder unit " + identity.id()
                    + " must be STUB or UNIMPLEMENTED, was " + identity.status());
        }
    }

    @Override
    protected Report doExecute(UnitMessage message) {
        // Unreachable: execute() refuses non-executable units before getting here.
        return Report.failed(message.id(), id(), "Unit " + id() + " has no implementation");
    }
}
