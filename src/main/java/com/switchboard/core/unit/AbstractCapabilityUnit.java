package com.switchboard.core.unit;

import com.switchboard.core.logging.MdcContext;
import com.switchboard.core.model.Report;
import com.switchboard.core.model.SelfAssessment;
import com.switchboard.core.model.Signal;
import com.switchboard.core.model.UnitIdentity;
import com.switchboard.core.model.UnitMessage;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Base class for capability units.
 * <p>
 * Converts every exception thrown by {@link #doExecute} or {@link #doHandleSignal} into a FAILED
 * report, and refuses to run at all when the unit's own status is not executable.
 */
public abstract class AbstractCapabilityUnit implements CapabilityUnit {

    protected final Logger log = LoggerFactory.getLogger(getClass());

    private final UnitIdentity identity;
    private final AtomicBoolean initialized = new AtomicBoolean(false);

    protected AbstractCapabilityUnit(UnitIdentity identity) {
        this.identity = Objects.requireNonNull(identity, "identity must not be null");
    }

    @Override
    public UnitIdentity identity() {
        return identity;
    }

    @Override
    public final void initialize() {
        if (initialized.compareAndSet(false, true)) {
            onInitialize();
            log.info("Initialized {} ({})", identity.id(), identity.status());
        }
    }

    public boolean isInitialized() {
        return initialized.get();
    }

    @Override
    public final Report execute(UnitMessage message) {
        if (!status().isExecutable()) {
            // Callers are expected to gate on status; reaching here is a contract violation.
            log.warn("execute() called on non-executable unit {} ({})", id(), status());
            return Report.failed(message.id(), id(),
                    "Unit " + id() + " is " + status() + " and cannot execute");
        }
        MdcContext.setUnit(id(), message.traceId());
        try {
            return doExecute(message);
        } catch (Exception e) {
            log.error("Unit {} failed on message {}: {}", id(), message.id(), e.getMessage(), e);
            return Report.failed(message.id(), id(),
                    e.getClass().getSimpleName() + ": " + e.getMessage());
        }
    }

    @Override
    public final Report handleSignal(Signal signal) {
        if (!status().isExecutable()) {
            return Report.failed(signal.id(), id(),
                    "Unit " + id() + " is " + status() + " and cannot handle signals");
        }
        try {
            return doHandleSignal(signal);
        } catch (Exception e) {
            log.error("Unit {} failed on signal {}: {}", id(), signal.type(), e.getMessage(), e);
            return Report.failed(signal.id(), id(),
                    e.getClass().getSimpleName() + ": " + e.getMessage());
        }
    }

    @Override
    public SelfAssessment selfReport() {
        return SelfAssessment.none();
    }

    protected void onInitialize() {
    }

    protected abstract Report doExecute(UnitMessage message) throws Exception;

    /**
     * Default acknowledges the signal without acting on it.
     */
    protected Report doHandleSignal(Signal signal) throws Exception {
        return Report.completed(signal.id(), id(), Map.of("acknowledged", signal.type()));
    }
}
