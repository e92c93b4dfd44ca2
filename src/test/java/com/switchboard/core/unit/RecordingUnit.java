package com.switchboard.core.unit;

import com.switchboard.core.model.Report;
import com.switchboard.core.model.SelfAssessment;
import com.switchboard.core.model.Signal;
import com.switchboard.core.model.UnitIdentity;
import com.switchboard.core.model.UnitMessage;
import com.switchboard.core.model.UnitRole;
import com.switchboard.core.model.UnitStatus;

import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Function;

/**
 * Test unit that records every call, whatever its status. Used to prove that callers never
 * reach a unit they should have gated.
 */
public class RecordingUnit implements CapabilityUnit {

    private final UnitIdentity identity;
    private final List<UnitMessage> executed = new CopyOnWriteArrayList<>();
    private final List<Signal> signals = new CopyOnWriteArrayList<>();
    private Function<UnitMessage, Report> behaviour;
    private int initializations;

    public RecordingUnit(String id, UnitStatus status, String reportsTo) {
        this.identity = new UnitIdentity(id, id, UnitRole.LEAF, status, reportsTo, Set.of());
        this.behaviour = m -> Report.completed(m.id(), id, Map.of("body", "done by " + id));
    }

    public RecordingUnit respondingWith(Function<UnitMessage, Report> behaviour) {
        this.behaviour = behaviour;
        return this;
    }

    @Override
    public UnitIdentity identity() {
        return identity;
    }

    @Override
    public void initialize() {
        initializations++;
    }

    @Override
    public Report execute(UnitMessage message) {
        executed.add(message);
        return behaviour.apply(message);
    }

    @Override
    public Report handleSignal(Signal signal) {
        signals.add(signal);
        return Report.completed(signal.id(), id(), Map.of("seen", signal.type()));
    }

    @Override
    public SelfAssessment selfReport() {
        return new SelfAssessment(true, 100);
    }

    public List<UnitMessage> executed() {
        return executed;
    }

    public List<Signal> signals() {
        return signals;
    }

    public int initializations() {
        return initializations;
    }
}
