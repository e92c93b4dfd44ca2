package com.switchboard.core.supervisor;

import com.switchboard.core.logging.MdcContext;
import com.switchboard.core.model.CapabilityReport;
import com.switchboard.core.model.CrossSupervisorRequest;
import com.switchboard.core.model.DelegationRule;
import com.switchboard.core.model.MutationDirective;
import com.switchboard.core.model.MutationResult;
import com.switchboard.core.model.Report;
import com.switchboard.core.model.RequestReceipt;
import com.switchboard.core.model.ReviewResult;
import com.switchboard.core.model.SelfAssessment;
import com.switchboard.core.model.Signal;
import com.switchboard.core.model.UnitIdentity;
import com.switchboard.core.model.UnitMessage;
import com.switchboard.core.model.UnitStatus;
import com.switchboard.core.model.Urgency;
import com.switchboard.core.unit.AbstractCapabilityUnit;
import com.switchboard.core.unit.CapabilityUnit;
import com.switchboard.core.unit.UnitOwner;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * A capability unit that owns other units and delegates work to them.
 * <p>
 * {@link #execute} runs, in order: the pause check, the {@link #handleDirect} hook, rule-based
 * delegation through the quality gate, then single-unit fallback. A unit whose status is not
 * executable is never called; the supervisor answers BLOCKED on its behalf.
 */
public abstract class Supervisor extends AbstractCapabilityUnit implements UnitOwner {

    public static final String UNIT_NOT_BUILT = "UNIT_NOT_BUILT";
    public static final String UNIT_IS_STUB = "UNIT_IS_STUB";
    public static final String SUPERVISOR_PAUSED = "SUPERVISOR_PAUSED";

    protected final SupervisorContext context;

    private final Map<String, CapabilityUnit> units = Collections.synchronizedMap(new LinkedHashMap<>());
    private final List<CrossSupervisorRequest> pendingRequests = new CopyOnWriteArrayList<>();

    protected Supervisor(UnitIdentity identity, SupervisorContext context) {
        super(identity);
        this.context = context;
    }

    @Override
    protected void onInitialize() {
        context.transport().register(id(), this::acceptRequest);
    }

    @Override
    public void registerUnit(CapabilityUnit unit) {
        units.put(unit.id(), unit);
        log.debug("{} registered unit {} ({})", id(), unit.id(), unit.status());
    }

    public List<CapabilityUnit> units() {
        synchronized (units) {
            return List.copyOf(units.values());
        }
    }

    /**
     * Rules evaluated by the delegation matcher, in declaration order.
     */
    protected List<DelegationRule> delegationRules() {
        return List.of();
    }

    public Set<String> managedMutationTypes() {
        return Set.of();
    }

    /**
     * Pure domain function applying one directive to this supervisor's parameters.
     */
    public MutationResult applyMutation(MutationDirective directive) {
        return MutationResult.notApplied(directive, id() + " does not handle mutation type " + directive.type());
    }

    /**
     * Domain review of a successful delegation. The default approves everything.
     */
    protected ReviewResult reviewOutput(Report report) {
        return ReviewResult.pass();
    }

    /**
     * Hook for messages the supervisor answers itself instead of delegating.
     */
    protected Optional<Report> handleDirect(UnitMessage message) {
        return Optional.empty();
    }

    @Override
    protected Report doExecute(UnitMessage message) {
        Optional<Report> paused = checkPaused(message.id());
        if (paused.isPresent()) {
            return paused.get();
        }

        Optional<Report> direct = handleDirect(message);
        if (direct.isPresent()) {
            return direct.get();
        }

        Optional<String> target = context.matcher().resolve(delegationRules(), message.payload());
        if (target.isPresent()) {
            return delegateWithReview(target.get(), message);
        }

        List<CapabilityUnit> executable = units().stream()
                .filter(u -> u.status().isExecutable())
                .toList();
        if (executable.size() == 1) {
            log.debug("No rule matched; routing {} to sole executable unit {}", message.id(), executable.get(0).id());
            return delegateWithReview(executable.get(0).id(), message);
        }
        return Report.failed(message.id(), id(), "No delegation target for message " + message.id()
                + " (" + executable.size() + " executable units, no matching rule)");
    }

    /**
     * Delegates one message to an owned unit, refusing units that are not executable.
     */
    public Report delegateToUnit(String unitId, UnitMessage message) {
        CapabilityUnit unit = units.get(unitId);
        if (unit == null) {
            return Report.failed(message.id(), id(), "Unit " + unitId + " is not registered with " + id());
        }
        if (!unit.status().isExecutable()) {
            context.metrics().recordGatedDelegation(unitId, unit.status().name());
            log.info("Refusing to delegate {} to {}: unit is {}", message.id(), unitId, unit.status());
            return gatedReport(message.id(), unit);
        }

        long start = System.currentTimeMillis();
        Report report = unit.execute(message.redirectTo(unitId));
        MdcContext.setUnit(id(), message.traceId());
        context.metrics().recordDelegation(unitId, report.status().name(), System.currentTimeMillis() - start);
        return report;
    }

    public Report delegateWithReview(String unitId, UnitMessage message) {
        return context.qualityGate().delegateWithReview(id(), unitId, message,
                m -> delegateToUnit(unitId, m), this::reviewOutput);
    }

    /**
     * Sends a signal to every owned unit. Units that are not executable get a BLOCKED entry.
     */
    public Map<String, Report> broadcastToUnits(Signal signal) {
        Map<String, Report> results = new LinkedHashMap<>();
        for (CapabilityUnit unit : units()) {
            results.put(unit.id(), unit.status().isExecutable()
                    ? unit.handleSignal(signal)
                    : gatedReport(signal.id(), unit));
        }
        return results;
    }

    @Override
    protected Report doHandleSignal(Signal signal) {
        Map<String, Report> results = broadcastToUnits(signal);
        Map<String, Object> statuses = new LinkedHashMap<>();
        results.forEach((unitId, report) -> statuses.put(unitId, report.status().name()));
        return Report.completed(signal.id(), id(), Map.of("signal", signal.type(), "units", statuses));
    }

    public List<MutationResult> readAndApplyMutations() {
        return context.mutationPipeline().readAndApplyMutations(id(), managedMutationTypes(), this::applyMutation);
    }

    public RequestReceipt requestFromSupervisor(String toSupervisor, String requestType, String description,
                                                Urgency urgency, Map<String, Object> payload, Instant deadline) {
        return requestFromSupervisor(new CrossSupervisorRequest(null, id(), toSupervisor, requestType,
                description, urgency, payload, deadline));
    }

    public RequestReceipt requestFromSupervisor(CrossSupervisorRequest request) {
        if (request.fromSupervisor() != null && !id().equals(request.fromSupervisor())) {
            return RequestReceipt.failed(id() + " cannot send requests on behalf of " + request.fromSupervisor());
        }
        return context.requestProtocol().requestFromSupervisor(new CrossSupervisorRequest(request.id(), id(),
                request.toSupervisor(), request.requestType(), request.description(), request.urgency(),
                request.payload(), request.deadline()));
    }

    /**
     * Reloads the pending queue from the store. The store result replaces whatever the transport
     * delivered since the last cycle.
     */
    public List<CrossSupervisorRequest> readIncomingRequests() {
        List<CrossSupervisorRequest> incoming = context.requestProtocol().readIncomingRequests(id());
        synchronized (pendingRequests) {
            pendingRequests.clear();
            pendingRequests.addAll(incoming);
        }
        if (!incoming.isEmpty()) {
            log.info("{} has {} pending request(s)", id(), incoming.size());
        }
        return incoming;
    }

    public boolean respondToRequest(String requestKey, Map<String, Object> response) {
        boolean responded = context.requestProtocol().respond(requestKey, id(), response);
        if (responded) {
            pendingRequests.removeIf(r -> requestKey.equals(r.id()));
        }
        return responded;
    }

    /**
     * Transport handler for direct request delivery. The request is only queued here; the store
     * mirror stays authoritative.
     */
    @SuppressWarnings("unchecked")
    public Report acceptRequest(UnitMessage message) {
        Map<String, Object> payload = message.payload();
        Object body = payload.get("payload");
        Object urgency = payload.get("urgency");
        CrossSupervisorRequest request = new CrossSupervisorRequest(
                "xreq_" + message.id(), message.from(), id(),
                String.valueOf(payload.get("requestType")),
                payload.get("description") != null ? payload.get("description").toString() : null,
                urgency != null ? Urgency.valueOf(urgency.toString()) : message.priority(),
                body instanceof Map<?, ?> m ? (Map<String, Object>) m : Map.of(),
                null);
        pendingRequests.add(request);
        log.debug("{} queued request {} from {}", id(), request.id(), message.from());
        return Report.pending(message.id(), id(), Map.of("queued", true, "requestType", request.requestType()));
    }

    public List<CrossSupervisorRequest> pendingRequests() {
        return List.copyOf(pendingRequests);
    }

    /**
     * One operating cycle: apply owned mutation directives, then reload incoming requests.
     */
    public Report runCycle() {
        String cycleId = "cycle_" + UUID.randomUUID();
        Optional<Report> paused = checkPaused(cycleId);
        if (paused.isPresent()) {
            return paused.get();
        }
        List<MutationResult> mutations = readAndApplyMutations();
        List<CrossSupervisorRequest> requests = readIncomingRequests();

        Map<String, Object> data = new LinkedHashMap<>();
        data.put("mutationsProcessed", mutations.size());
        data.put("mutationsApplied", mutations.stream().filter(MutationResult::applied).count());
        data.put("mutationResults", mutations);
        data.put("pendingRequests", requests.size());
        return Report.completed(cycleId, id(), data);
    }

    public Optional<Report> checkPaused(String taskId) {
        if (!context.swarmControl().isPaused(id())) {
            return Optional.empty();
        }
        return Optional.of(Report.blocked(taskId, id(), Map.of("reason", SUPERVISOR_PAUSED),
                List.of(id() + " is paused")));
    }

    public CapabilityReport capabilityReport() {
        List<CapabilityReport.UnitCapability> capabilities = new ArrayList<>();
        List<String> blockedBy = new ArrayList<>();
        for (CapabilityUnit unit : units()) {
            capabilities.add(new CapabilityReport.UnitCapability(unit.id(), unit.status(),
                    unit.status().isExecutable() && unit.selfReport().hasRealLogic()));
            if (!unit.status().isExecutable()) {
                blockedBy.add(unit.id() + " (" + unit.status() + ")");
            }
        }
        boolean works = capabilities.stream().anyMatch(CapabilityReport.UnitCapability::hasRealLogic);
        return new CapabilityReport(id(), status(), capabilities, works, blockedBy);
    }

    @Override
    public SelfAssessment selfReport() {
        List<CapabilityUnit> owned = units();
        if (owned.isEmpty()) {
            return new SelfAssessment(true, 0);
        }
        long executable = owned.stream().filter(u -> u.status().isExecutable()).count();
        return new SelfAssessment(true, (int) (executable * 100 / owned.size()));
    }

    private Report gatedReport(String taskId, CapabilityUnit unit) {
        UnitStatus status = unit.status();
        String reason = status == UnitStatus.UNIMPLEMENTED ? UNIT_NOT_BUILT : UNIT_IS_STUB;
        Map<String, Object> data = new LinkedHashMap<>();
        data.put("reason", reason);
        data.put("unitId", unit.id());
        data.put("unitStatus", status.name());
        return Report.blocked(taskId, id(), data,
                List.of("Unit " + unit.id() + " is " + status + " and cannot execute"));
    }
}
