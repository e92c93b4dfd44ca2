package com.switchboard.core.supervisor;

import com.switchboard.core.SwarmFixture;
import com.switchboard.core.model.CapabilityReport;
import com.switchboard.core.model.CrossSupervisorRequest;
import com.switchboard.core.model.DelegationRule;
import com.switchboard.core.model.MessageType;
import com.switchboard.core.model.MutationDirective;
import com.switchboard.core.model.MutationResult;
import com.switchboard.core.model.Report;
import com.switchboard.core.model.ReportStatus;
import com.switchboard.core.model.RequestReceipt;
import com.switchboard.core.model.ReviewResult;
import com.switchboard.core.model.ReviewSeverity;
import com.switchboard.core.model.Signal;
import com.switchboard.core.model.UnitIdentity;
import com.switchboard.core.model.UnitMessage;
import com.switchboard.core.model.UnitRole;
import com.switchboard.core.model.UnitStatus;
import com.switchboard.core.model.Urgency;
import com.switchboard.core.qualitygate.QualityGate;
import com.switchboard.core.store.StorePriority;
import com.switchboard.core.transport.TransportAck;
import com.switchboard.core.unit.RecordingUnit;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for {@link Supervisor}, using a small test supervisor over hand-wired collaborators.
 */
class SupervisorTest {

    private SwarmFixture fixture;
    private TestSupervisor supervisor;
    private RecordingUnit worker;
    private RecordingUnit stub;
    private RecordingUnit unbuilt;

    /**
     * Routes "work" to WORKER, "draft" to STUB_UNIT and "plan" to UNBUILT_UNIT; answers "ping" itself.
     */
    static class TestSupervisor extends Supervisor {

        boolean rejectEverything;
        int limit = 5;

        TestSupervisor(SupervisorContext context) {
            super(new UnitIdentity("TEST_SUPERVISOR", "Test Supervisor", UnitRole.SUPERVISOR,
                    UnitStatus.OPERATIONAL, null, Set.of()), context);
        }

        @Override
        protected List<DelegationRule> delegationRules() {
            return List.of(
                    DelegationRule.of("WORKER", 10, "work"),
                    DelegationRule.of("STUB_UNIT", 10, "draft"),
                    DelegationRule.of("UNBUILT_UNIT", 10, "plan"));
        }

        @Override
        protected Optional<Report> handleDirect(UnitMessage message) {
            if ("ping".equals(message.payload().get("query"))) {
                return Optional.of(Report.completed(message.id(), id(), Map.of("pong", true)));
            }
            return Optional.empty();
        }

        @Override
        protected ReviewResult reviewOutput(Report report) {
            return rejectEverything
                    ? ReviewResult.reject(ReviewSeverity.MAJOR, List.of("not good enough"))
                    : ReviewResult.pass();
        }

        @Override
        public Set<String> managedMutationTypes() {
            return Set.of("LIMIT");
        }

        @Override
        public MutationResult applyMutation(MutationDirective directive) {
            int before = limit;
            limit = ((Number) directive.parameters().get("limit")).intValue();
            return new MutationResult(directive.id(), directive.type(), true,
                    Map.of("limit", before), Map.of("limit", limit), null);
        }
    }

    @BeforeEach
    void setUp() {
        fixture = new SwarmFixture();
        supervisor = new TestSupervisor(fixture.context);
        worker = new RecordingUnit("WORKER", UnitStatus.OPERATIONAL, "TEST_SUPERVISOR");
        stub = new RecordingUnit("STUB_UNIT", UnitStatus.STUB, "TEST_SUPERVISOR");
        unbuilt = new RecordingUnit("UNBUILT_UNIT", UnitStatus.UNIMPLEMENTED, "TEST_SUPERVISOR");
        supervisor.registerUnit(worker);
        supervisor.registerUnit(stub);
        supervisor.registerUnit(unbuilt);
        supervisor.initialize();
    }

    private UnitMessage message(Map<String, Object> payload) {
        return UnitMessage.command("ORCHESTRATOR", "TEST_SUPERVISOR", payload);
    }

    // -- status gating -----------------------------------------------------

    @Nested
    @DisplayName("status gating")
    class StatusGating {

        @Test
        @DisplayName("a STUB unit is never called and the supervisor answers BLOCKED")
        void stubIsBlocked() {
            Report report = supervisor.delegateToUnit("STUB_UNIT", message(Map.of("task", "draft")));

            assertEquals(ReportStatus.BLOCKED, report.status());
            assertEquals(Supervisor.UNIT_IS_STUB, report.reason());
            assertEquals("STUB_UNIT", report.data().get("unitId"));
            assertEquals("STUB", report.data().get("unitStatus"));
            assertTrue(report.errors().get(0).contains("STUB_UNIT"));
            assertTrue(report.errors().get(0).contains("STUB"));
            assertTrue(stub.executed().isEmpty());
        }

        @Test
        @DisplayName("an UNIMPLEMENTED unit is reported as not built")
        void unimplementedIsBlocked() {
            Report report = supervisor.execute(message(Map.of("task", "plan the quarter")));

            assertEquals(ReportStatus.BLOCKED, report.status());
            assertEquals(Supervisor.UNIT_NOT_BUILT, report.reason());
            assertEquals("UNIMPLEMENTED", report.data().get("unitStatus"));
            assertTrue(unbuilt.executed().isEmpty());
        }

        @Test
        @DisplayName("gated delegations are counted per unit")
        void gatedMetric() {
            supervisor.delegateToUnit("STUB_UNIT", message(Map.of()));
            supervisor.delegateToUnit("STUB_UNIT", message(Map.of()));

            assertEquals(2.0, fixture.meterRegistry.find("switchboard.delegation.gated")
                    .tag("unit", "STUB_UNIT").counter().count());
        }

        @Test
        @DisplayName("an unregistered unit yields FAILED")
        void unregisteredUnit() {
            Report report = supervisor.delegateToUnit("NOBODY", message(Map.of()));

            assertEquals(ReportStatus.FAILED, report.status());
            assertTrue(report.errors().get(0).contains("not registered"));
        }
    }

    // -- execute -----------------------------------------------------------

    @Nested
    @DisplayName("execute")
    class Execute {

        @Test
        @DisplayName("matching rule delegates to the operational unit")
        void ruleDelegation() {
            Report report = supervisor.execute(message(Map.of("task", "do the work")));

            assertEquals(ReportStatus.COMPLETED, report.status());
            assertEquals(1, worker.executed().size());
            assertEquals("WORKER", worker.executed().get(0).to());
        }

        @Test
        @DisplayName("handleDirect answers before any delegation")
        void directHandling() {
            Report report = supervisor.execute(message(Map.of("query", "ping", "task", "work")));

            assertEquals(Boolean.TRUE, report.data().get("pong"));
            assertTrue(worker.executed().isEmpty());
        }

        @Test
        @DisplayName("with no matching rule the sole executable unit gets the work")
        void soleExecutableFallback() {
            Report report = supervisor.execute(message(Map.of("task", "something else")));

            assertEquals(ReportStatus.COMPLETED, report.status());
            assertEquals(1, worker.executed().size());
        }

        @Test
        @DisplayName("with no rule and several executable units the supervisor fails")
        void ambiguousTarget() {
            supervisor.registerUnit(new RecordingUnit("SECOND_WORKER", UnitStatus.VERIFIED, "TEST_SUPERVISOR"));

            Report report = supervisor.execute(message(Map.of("task", "something else")));

            assertEquals(ReportStatus.FAILED, report.status());
            assertTrue(report.errors().get(0).startsWith("No delegation target"));
        }

        @Test
        @DisplayName("rejected output is retried then escalated")
        void qualityGateApplies() {
            supervisor.rejectEverything = true;

            Report report = supervisor.execute(message(Map.of("task", "work")));

            assertEquals(ReportStatus.BLOCKED, report.status());
            assertEquals(QualityGate.ESCALATION_REASON, report.reason());
            assertEquals(QualityGate.MAX_RETRIES + 1, worker.executed().size());
        }

        @Test
        @DisplayName("a paused supervisor answers BLOCKED without delegating")
        void paused() {
            fixture.swarmControl.pause("TEST_SUPERVISOR", "maintenance");

            Report report = supervisor.execute(message(Map.of("task", "work")));

            assertEquals(ReportStatus.BLOCKED, report.status());
            assertEquals(Supervisor.SUPERVISOR_PAUSED, report.reason());
            assertTrue(worker.executed().isEmpty());
        }
    }

    // -- signals -----------------------------------------------------------

    @Test
    @DisplayName("signals reach executable units only; the others are reported BLOCKED")
    void broadcastSignal() {
        Map<String, Report> results = supervisor.broadcastToUnits(Signal.of("lead.replied", "CRM", Map.of()));

        assertEquals(ReportStatus.COMPLETED, results.get("WORKER").status());
        assertEquals(ReportStatus.BLOCKED, results.get("STUB_UNIT").status());
        assertEquals(ReportStatus.BLOCKED, results.get("UNBUILT_UNIT").status());
        assertEquals(1, worker.signals().size());
        assertTrue(stub.signals().isEmpty());
        assertTrue(unbuilt.signals().isEmpty());
    }

    // -- capability reporting ----------------------------------------------

    @Test
    @DisplayName("capability report names the units that block it")
    void capabilityReport() {
        CapabilityReport report = supervisor.capabilityReport();

        assertEquals("TEST_SUPERVISOR", report.supervisor());
        assertTrue(report.actuallyWorks());
        assertEquals(3, report.units().size());
        assertEquals(List.of("STUB_UNIT (STUB)", "UNBUILT_UNIT (UNIMPLEMENTED)"), report.blockedBy());
        assertEquals(33, supervisor.selfReport().functionalWeight());
    }

    // -- cycles and requests -----------------------------------------------

    @Nested
    @DisplayName("cycles")
    class Cycles {

        @Test
        @DisplayName("runCycle applies owned mutations and loads incoming requests")
        void runCycle() {
            fixture.mutationPipeline.submit(new MutationDirective("dir_limit", "LIMIT", "test",
                    Map.of("limit", 9), "tuning", 70, "ANALYST"), StorePriority.MEDIUM);
            fixture.requestProtocol.requestFromSupervisor(new CrossSupervisorRequest(null, "ORCHESTRATOR",
                    "TEST_SUPERVISOR", "STATUS", "How are we doing?", Urgency.LOW, Map.of(), null));

            Report report = supervisor.runCycle();

            assertEquals(ReportStatus.COMPLETED, report.status());
            assertEquals(1, report.data().get("mutationsProcessed"));
            assertEquals(1L, report.data().get("mutationsApplied"));
            assertEquals(1, report.data().get("pendingRequests"));
            assertEquals(9, supervisor.limit);
            assertEquals(1, supervisor.pendingRequests().size());

            Report second = supervisor.runCycle();
            assertEquals(0, second.data().get("mutationsProcessed"));
        }

        @Test
        @DisplayName("a paused supervisor skips its cycle")
        void pausedCycle() {
            fixture.swarmControl.pauseAll("incident");

            Report report = supervisor.runCycle();

            assertEquals(ReportStatus.BLOCKED, report.status());
            assertEquals(Supervisor.SUPERVISOR_PAUSED, report.reason());
        }

        @Test
        @DisplayName("direct delivery queues the request and the store stays authoritative")
        void acceptRequestOverTransport() {
            UnitMessage message = fixture.transport.createMessage(MessageType.COMMAND, "ORCHESTRATOR",
                    "TEST_SUPERVISOR", Map.of("requestType", "STATUS", "urgency", "HIGH", "payload", Map.of("x", 1)));

            TransportAck ack = fixture.transport.send(message);

            assertTrue(ack.delivered());
            assertEquals(ReportStatus.PENDING, ack.report().status());
            assertEquals(1, supervisor.pendingRequests().size());
            assertEquals(Urgency.HIGH, supervisor.pendingRequests().get(0).urgency());

            // nothing was mirrored for this hand-made message, so reloading from the store clears it
            supervisor.readIncomingRequests();
            assertTrue(supervisor.pendingRequests().isEmpty());
        }

        @Test
        @DisplayName("responding removes the request from the pending list")
        void respondToRequest() {
            fixture.requestProtocol.requestFromSupervisor(new CrossSupervisorRequest(null, "ORCHESTRATOR",
                    "TEST_SUPERVISOR", "STATUS", null, Urgency.NORMAL, Map.of(), null));
            List<CrossSupervisorRequest> incoming = supervisor.readIncomingRequests();

            assertTrue(supervisor.respondToRequest(incoming.get(0).id(), Map.of("ok", true)));
            assertTrue(supervisor.pendingRequests().isEmpty());
            assertTrue(supervisor.readIncomingRequests().isEmpty());
        }

        @Test
        @DisplayName("a supervisor cannot send requests on behalf of another")
        void spoofedSender() {
            RequestReceipt receipt = supervisor.requestFromSupervisor(new CrossSupervisorRequest(null,
                    "ORCHESTRATOR", "CONTENT_MANAGER", "X", null, Urgency.NORMAL, Map.of(), null));

            assertFalse(receipt.sent());
        }

        @Test
        @DisplayName("outgoing requests are stamped with the sender id")
        void outgoingRequest() {
            RequestReceipt receipt = supervisor.requestFromSupervisor("CONTENT_MANAGER", "COPY_REFRESH",
                    "Need new copy", Urgency.HIGH, Map.of(), null);

            assertTrue(receipt.sent());
            List<CrossSupervisorRequest> incoming = fixture.requestProtocol.readIncomingRequests("CONTENT_MANAGER");
            assertEquals("TEST_SUPERVISOR", incoming.get(0).fromSupervisor());
        }
    }
}
