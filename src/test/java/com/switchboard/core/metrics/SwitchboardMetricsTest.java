package com.switchboard.core.metrics;

import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class SwitchboardMetricsTest {

    private SimpleMeterRegistry registry;
    private SwitchboardMetrics metrics;

    @BeforeEach
    void setUp() {
        registry = new SimpleMeterRegistry();
        metrics = new SwitchboardMetrics(registry);
    }

    @Test
    @DisplayName("recordDelegation creates a timer per unit and status")
    void recordDelegation() {
        metrics.recordDelegation("EMAIL_CHANNEL", "COMPLETED", 40);
        metrics.recordDelegation("EMAIL_CHANNEL", "COMPLETED", 60);
        metrics.recordDelegation("EMAIL_CHANNEL", "FAILED", 10);

        var completed = registry.find("switchboard.delegation.duration")
                .tag("unit", "EMAIL_CHANNEL").tag("status", "COMPLETED").timer();
        assertNotNull(completed);
        assertEquals(2, completed.count());
    }

    @Test
    @DisplayName("recordReviewResult increments the matching counter")
    void recordReviewResult() {
        metrics.recordReviewResult(true);
        metrics.recordReviewResult(false);
        metrics.recordReviewResult(false);

        assertEquals(1.0, registry.find("switchboard.quality_gate.reviews")
                .tag("result", "approved").counter().count());
        assertEquals(2.0, registry.find("switchboard.quality_gate.reviews")
                .tag("result", "rejected").counter().count());
    }

    @Test
    @DisplayName("mutation and request counters are tagged by outcome")
    void mutationAndRequestCounters() {
        metrics.recordMutation("FREQUENCY_CAP", true);
        metrics.recordMutation("FREQUENCY_CAP", false);
        metrics.recordCrossSupervisorRequest("COPY_REFRESH", false);

        assertEquals(1.0, registry.find("switchboard.mutations.total")
                .tag("type", "FREQUENCY_CAP").tag("applied", "true").counter().count());
        assertEquals(1.0, registry.find("switchboard.requests.total")
                .tag("delivered", "false").counter().count());
    }

    @Test
    @DisplayName("sequence counters track step attempts and outcomes")
    void sequenceCounters() {
        metrics.recordStepAttempt("SMS", "FAILED");
        metrics.recordStepAttempt("EMAIL", "COMPLETED");
        metrics.recordSequenceResult("COMPLETED");
        metrics.incrementEscalations("OUTREACH_MANAGER");

        assertEquals(1.0, registry.find("switchboard.sequence.step_attempts")
                .tag("channel", "SMS").tag("status", "FAILED").counter().count());
        assertEquals(1.0, registry.find("switchboard.sequences.total")
                .tag("status", "COMPLETED").counter().count());
        assertEquals(1.0, registry.find("switchboard.escalations.total")
                .tag("supervisor", "OUTREACH_MANAGER").counter().count());
    }
}
