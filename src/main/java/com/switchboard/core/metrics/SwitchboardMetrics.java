package com.switchboard.core.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Service;

import java.time.Duration;

/**
 * Centralised Micrometer metrics for delegation, quality gates and outreach sequences.
 */
@Service
public class SwitchboardMetrics {

    private final MeterRegistry registry;

    public SwitchboardMetrics(MeterRegistry registry) {
        this.registry = registry;
    }

    public void recordDelegation(String unitId, String status, long ms) {
        Timer.builder("switchboard.delegation.duration")
                .tag("unit", unitId)
                .tag("status", status)
                .register(registry)
                .record(Duration.ofMillis(ms));
    }

    public void recordGatedDelegation(String unitId, String unitStatus) {
        Counter.builder("switchboard.delegation.gated")
                .description("Delegations refused because the unit is not executable")
                .tag("unit", unitId)
                .tag("unitStatus", unitStatus)
                .register(registry)
                .increment();
    }

    public void recordReviewResult(boolean approved) {
        Counter.builder("switchboard.quality_gate.reviews")
                .tag("result", approved ? "approved" : "rejected")
                .register(registry)
                .increment();
    }

    public void incrementEscalations(String supervisorId) {
        Counter.builder("switchboard.escalations.total")
                .tag("supervisor", supervisorId)
                .register(registry)
                .increment();
    }

    public void recordMutation(String mutationType, boolean applied) {
        Counter.builder("switchboard.mutations.total")
                .tag("type", mutationType)
                .tag("applied", String.valueOf(applied))
                .register(registry)
                .increment();
    }

    public void recordCrossSupervisorRequest(String requestType, boolean delivered) {
        Counter.builder("switchboard.requests.total")
                .tag("type", requestType)
                .tag("delivered", String.valueOf(delivered))
                .register(registry)
                .increment();
    }

    /**
     * Records a single channel attempt within a sequence step.
     *
     * @param channel channel name, e.g. "EMAIL"
     * @param status  report status of the attempt
     */
    public void recordStepAttempt(String channel, String status) {
        Counter.builder("switchboard.sequence.step_attempts")
                .description("Channel attempts made by the sequence engine")
                .tag("channel", channel)
                .tag("status", status)
                .register(registry)
                .increment();
    }

    public void recordSequenceResult(String status) {
        Counter.builder("switchboard.sequences.total")
                .tag("status", status)
                .register(registry)
                .increment();
    }
}
