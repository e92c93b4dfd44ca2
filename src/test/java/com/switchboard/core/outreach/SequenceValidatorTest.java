package com.switchboard.core.outreach;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for {@link SequenceValidator}.
 */
class SequenceValidatorTest {

    private final SequenceValidator validator = new SequenceValidator();
    private final Lead lead = Lead.of("lead-1", "Ana", "ana@example.com", null);

    @Test
    void acceptsWellFormedSequence() {
        SequenceDefinition definition = new SequenceDefinition("ok", List.of(
                SequenceStep.of(1, Channel.EMAIL, "Hi"),
                new SequenceStep(2, Channel.SMS, 24, "Ping", Map.of(), Channel.EMAIL, 1)),
                new ComplianceSettings(true, 2, 5, 22, 7));

        assertDoesNotThrow(() -> validator.validate(definition, lead));
    }

    @Test
    void nullDefinition() {
        IllegalArgumentException ex = assertThrows(IllegalArgumentException.class,
                () -> validator.validate(null, lead));
        assertEquals("Sequence definition is required", ex.getMessage());
    }

    @Test
    @DisplayName("every problem is listed in one message")
    void listsAllProblems() {
        SequenceDefinition definition = new SequenceDefinition(" ", List.of(
                new SequenceStep(2, Channel.EMAIL, 0, "a", Map.of(), null, null),
                new SequenceStep(2, null, -1, " ", Map.of(), null, -3),
                new SequenceStep(3, Channel.SMS, 0, "c", Map.of(), Channel.SMS, null)),
                new ComplianceSettings(true, -1, null, 24, null));

        IllegalArgumentException ex = assertThrows(IllegalArgumentException.class,
                () -> validator.validate(definition, Lead.of(null, null, null, null)));

        String message = ex.getMessage();
        assertTrue(message.startsWith("Invalid sequence: sequenceId is required; "));
        assertTrue(message.contains("step 2: step numbers must be positive and strictly increasing"));
        assertTrue(message.contains("step 2: channel is required"));
        assertTrue(message.contains("step 2: delayHours must not be negative"));
        assertTrue(message.contains("step 2: template is required"));
        assertTrue(message.contains("step 2: fallbackDelayHours must not be negative"));
        assertTrue(message.contains("step 3: fallbackChannel must differ from channel"));
        assertTrue(message.contains("quietHoursStart must be within 0..23"));
        assertTrue(message.contains("maxContactsPerDay must not be negative"));
        assertTrue(message.endsWith("lead id is required"));
    }

    @Test
    void emptyStepsRejected() {
        IllegalArgumentException ex = assertThrows(IllegalArgumentException.class,
                () -> validator.validate(new SequenceDefinition("s", null, null), lead));
        assertTrue(ex.getMessage().contains("at least one step"));
    }
}
