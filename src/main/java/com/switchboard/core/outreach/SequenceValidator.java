package com.switchboard.core.outreach;

import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Rejects malformed sequence documents before any step runs.
 */
@Component
public class SequenceValidator {

    /**
     * @throws IllegalArgumentException listing every problem found
     */
    public void validate(SequenceDefinition definition, Lead lead) {
        List<String> problems = new ArrayList<>();
        if (definition == null) {
            throw new IllegalArgumentException("Sequence definition is required");
        }
        if (definition.sequenceId() == null || definition.sequenceId().isBlank()) {
            problems.add("sequenceId is required");
        }
        if (definition.steps().isEmpty()) {
            problems.add("sequence must have at least one step");
        }
        int previous = 0;
        for (SequenceStep step : definition.steps()) {
            String label = "step " + step.stepNumber();
            if (step.stepNumber() <= previous) {
                problems.add(label + ": step numbers must be positive and strictly increasing");
            }
            previous = step.stepNumber();
            if (step.channel() == null) {
                problems.add(label + ": channel is required");
            }
            if (step.delayHours() < 0) {
                problems.add(label + ": delayHours must not be negative");
            }
            if (step.template() == null || step.template().isBlank()) {
                problems.add(label + ": template is required");
            }
            if (step.fallbackChannel() != null && step.fallbackChannel() == step.channel()) {
                problems.add(label + ": fallbackChannel must differ from channel");
            }
            if (step.fallbackDelayHours() != null && step.fallbackDelayHours() < 0) {
                problems.add(label + ": fallbackDelayHours must not be negative");
            }
        }
        ComplianceSettings settings = definition.complianceSettings();
        checkHour(problems, "quietHoursStart", settings.quietHoursStart());
        checkHour(problems, "quietHoursEnd", settings.quietHoursEnd());
        if (settings.maxContactsPerDay() != null && settings.maxContactsPerDay() < 0) {
            problems.add("maxContactsPerDay must not be negative");
        }
        if (settings.maxContactsPerWeek() != null && settings.maxContactsPerWeek() < 0) {
            problems.add("maxContactsPerWeek must not be negative");
        }
        if (lead == null || lead.id() == null || lead.id().isBlank()) {
            problems.add("lead id is required");
        }
        if (!problems.isEmpty()) {
            throw new IllegalArgumentException("Invalid sequence: " + String.join("; ", problems));
        }
    }

    private static void checkHour(List<String> problems, String name, Integer hour) {
        if (hour != null && (hour < 0 || hour > 23)) {
            problems.add(name + " must be within 0..23");
        }
    }
}
