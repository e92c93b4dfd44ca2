package com.switchboard.core.outreach;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Progress of one sequence against one lead. Transitions return new instances and refuse to
 * move an execution that has already reached a terminal status.
 *
 * @param currentStep number of steps already executed, i.e. the index of the next step
 * @param reasons     block or failure reasons once terminal
 */
public record SequenceExecution(
    String sequenceId,
    String leadId,
    int currentStep,
    int totalSteps,
    SequenceStatus status,
    List<StepResult> stepResults,
    List<String> reasons,
    Instant startedAt,
    Instant updatedAt,
    Instant completedAt
) {

    public SequenceExecution {
        stepResults = stepResults != null ? List.copyOf(stepResults) : List.of();
        reasons = reasons != null ? List.copyOf(reasons) : List.of();
    }

    public static SequenceExecution start(String sequenceId, String leadId, int totalSteps, Instant now) {
        return new SequenceExecution(sequenceId, leadId, 0, totalSteps, SequenceStatus.IN_PROGRESS,
                List.of(), List.of(), now, now, null);
    }

    public SequenceExecution recordStep(StepResult result, Instant now) {
        requireActive();
        List<StepResult> results = new ArrayList<>(stepResults);
        results.add(result);
        return new SequenceExecution(sequenceId, leadId, currentStep + 1, totalSteps, status,
                results, reasons, startedAt, now, null);
    }

    public SequenceExecution finish(SequenceStatus terminal, List<String> terminalReasons, Instant now) {
        requireActive();
        if (!terminal.isTerminal()) {
            throw new IllegalArgumentException(terminal + " is not a terminal status");
        }
        return new SequenceExecution(sequenceId, leadId, currentStep, totalSteps, terminal,
                stepResults, terminalReasons, startedAt, now, now);
    }

    public boolean hasEnded() {
        return status.isTerminal();
    }

    private void requireActive() {
        if (status.isTerminal()) {
            throw new IllegalStateException("Sequence " + sequenceId + " for lead " + leadId
                    + " is already " + status);
        }
    }
}
