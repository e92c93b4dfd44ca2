package com.switchboard.core.outreach;

import com.switchboard.core.model.ReportStatus;

import java.time.Instant;
import java.util.List;

/**
 * Outcome of one sequence step, after any fallback attempt.
 *
 * @param channel      channel whose result decided the step
 * @param fallbackUsed whether the fallback channel was attempted
 * @param errors       reasons from the deciding attempt
 */
public record StepResult(
    int stepNumber,
    Channel channel,
    ReportStatus status,
    boolean fallbackUsed,
    List<String> errors,
    Instant executedAt
) {

    public StepResult {
        errors = errors != null ? List.copyOf(errors) : List.of();
    }
}
