package com.switchboard.core.model;

import java.io.Serializable;
import java.util.List;

/**
 * Verdict of a supervisor's review of a delegated result. Produced fresh per attempt.
 */
public record ReviewResult(
    boolean approved,
    List<String> feedback,
    ReviewSeverity severity
) implements Serializable {

    public ReviewResult {
        feedback = feedback != null ? List.copyOf(feedback) : List.of();
        severity = severity != null ? severity : (approved ? ReviewSeverity.PASS : ReviewSeverity.MAJOR);
    }

    public static ReviewResult pass() {
        return new ReviewResult(true, List.of(), ReviewSeverity.PASS);
    }

    public static ReviewResult reject(ReviewSeverity severity, List<String> feedback) {
        return new ReviewResult(false, feedback, severity);
    }
}
