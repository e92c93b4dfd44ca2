package com.switchboard.core.outreach;

import java.time.Instant;

/**
 * A deferred step waiting for its delay to elapse.
 */
public record ScheduledStep(String sequenceId, String leadId, int stepNumber, Instant dueAt) {}
