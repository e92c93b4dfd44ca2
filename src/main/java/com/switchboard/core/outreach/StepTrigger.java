package com.switchboard.core.outreach;

import java.time.Instant;
import java.util.List;

/**
 * Boundary to whatever re-invokes the engine once a step's delay has elapsed. The engine never
 * sleeps; it schedules here and is driven again through {@code resumeDue}.
 */
public interface StepTrigger {

    /**
     * Schedules a step, replacing any earlier schedule for the same sequence and lead.
     */
    void schedule(ScheduledStep step);

    /**
     * Removes and returns every step due at or before {@code now}, earliest first.
     */
    List<ScheduledStep> takeDue(Instant now);

    /**
     * Drops the scheduled step of a sequence for a lead, if any.
     *
     * @return true when a step was removed
     */
    boolean cancel(String sequenceId, String leadId);

    List<ScheduledStep> pending();
}
