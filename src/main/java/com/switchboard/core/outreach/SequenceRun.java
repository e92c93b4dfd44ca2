package com.switchboard.core.outreach;

/**
 * What the engine persists per (sequence, lead): the definition it started with, the lead as
 * given, and the execution state.
 */
public record SequenceRun(SequenceDefinition definition, Lead lead, SequenceExecution execution) {

    SequenceRun withExecution(SequenceExecution next) {
        return new SequenceRun(definition, lead, next);
    }
}
