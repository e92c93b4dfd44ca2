package com.switchboard.core.outreach;

public enum SequenceStatus {
    IN_PROGRESS,
    COMPLETED,
    BLOCKED,
    FAILED;

    public boolean isTerminal() {
        return this != IN_PROGRESS;
    }
}
