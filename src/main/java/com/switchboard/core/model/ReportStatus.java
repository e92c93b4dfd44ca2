package com.switchboard.core.model;

/**
 * Outcome of a unit invocation.
 */
public enum ReportStatus {
    COMPLETED,
    FAILED,
    BLOCKED,  // policy or capability denial, always carries reasons
    PENDING   // scheduled but not yet executed
}
