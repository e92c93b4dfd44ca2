package com.switchboard.core.model;

public enum ReviewSeverity {
    PASS,
    MINOR,
    MAJOR,
    BLOCK
}
