package com.switchboard.core.model;

/**
 * Urgency of a message or cross-supervisor request.
 */
public enum Urgency {
    LOW,
    NORMAL,
    HIGH,
    CRITICAL
}
