package com.switchboard.core.store;

import com.switchboard.core.model.Urgency;

/**
 * Priority of a store entry. Higher {@link #rank()} sorts first in descending queries.
 */
public enum StorePriority {
    LOW(1),
    MEDIUM(2),
    HIGH(3),
    CRITICAL(4);

    private final int rank;

    StorePriority(int rank) {
        this.rank = rank;
    }

    public int rank() {
        return rank;
    }

    public static StorePriority fromUrgency(Urgency urgency) {
        if (urgency == null) {
            return MEDIUM;
        }
        return switch (urgency) {
            case CRITICAL -> CRITICAL;
            case HIGH -> HIGH;
            default -> MEDIUM;
        };
    }

    public Urgency toUrgency() {
        return switch (this) {
            case CRITICAL -> Urgency.CRITICAL;
            case HIGH -> Urgency.HIGH;
            case LOW -> Urgency.LOW;
            default -> Urgency.NORMAL;
        };
    }
}
