package com.switchboard.core.outreach;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.switchboard.core.registry.UnitId;

import java.util.Locale;

/**
 * Contact channel, each backed by one channel unit.
 */
public enum Channel {
    EMAIL(UnitId.EMAIL_CHANNEL),
    SMS(UnitId.SMS_CHANNEL),
    LINKEDIN(UnitId.LINKEDIN_CHANNEL),
    PHONE(UnitId.PHONE_CHANNEL);

    private final UnitId unitId;

    Channel(UnitId unitId) {
        this.unitId = unitId;
    }

    public String unitId() {
        return unitId.name();
    }

    /**
     * Case-insensitive lookup used when binding sequence documents.
     */
    @JsonCreator
    public static Channel fromValue(String value) {
        if (value == null || value.isBlank()) {
            return null;
        }
        try {
            return valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Unknown channel: " + value);
        }
    }
}
