package com.switchboard.core.model;

import java.io.Serializable;
import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.UUID;

/**
 * An event broadcast to units through {@code handleSignal}.
 *
 * @param id        unique signal id
 * @param type      signal type (e.g. "lead.replied", "swarm.resumed")
 * @param origin    unit that raised the signal
 * @param payload   arbitrary key-value data
 * @param createdAt creation time
 */
public record Signal(
    String id,
    String type,
    String origin,
    Map<String, Object> payload,
    Instant createdAt
) implements Serializable {

    public Signal {
        payload = payload != null ? Collections.unmodifiableMap(new LinkedHashMap<>(payload)) : Map.of();
        createdAt = createdAt != null ? createdAt : Instant.now();
    }

    public static Signal of(String type, String origin, Map<String, Object> payload) {
        return new Signal("sig_" + UUID.randomUUID(), type, origin, payload, Instant.now());
    }
}
