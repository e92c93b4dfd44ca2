package com.switchboard.core.model;

import java.io.Serializable;
import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.UUID;

/**
 * A structured message addressed to a single unit. Consumed exactly once by the addressee.
 *
 * @param id               unique message id
 * @param type             command, event or query
 * @param from             sender unit id
 * @param to               addressee unit id
 * @param payload          opaque structured data
 * @param priority         delivery urgency
 * @param requiresResponse whether the sender expects a {@link Report}
 * @param traceId          correlation id shared across retries and hops
 * @param timestamp        creation time
 */
public record UnitMessage(
    String id,
    MessageType type,
    String from,
    String to,
    Map<String, Object> payload,
    Urgency priority,
    boolean requiresResponse,
    String traceId,
    Instant timestamp
) implements Serializable {

    public UnitMessage {
        Objects.requireNonNull(id, "id must not be null");
        type = type != null ? type : MessageType.COMMAND;
        payload = payload != null ? Collections.unmodifiableMap(new LinkedHashMap<>(payload)) : Map.of();
        priority = priority != null ? priority : Urgency.NORMAL;
        traceId = traceId != null ? traceId : id;
        timestamp = timestamp != null ? timestamp : Instant.now();
    }

    /**
     * Creates a command that expects a response, with a generated id.
     */
    public static UnitMessage command(String from, String to, Map<String, Object> payload) {
        String id = "msg_" + UUID.randomUUID();
        return new UnitMessage(id, MessageType.COMMAND, from, to, payload, Urgency.NORMAL, true, id, Instant.now());
    }

    /**
     * Returns a copy of this message with a new id and payload, keeping sender, addressee and trace.
     */
    public UnitMessage withPayload(String newId, Map<String, Object> newPayload) {
        return new UnitMessage(newId, type, from, to, newPayload, priority, requiresResponse, traceId, Instant.now());
    }

    /**
     * Returns a copy readdressed to another unit.
     */
    public UnitMessage redirectTo(String newTo) {
        return new UnitMessage(id, type, from, newTo, payload, priority, requiresResponse, traceId, timestamp);
    }

    public UnitMessage withPriority(Urgency newPriority) {
        return new UnitMessage(id, type, from, to, payload, newPriority, requiresResponse, traceId, timestamp);
    }

    /**
     * Payload merged with the given entries; later entries win.
     */
    public Map<String, Object> payloadWith(Map<String, Object> extra) {
        var merged = new LinkedHashMap<String, Object>(payload);
        merged.putAll(extra);
        return merged;
    }
}
