package com.switchboard.core.model;

import java.io.Serializable;
import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * A structured request from one supervisor to another. Delivered over the transport and mirrored
 * into the shared store so the receiver picks it up on its next cycle even if delivery is missed.
 *
 * @param id             store key of the mirrored record; null before it is sent
 * @param fromSupervisor requesting supervisor
 * @param toSupervisor   receiving supervisor
 * @param requestType    short request type (e.g. "COPY_REFRESH")
 * @param description    free-text description
 * @param urgency        request urgency
 * @param payload        request data
 * @param deadline       optional response deadline
 */
public record CrossSupervisorRequest(
    String id,
    String fromSupervisor,
    String toSupervisor,
    String requestType,
    String description,
    Urgency urgency,
    Map<String, Object> payload,
    Instant deadline
) implements Serializable {

    public CrossSupervisorRequest {
        urgency = urgency != null ? urgency : Urgency.NORMAL;
        payload = payload != null ? Collections.unmodifiableMap(new LinkedHashMap<>(payload)) : Map.of();
    }
}
