package com.switchboard.core.model;

import java.io.Serializable;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * An externally authored instruction to adjust a supervisor's operating parameters.
 * Applied at most once; {@link #id} is the idempotency key.
 *
 * @param id           directive identifier
 * @param type         mutation type (e.g. "FREQUENCY_CAP")
 * @param targetDomain supervisor domain the directive is aimed at
 * @param parameters   type-specific parameters
 * @param reason       why the producer wants the change
 * @param confidence   producer confidence, 0..100
 * @param sourceAgent  unit that authored the directive
 */
public record MutationDirective(
    String id,
    String type,
    String targetDomain,
    Map<String, Object> parameters,
    String reason,
    int confidence,
    String sourceAgent
) implements Serializable {

    public MutationDirective {
        Objects.requireNonNull(id, "id must not be null");
        Objects.requireNonNull(type, "type must not be null");
        if (confidence < 0 || confidence > 100) {
            throw new IllegalArgumentException("confidence must be within [0,100], was " + confidence);
        }
        parameters = parameters != null ? Collections.unmodifiableMap(new LinkedHashMap<>(parameters)) : Map.of();
    }
}
