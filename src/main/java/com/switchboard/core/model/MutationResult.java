package com.switchboard.core.model;

import java.io.Serializable;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Outcome of applying one {@link MutationDirective}, with before/after state for the audit log.
 */
public record MutationResult(
    String directiveId,
    String mutationType,
    boolean applied,
    Map<String, Object> beforeState,
    Map<String, Object> afterState,
    String error
) implements Serializable {

    public MutationResult {
        beforeState = beforeState != null ? Collections.unmodifiableMap(new LinkedHashMap<>(beforeState)) : Map.of();
        afterState = afterState != null ? Collections.unmodifiableMap(new LinkedHashMap<>(afterState)) : Map.of();
    }

    public static MutationResult notApplied(MutationDirective directive, String error) {
        return new MutationResult(directive.id(), directive.type(), false, Map.of(), Map.of(), error);
    }
}
