package com.switchboard.core.model;

import java.io.Serializable;
import java.util.Objects;
import java.util.Set;

/**
 * Static identity of a capability unit, fixed at process start.
 *
 * @param id           stable unique identifier (e.g. "EMAIL_CHANNEL")
 * @param displayName  human-readable name
 * @param role         leaf or supervisor
 * @param status       capability-readiness level
 * @param reportsTo    id of the owning supervisor, null for the root authority
 * @param capabilities free-form capability tags
 */
public record UnitIdentity(
    String id,
    String displayName,
    UnitRole role,
    UnitStatus status,
    String reportsTo,
    Set<String> capabilities
) implements Serializable {

    public UnitIdentity {
        Objects.requireNonNull(id, "id must not be null");
        Objects.requireNonNull(role, "role must not be null");
        Objects.requireNonNull(status, "status must not be null");
        displayName = displayName != null ? displayName : id;
        capabilities = capabilities != null ? Set.copyOf(capabilities) : Set.of();
    }
}
