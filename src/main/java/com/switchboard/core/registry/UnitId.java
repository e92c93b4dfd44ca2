package com.switchboard.core.registry;

import com.switchboard.core.model.UnitIdentity;
import com.switchboard.core.model.UnitRole;
import com.switchboard.core.model.UnitStatus;

import java.util.Optional;
import java.util.Set;

/**
 * Closed set of components known to the system, with their static identity.
 */
public enum UnitId {

    ORCHESTRATOR("Orchestrator", UnitRole.SUPERVISOR, UnitStatus.OPERATIONAL, null,
            Set.of("routing", "escalation-intake")),
    OUTREACH_MANAGER("Outreach Manager", UnitRole.SUPERVISOR, UnitStatus.OPERATIONAL, "ORCHESTRATOR",
            Set.of("sequences", "compliance", "channel-escalation")),
    CONTENT_MANAGER("Content Manager", UnitRole.SUPERVISOR, UnitStatus.OPERATIONAL, "ORCHESTRATOR",
            Set.of("content-requests")),

    EMAIL_CHANNEL("Email Channel", UnitRole.LEAF, UnitStatus.OPERATIONAL, "OUTREACH_MANAGER",
            Set.of("email")),
    SMS_CHANNEL("SMS Channel", UnitRole.LEAF, UnitStatus.OPERATIONAL, "OUTREACH_MANAGER",
            Set.of("sms")),
    LINKEDIN_CHANNEL("LinkedIn Channel", UnitRole.LEAF, UnitStatus.STUB, "OUTREACH_MANAGER",
            Set.of("linkedin")),
    PHONE_CHANNEL("Phone Channel", UnitRole.LEAF, UnitStatus.UNIMPLEMENTED, "OUTREACH_MANAGER",
            Set.of("phone")),

    COPYWRITER("Copywriter", UnitRole.LEAF, UnitStatus.STUB, "CONTENT_MANAGER",
            Set.of("copy")),
    SUBJECT_LINE_WRITER("Subject Line Writer", UnitRole.LEAF, UnitStatus.UNIMPLEMENTED, "CONTENT_MANAGER",
            Set.of("subject-lines"));

    private final UnitIdentity identity;

    UnitId(String displayName, UnitRole role, UnitStatus status, String reportsTo, Set<String> capabilities) {
        this.identity = new UnitIdentity(name(), displayName, role, status, reportsTo, capabilities);
    }

    public UnitIdentity identity() {
        return identity;
    }

    /**
     * Looks up an id without throwing; unknown or null ids yield empty.
     */
    public static Optional<UnitId> parse(String id) {
        if (id == null || id.isBlank()) {
            return Optional.empty();
        }
        for (UnitId candidate : values()) {
            if (candidate.name().equals(id)) {
                return Optional.of(candidate);
            }
        }
        return Optional.empty();
    }
}
