package com.switchboard.core.model;

import java.io.Serializable;
import java.util.List;

/**
 * Routes a message to a unit when any trigger keyword appears in its payload.
 * Rules are evaluated by descending priority; on a tie the rule declared first wins.
 */
public record DelegationRule(
    List<String> triggerKeywords,
    String delegateTo,
    int priority,
    boolean requiresApproval
) implements Serializable {

    public DelegationRule {
        triggerKeywords = triggerKeywords != null ? List.copyOf(triggerKeywords) : List.of();
    }

    public static DelegationRule of(String delegateTo, int priority, String... keywords) {
        return new DelegationRule(List.of(keywords), delegateTo, priority, false);
    }
}
