package com.switchboard.core.supervisor;

import com.switchboard.core.model.DelegationRule;
import com.switchboard.core.registry.UnitId;
import org.springframework.stereotype.Service;

import java.util.List;

/**
 * Owns the content units. None of them are built yet, so every delegation here comes back
 * BLOCKED; the supervisor still takes part in cycles and cross-supervisor requests.
 */
@Service
public class ContentSupervisor extends Supervisor {

    private static final List<DelegationRule> RULES = List.of(
            DelegationRule.of(UnitId.SUBJECT_LINE_WRITER.name(), 10, "subject", "headline"),
            DelegationRule.of(UnitId.COPYWRITER.name(), 10, "copy", "body", "hook"));

    public ContentSupervisor(SupervisorContext context) {
        super(UnitId.CONTENT_MANAGER.identity(), context);
    }

    @Override
    protected List<DelegationRule> delegationRules() {
        return RULES;
    }
}
