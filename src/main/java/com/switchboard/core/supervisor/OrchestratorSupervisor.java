package com.switchboard.core.supervisor;

import com.switchboard.core.model.DelegationRule;
import com.switchboard.core.model.Report;
import com.switchboard.core.model.UnitMessage;
import com.switchboard.core.registry.UnitId;
import com.switchboard.core.store.StoreCategory;
import com.switchboard.core.store.StoreEntry;
import com.switchboard.core.store.StoreQuery;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Root authority. Routes top-level work to the domain supervisors and is the addressee of
 * quality-gate escalations.
 */
@Service
public class OrchestratorSupervisor extends Supervisor {

    private static final List<DelegationRule> RULES = List.of(
            DelegationRule.of(UnitId.OUTREACH_MANAGER.name(), 10, "sequence", "outreach", "lead", "email", "sms"),
            DelegationRule.of(UnitId.CONTENT_MANAGER.name(), 5, "content", "copy", "subject", "headline"));

    public OrchestratorSupervisor(SupervisorContext context) {
        super(UnitId.ORCHESTRATOR.identity(), context);
    }

    @Override
    protected List<DelegationRule> delegationRules() {
        return RULES;
    }

    /**
     * Answers {@code {"query": "escalations"}} itself.
     */
    @Override
    protected Optional<Report> handleDirect(UnitMessage message) {
        if ("escalations".equals(message.payload().get("query"))) {
            List<Map<String, Object>> open = readEscalations().stream()
                    .map(e -> Map.<String, Object>of("key", e.key(), "from", String.valueOf(e.stringValue("fromAgent")),
                            "body", e.value().getOrDefault("body", Map.of())))
                    .toList();
            return Optional.of(Report.completed(message.id(), id(), Map.of("escalations", open)));
        }
        return Optional.empty();
    }

    /**
     * Unanswered escalations addressed to this unit, highest priority first.
     */
    public List<StoreEntry> readEscalations() {
        return context.store().query(id(), StoreQuery.builder()
                        .category(StoreCategory.CROSS_AGENT)
                        .tags("escalation")
                        .sortBy(StoreQuery.SortBy.PRIORITY, true)
                        .build())
                .stream()
                .filter(e -> id().equals(e.stringValue("toAgent")))
                .filter(e -> !e.booleanValue("responded"))
                .toList();
    }
}
