package com.switchboard.core.mutation;

import com.switchboard.core.metrics.SwitchboardMetrics;
import com.switchboard.core.model.MutationDirective;
import com.switchboard.core.model.MutationResult;
import com.switchboard.core.store.SharedStore;
import com.switchboard.core.store.StoreCategory;
import com.switchboard.core.store.StoreEntry;
import com.switchboard.core.store.StorePriority;
import com.switchboard.core.store.StoreQuery;
import com.switchboard.core.store.WriteOptions;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.function.Function;

/**
 * Moves mutation directives from producers to the supervisors that own their type.
 * <p>
 * A directive is applied at most once. The "processed" mark on the source entry is the only
 * idempotency mechanism, so it is the last write for each directive and processed entries are
 * excluded from every later query.
 */
@Service
public class MutationPipeline {

    private static final Logger log = LoggerFactory.getLogger(MutationPipeline.class);

    static final String DIRECTIVE_TAG = "mutation-directive";
    static final String PROCESSED_TAG = "processed";
    static final String LOG_TAG = "mutation-log";

    private final SharedStore store;
    private final SwitchboardMetrics metrics;
    private final Clock clock;

    public MutationPipeline(SharedStore store, SwitchboardMetrics metrics, Clock clock) {
        this.store = store;
        this.metrics = metrics;
        this.clock = clock;
    }

    /**
     * Stores a directive for its owning supervisor's next cycle. Re-submitting an id overwrites the
     * pending directive; an already processed one stays processed.
     */
    public StoreEntry submit(MutationDirective directive, StorePriority priority) {
        var existing = store.read(StoreCategory.STRATEGY, directive.id(), directive.sourceAgent());
        if (existing.isPresent() && isProcessed(existing.get())) {
            log.info("Directive {} already processed; ignoring resubmission", directive.id());
            return existing.get();
        }
        Map<String, Object> value = new LinkedHashMap<>();
        value.put("id", directive.id());
        value.put("type", directive.type());
        value.put("targetDomain", directive.targetDomain());
        value.put("parameters", directive.parameters());
        value.put("reason", directive.reason());
        value.put("confidence", directive.confidence());
        value.put("sourceAgent", directive.sourceAgent());
        value.put("processed", false);
        return store.write(StoreCategory.STRATEGY, directive.id(), value, directive.sourceAgent(),
                WriteOptions.of(priority != null ? priority : StorePriority.MEDIUM,
                        DIRECTIVE_TAG, directive.type().toLowerCase(Locale.ROOT)));
    }

    /**
     * Applies every unprocessed directive of an owned type, highest priority first.
     * A failure on one directive is recorded in its result and does not stop the batch.
     */
    public List<MutationResult> readAndApplyMutations(String supervisorId, Set<String> ownedTypes,
                                                      Function<MutationDirective, MutationResult> applier) {
        if (ownedTypes == null || ownedTypes.isEmpty()) {
            return List.of();
        }
        List<StoreEntry> pending = store.query(supervisorId, StoreQuery.builder()
                .category(StoreCategory.STRATEGY)
                .tags(DIRECTIVE_TAG)
                .excludeTags(PROCESSED_TAG)
                .sortBy(StoreQuery.SortBy.PRIORITY, true)
                .limit(Integer.MAX_VALUE)
                .build());

        List<MutationResult> results = new ArrayList<>();
        for (StoreEntry entry : pending) {
            if (isProcessed(entry) || !ownedTypes.contains(entry.stringValue("type"))) {
                continue;
            }
            results.add(applyOne(supervisorId, entry, applier));
        }
        if (!results.isEmpty()) {
            log.info("{} processed {} mutation directive(s)", supervisorId, results.size());
        }
        return results;
    }

    private MutationResult applyOne(String supervisorId, StoreEntry entry,
                                    Function<MutationDirective, MutationResult> applier) {
        String directiveId = entry.key();
        String type = entry.stringValue("type");
        MutationResult result;
        try {
            result = applier.apply(toDirective(entry));
        } catch (RuntimeException e) {
            log.warn("Directive {} ({}) could not be applied by {}: {}", directiveId, type, supervisorId, e.getMessage());
            result = new MutationResult(directiveId, type, false, Map.of(), Map.of(), e.getMessage());
        }

        try {
            writeAuditEntry(supervisorId, directiveId, result);
            markProcessed(supervisorId, entry);
        } catch (RuntimeException e) {
            log.error("Directive {} audit/mark failed for {}; it will be retried next cycle: {}",
                    directiveId, supervisorId, e.getMessage(), e);
            result = new MutationResult(directiveId, type, false, result.beforeState(), result.afterState(),
                    "Not recorded: " + e.getMessage());
        }
        metrics.recordMutation(type, result.applied());
        return result;
    }

    private void writeAuditEntry(String supervisorId, String directiveId, MutationResult result) {
        Map<String, Object> audit = new LinkedHashMap<>();
        audit.put("sourceDirectiveId", directiveId);
        audit.put("mutationType", result.mutationType());
        audit.put("beforeState", result.beforeState());
        audit.put("afterState", result.afterState());
        audit.put("applied", result.applied());
        audit.put("error", result.error());
        audit.put("appliedBy", supervisorId);
        audit.put("appliedAt", clock.instant().toString());
        String typeTag = result.mutationType() != null ? result.mutationType().toLowerCase(Locale.ROOT) : "unknown";
        store.write(StoreCategory.WORKFLOW, "mutation_log_" + directiveId, audit, supervisorId,
                WriteOptions.of(StorePriority.MEDIUM, LOG_TAG, typeTag));
    }

    private void markProcessed(String supervisorId, StoreEntry entry) {
        Map<String, Object> value = new LinkedHashMap<>(entry.value());
        value.put("processed", true);
        value.put("processedBy", supervisorId);
        value.put("processedAt", clock.instant().toString());
        List<String> tags = new ArrayList<>(entry.tags());
        if (!tags.contains(PROCESSED_TAG)) {
            tags.add(PROCESSED_TAG);
        }
        store.write(StoreCategory.STRATEGY, entry.key(), value, supervisorId,
                new WriteOptions(entry.priority(), tags));
    }

    private static boolean isProcessed(StoreEntry entry) {
        return entry.hasTag(PROCESSED_TAG) || entry.booleanValue("processed");
    }

    @SuppressWarnings("unchecked")
    static MutationDirective toDirective(StoreEntry entry) {
        Map<String, Object> value = entry.value();
        Object params = value.get("parameters");
        Object confidence = value.get("confidence");
        return new MutationDirective(
                entry.key(),
                entry.stringValue("type"),
                entry.stringValue("targetDomain"),
                params instanceof Map<?, ?> m ? (Map<String, Object>) m : Map.of(),
                entry.stringValue("reason"),
                confidence instanceof Number n ? n.intValue() : 0,
                entry.stringValue("sourceAgent"));
    }
}
