package com.switchboard.core.outreach;

import com.switchboard.core.model.Report;
import com.switchboard.core.model.ReportStatus;
import com.switchboard.core.registry.UnitId;
import com.switchboard.core.store.SharedStore;
import com.switchboard.core.store.StoreCategory;
import com.switchboard.core.store.StoreEntry;
import com.switchboard.core.store.StorePriority;
import com.switchboard.core.store.StoreQuery;
import com.switchboard.core.store.WriteOptions;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Every channel attempt the engine makes, keyed {@code contact_<sequence>_<lead>_<step>_<channel>}.
 * Only COMPLETED attempts count towards the frequency caps.
 */
@Component
public class ContactHistory {

    static final String TAG = "contact-history";

    private static final String WRITER = UnitId.OUTREACH_MANAGER.name();

    private final SharedStore store;
    private final Clock clock;

    public ContactHistory(SharedStore store, Clock clock) {
        this.store = store;
        this.clock = clock;
    }

    public void record(String sequenceId, String leadId, int stepNumber, Channel channel,
                       boolean fallback, Report report) {
        Map<String, Object> value = new LinkedHashMap<>();
        value.put("sequenceId", sequenceId);
        value.put("leadId", leadId);
        value.put("stepNumber", stepNumber);
        value.put("channel", channel.name());
        value.put("fallback", fallback);
        value.put("status", report.status().name());
        value.put("errors", report.errors());
        value.put("providerMessageId", report.data().get("providerMessageId"));
        value.put("attemptedAt", clock.instant().toString());
        String key = "contact_" + sequenceId + "_" + leadId + "_" + stepNumber + "_" + channel.name();
        store.write(StoreCategory.WORKFLOW, key, value, WRITER,
                WriteOptions.of(StorePriority.MEDIUM, TAG, "lead:" + leadId));
    }

    public long countContactsSince(String leadId, Instant since) {
        List<StoreEntry> entries = store.query(WRITER, StoreQuery.builder()
                .category(StoreCategory.WORKFLOW)
                .tags("lead:" + leadId)
                .limit(Integer.MAX_VALUE)
                .build());
        return entries.stream()
                .filter(e -> e.hasTag(TAG))
                .filter(e -> ReportStatus.COMPLETED.name().equals(e.stringValue("status")))
                .filter(e -> !e.updatedAt().isBefore(since))
                .count();
    }
}
