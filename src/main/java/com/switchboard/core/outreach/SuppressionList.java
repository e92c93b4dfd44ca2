package com.switchboard.core.outreach;

import com.switchboard.core.registry.UnitId;
import com.switchboard.core.store.SharedStore;
import com.switchboard.core.store.StoreCategory;
import com.switchboard.core.store.StoreEntry;
import com.switchboard.core.store.StorePriority;
import com.switchboard.core.store.WriteOptions;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Do-not-contact and unsubscribe flags, kept as lead profiles in the shared store under
 * {@code suppression_<leadId>}.
 */
@Component
public class SuppressionList {

    private static final String WRITER = UnitId.OUTREACH_MANAGER.name();

    private final SharedStore store;
    private final Clock clock;

    public SuppressionList(SharedStore store, Clock clock) {
        this.store = store;
        this.clock = clock;
    }

    public boolean isDoNotContact(String leadId) {
        return find(leadId).map(e -> e.booleanValue("doNotContact")).orElse(false);
    }

    public boolean isUnsubscribed(String leadId) {
        return find(leadId).map(e -> e.booleanValue("unsubscribed")).orElse(false);
    }

    public void markDoNotContact(String leadId, String reason) {
        update(leadId, "doNotContact", reason);
    }

    public void markUnsubscribed(String leadId, String reason) {
        update(leadId, "unsubscribed", reason);
    }

    private Optional<StoreEntry> find(String leadId) {
        return store.read(StoreCategory.PROFILE, key(leadId), WRITER);
    }

    private void update(String leadId, String flag, String reason) {
        Map<String, Object> value = new LinkedHashMap<>(find(leadId).map(StoreEntry::value).orElse(Map.of()));
        value.put("leadId", leadId);
        value.put(flag, true);
        value.put(flag + "Reason", reason);
        value.put(flag + "At", clock.instant().toString());
        store.write(StoreCategory.PROFILE, key(leadId), value, WRITER,
                WriteOptions.of(StorePriority.HIGH, "suppression", "lead:" + leadId));
    }

    private static String key(String leadId) {
        return "suppression_" + leadId;
    }
}
