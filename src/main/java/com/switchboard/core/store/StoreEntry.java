package com.switchboard.core.store;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * A versioned document in the shared store, addressed by {@code (category, key)}.
 *
 * @param id        surrogate id assigned on first write
 * @param category  namespace
 * @param key       idempotent key within the category
 * @param value     JSON-compatible document
 * @param createdBy unit that first wrote the entry
 * @param createdAt first write time
 * @param updatedAt last write time
 * @param priority  entry priority
 * @param tags      query tags
 * @param version   incremented on every write, starting at 1
 */
public record StoreEntry(
    String id,
    StoreCategory category,
    String key,
    Map<String, Object> value,
    String createdBy,
    Instant createdAt,
    Instant updatedAt,
    StorePriority priority,
    List<String> tags,
    long version
) {

    public StoreEntry {
        value = value != null ? Collections.unmodifiableMap(new LinkedHashMap<>(value)) : Map.of();
        tags = tags != null ? List.copyOf(tags) : List.of();
        priority = priority != null ? priority : StorePriority.MEDIUM;
    }

    public boolean hasTag(String tag) {
        return tags.contains(tag);
    }

    public String stringValue(String field) {
        Object v = value.get(field);
        return v != null ? v.toString() : null;
    }

    public boolean booleanValue(String field) {
        Object v = value.get(field);
        return v instanceof Boolean b ? b : v != null && Boolean.parseBoolean(v.toString());
    }
}
