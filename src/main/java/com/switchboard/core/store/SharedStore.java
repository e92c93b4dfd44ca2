package com.switchboard.core.store;

import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Durable key/value store shared by every unit. It is the only shared mutable state in the system,
 * so every writer uses a deterministic key and concurrent writes to one key are last-writer-wins.
 */
public interface SharedStore {

    /**
     * Creates or updates the entry at {@code (category, key)}.
     *
     * @return the entry as stored
     * @throws StoreException if the backing store cannot be written
     */
    StoreEntry write(StoreCategory category, String key, Map<String, Object> value,
                     String writer, WriteOptions options);

    Optional<StoreEntry> read(StoreCategory category, String key, String reader);

    /**
     * Returns matching entries, sorted as requested. Sorting is stable, so entries with equal sort
     * keys keep their creation order.
     */
    List<StoreEntry> query(String reader, StoreQuery filter);

    /**
     * Backend name for health reporting.
     */
    String backend();
}
