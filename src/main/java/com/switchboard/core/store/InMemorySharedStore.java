package com.switchboard.core.store;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * In-memory {@link SharedStore}. Suitable for development and tests; state is lost on restart.
 * Entries keep their creation order, which stable sorting relies on.
 */
public class InMemorySharedStore implements SharedStore {

    private static final Logger log = LoggerFactory.getLogger(InMemorySharedStore.class);

    private final Map<String, StoreEntry> entries = new LinkedHashMap<>();
    private final ReentrantReadWriteLock lock = new ReentrantReadWriteLock();
    private final Clock clock;
    private final int defaultLimit;

    public InMemorySharedStore(Clock clock, int defaultLimit) {
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
        this.defaultLimit = defaultLimit;
    }

    public InMemorySharedStore(Clock clock) {
        this(clock, 0);
    }

    @Override
    public StoreEntry write(StoreCategory category, String key, Map<String, Object> value,
                            String writer, WriteOptions options) {
        Objects.requireNonNull(category, "category must not be null");
        Objects.requireNonNull(key, "key must not be null");
        WriteOptions opts = options != null ? options : WriteOptions.defaults();
        String composite = StoreQueries.compositeKey(category, key);
        Instant now = clock.instant();

        lock.writeLock().lock();
        try {
            StoreEntry existing = entries.get(composite);
            StoreEntry stored;
            if (existing != null) {
                stored = new StoreEntry(existing.id(), category, key, value, existing.createdBy(),
                        existing.createdAt(), now,
                        opts.priority() != null ? opts.priority() : existing.priority(),
                        opts.tags() != null ? opts.tags() : existing.tags(),
                        existing.version() + 1);
                log.debug("Updated {} by {} (v{})", composite, writer, stored.version());
            } else {
                stored = new StoreEntry("mem_" + UUID.randomUUID(), category, key, value, writer,
                        now, now, opts.priority(), opts.tags(), 1);
                log.debug("Created {} by {}", composite, writer);
            }
            entries.put(composite, stored);
            return stored;
        } finally {
            lock.writeLock().unlock();
        }
    }

    @Override
    public Optional<StoreEntry> read(StoreCategory category, String key, String reader) {
        lock.readLock().lock();
        try {
            return Optional.ofNullable(entries.get(StoreQueries.compositeKey(category, key)));
        } finally {
            lock.readLock().unlock();
        }
    }

    @Override
    public List<StoreEntry> query(String reader, StoreQuery filter) {
        StoreQuery query = filter != null ? filter : StoreQuery.builder().build();
        List<StoreEntry> matched = new ArrayList<>();
        lock.readLock().lock();
        try {
            for (StoreEntry entry : entries.values()) {
                if (query.matches(entry)) {
                    matched.add(entry);
                }
            }
        } finally {
            lock.readLock().unlock();
        }
        return StoreQueries.sortAndLimit(matched, query, defaultLimit);
    }

    @Override
    public String backend() {
        return "memory";
    }

    public int size() {
        lock.readLock().lock();
        try {
            return entries.size();
        } finally {
            lock.readLock().unlock();
        }
    }
}
