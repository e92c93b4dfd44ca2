package com.switchboard.core.store;

import java.util.Comparator;
import java.util.List;

/**
 * Sorting and paging shared by the store backends.
 */
final class StoreQueries {

    private StoreQueries() {}

    /**
     * Sorts {@code entries} in place (stable) and applies the query limit.
     */
    static List<StoreEntry> sortAndLimit(List<StoreEntry> entries, StoreQuery query, int defaultLimit) {
        Comparator<StoreEntry> comparator = switch (query.sortBy()) {
            case PRIORITY -> Comparator.comparingInt(e -> e.priority().rank());
            case UPDATED_AT -> Comparator.comparing(StoreEntry::updatedAt);
            case CREATED_AT -> Comparator.comparing(StoreEntry::createdAt);
        };
        entries.sort(query.descending() ? comparator.reversed() : comparator);

        int limit = query.limit() > 0 ? query.limit() : defaultLimit;
        if (limit > 0 && entries.size() > limit) {
            return List.copyOf(entries.subList(0, limit));
        }
        return List.copyOf(entries);
    }

    static String compositeKey(StoreCategory category, String key) {
        return category.name() + ":" + key;
    }
}
