package com.switchboard.core.store;

import java.util.List;

/**
 * Options for {@link SharedStore#write}. Null fields keep the existing entry's values on update.
 */
public record WriteOptions(StorePriority priority, List<String> tags) {

    public static WriteOptions defaults() {
        return new WriteOptions(null, null);
    }

    public static WriteOptions of(StorePriority priority, String... tags) {
        return new WriteOptions(priority, List.of(tags));
    }

    public static WriteOptions tagged(String... tags) {
        return new WriteOptions(null, List.of(tags));
    }
}
