package com.switchboard.core.store;

import java.util.List;

/**
 * Filter for {@link SharedStore#query}. Entries match when they carry any of {@link #tags}
 * and none of {@link #excludeTags}.
 */
public record StoreQuery(
    StoreCategory category,
    List<String> tags,
    List<String> excludeTags,
    String createdBy,
    SortBy sortBy,
    boolean descending,
    int limit
) {

    public enum SortBy { CREATED_AT, UPDATED_AT, PRIORITY }

    public StoreQuery {
        tags = tags != null ? List.copyOf(tags) : List.of();
        excludeTags = excludeTags != null ? List.copyOf(excludeTags) : List.of();
        sortBy = sortBy != null ? sortBy : SortBy.CREATED_AT;
    }

    public static Builder builder() {
        return new Builder();
    }

    public boolean matches(StoreEntry entry) {
        if (category != null && entry.category() != category) {
            return false;
        }
        if (!tags.isEmpty() && tags.stream().noneMatch(entry::hasTag)) {
            return false;
        }
        if (excludeTags.stream().anyMatch(entry::hasTag)) {
            return false;
        }
        return createdBy == null || createdBy.equals(entry.createdBy());
    }

    public static final class Builder {
        private StoreCategory category;
        private List<String> tags = List.of();
        private List<String> excludeTags = List.of();
        private String createdBy;
        private SortBy sortBy = SortBy.CREATED_AT;
        private boolean descending = true;
        private int limit = 0;

        private Builder() {}

        public Builder category(StoreCategory category) {
            this.category = category;
            return this;
        }

        public Builder tags(String... tags) {
            this.tags = List.of(tags);
            return this;
        }

        public Builder excludeTags(String... excludeTags) {
            this.excludeTags = List.of(excludeTags);
            return this;
        }

        public Builder createdBy(String createdBy) {
            this.createdBy = createdBy;
            return this;
        }

        public Builder sortBy(SortBy sortBy, boolean descending) {
            this.sortBy = sortBy;
            this.descending = descending;
            return this;
        }

        /** Zero means the store's default limit. */
        public Builder limit(int limit) {
            this.limit = limit;
            return this;
        }

        public StoreQuery build() {
            return new StoreQuery(category, tags, excludeTags, createdBy, sortBy, descending, limit);
        }
    }
}
