package com.umitunal.tasklite.storage;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Shadow metadata for one persisted key. {@code size} is the length of the
 * serialized value and is recomputed on every write.
 */
public class StorageItemMeta {
    private final String key;
    private final long size;
    private final StorageCategory category;
    private final long createdAt;
    private long lastAccessedAt;

    @JsonCreator
    public StorageItemMeta(@JsonProperty("key") String key,
                           @JsonProperty("size") long size,
                           @JsonProperty("category") StorageCategory category,
                           @JsonProperty("createdAt") long createdAt,
                           @JsonProperty("lastAccessedAt") long lastAccessedAt) {
        this.key = key;
        this.size = size;
        this.category = category != null ? category : StorageCategory.UNKNOWN;
        this.createdAt = createdAt;
        this.lastAccessedAt = lastAccessedAt;
    }

    @JsonProperty("key")
    public String getKey() { return key; }

    @JsonProperty("size")
    public long getSize() { return size; }

    @JsonProperty("category")
    public StorageCategory getCategory() { return category; }

    @JsonProperty("createdAt")
    public long getCreatedAt() { return createdAt; }

    @JsonProperty("lastAccessedAt")
    public long getLastAccessedAt() { return lastAccessedAt; }

    /**
     * Record an access. The timestamp never moves backwards.
     */
    void touch(long now) {
        this.lastAccessedAt = Math.max(lastAccessedAt, now);
    }

    StorageItemMeta copy() {
        return new StorageItemMeta(key, size, category, createdAt, lastAccessedAt);
    }

    @Override
    public String toString() {
        return String.format("StorageItemMeta{key='%s', size=%d, category=%s, createdAt=%d, lastAccessedAt=%d}",
                key, size, category.tag(), createdAt, lastAccessedAt);
    }
}
