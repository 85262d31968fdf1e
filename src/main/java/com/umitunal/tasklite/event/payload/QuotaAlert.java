package com.umitunal.tasklite.event.payload;

import com.umitunal.tasklite.storage.QuotaLevel;
import com.umitunal.tasklite.storage.StorageStats;

/**
 * Storage usage crossed a threshold, or a write was refused for lack of room.
 * {@code key} and {@code requestedBytes} are only set for refused writes.
 */
public final class QuotaAlert implements EventPayload {
    private final QuotaLevel level;
    private final StorageStats stats;
    private final String key;
    private final long requestedBytes;

    public QuotaAlert(QuotaLevel level, StorageStats stats) {
        this(level, stats, null, 0);
    }

    public QuotaAlert(QuotaLevel level, StorageStats stats, String key, long requestedBytes) {
        this.level = level;
        this.stats = stats;
        this.key = key;
        this.requestedBytes = requestedBytes;
    }

    public QuotaLevel getLevel() { return level; }
    public StorageStats getStats() { return stats; }
    public String getKey() { return key; }
    public long getRequestedBytes() { return requestedBytes; }

    @Override
    public String toString() {
        return String.format("QuotaAlert{level=%s, key='%s', requestedBytes=%d, stats=%s}",
                level, key, requestedBytes, stats);
    }
}
