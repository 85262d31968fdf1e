package com.umitunal.tasklite.storage;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;

/**
 * Point-in-time usage of the persistent store.
 */
public class StorageStats {
    private final long bytesUsed;
    private final long bytesTotal;
    private final int itemCount;
    private final Map<StorageCategory, CategoryUsage> byCategory;

    public StorageStats(long bytesUsed, long bytesTotal, int itemCount, Map<StorageCategory, CategoryUsage> byCategory) {
        this.bytesUsed = bytesUsed;
        this.bytesTotal = bytesTotal;
        this.itemCount = itemCount;
        this.byCategory = byCategory.isEmpty()
                ? Collections.emptyMap()
                : Collections.unmodifiableMap(new EnumMap<>(byCategory));
    }

    public long getBytesUsed() { return bytesUsed; }
    public long getBytesTotal() { return bytesTotal; }
    public int getItemCount() { return itemCount; }
    public Map<StorageCategory, CategoryUsage> getByCategory() { return byCategory; }

    /**
     * Usage as a percentage (0-100) of the quota.
     */
    public double getPercentUsed() {
        return bytesTotal == 0 ? 0.0 : (bytesUsed * 100.0) / bytesTotal;
    }

    @Override
    public String toString() {
        return String.format("StorageStats{used=%s, total=%s, percent=%.1f, items=%d}",
                StorageUnits.formatBytes(bytesUsed), StorageUnits.formatBytes(bytesTotal),
                getPercentUsed(), itemCount);
    }

    /**
     * Item count and summed size of one category.
     */
    public static class CategoryUsage {
        private final int count;
        private final long size;

        public CategoryUsage(int count, long size) {
            this.count = count;
            this.size = size;
        }

        public int getCount() { return count; }
        public long getSize() { return size; }

        CategoryUsage plus(long itemSize) {
            return new CategoryUsage(count + 1, size + itemSize);
        }

        @Override
        public String toString() {
            return "CategoryUsage{count=" + count + ", size=" + size + "}";
        }
    }
}
