package com.umitunal.tasklite.config;

import com.umitunal.tasklite.storage.StorageCategory;

import java.time.Duration;
import java.util.Collections;
import java.util.EnumSet;
import java.util.Objects;
import java.util.Set;

/**
 * Quota thresholds and eviction policy for the storage manager.
 */
public class StorageManagerConfig {
    private final int warningThresholdPercent;
    private final int criticalThresholdPercent;
    private final int writeHeadroomPercent;
    private final String metadataKey;
    private final Duration checkInterval;
    private final boolean autoCleanup;
    private final int cleanupTargetPercent;
    private final Set<StorageCategory> protectedCategories;

    private StorageManagerConfig(Builder builder) {
        this.warningThresholdPercent = builder.warningThresholdPercent;
        this.criticalThresholdPercent = builder.criticalThresholdPercent;
        this.writeHeadroomPercent = builder.writeHeadroomPercent;
        this.metadataKey = builder.metadataKey;
        this.checkInterval = builder.checkInterval;
        this.autoCleanup = builder.autoCleanup;
        this.cleanupTargetPercent = builder.cleanupTargetPercent;
        this.protectedCategories = Collections.unmodifiableSet(EnumSet.copyOf(builder.protectedCategories));
    }

    public int getWarningThresholdPercent() { return warningThresholdPercent; }
    public int getCriticalThresholdPercent() { return criticalThresholdPercent; }
    public int getWriteHeadroomPercent() { return writeHeadroomPercent; }
    public String getMetadataKey() { return metadataKey; }
    public Duration getCheckInterval() { return checkInterval; }
    public boolean isAutoCleanup() { return autoCleanup; }
    public int getCleanupTargetPercent() { return cleanupTargetPercent; }
    public Set<StorageCategory> getProtectedCategories() { return protectedCategories; }

    public static StorageManagerConfig defaults() {
        return newBuilder().build();
    }

    public static Builder newBuilder() {
        return new Builder();
    }

    public static class Builder {
        private int warningThresholdPercent = 80;
        private int criticalThresholdPercent = 95;
        private int writeHeadroomPercent = 95;
        private String metadataKey = "_storage_meta";
        private Duration checkInterval = Duration.ofSeconds(60);
        private boolean autoCleanup = true;
        private int cleanupTargetPercent = 70;
        private Set<StorageCategory> protectedCategories =
                EnumSet.of(StorageCategory.SETTINGS, StorageCategory.ENCRYPTED_KEY, StorageCategory.JOB_QUEUE);

        private Builder() {
        }

        /**
         * Usage percentage at which a warning event is emitted.
         * Default: 80
         */
        public Builder withWarningThreshold(int percent) {
            this.warningThresholdPercent = percent;
            return this;
        }

        /**
         * Usage percentage at which the quota is treated as exceeded.
         * Default: 95
         */
        public Builder withCriticalThreshold(int percent) {
            this.criticalThresholdPercent = percent;
            return this;
        }

        /**
         * Share of the quota a single write may fill before cleanup or rejection.
         * Default: 95
         */
        public Builder withWriteHeadroom(int percent) {
            this.writeHeadroomPercent = percent;
            return this;
        }

        /**
         * Reserved key holding the metadata map. Default: "_storage_meta"
         */
        public Builder withMetadataKey(String key) {
            if (key == null || key.isBlank()) {
                throw new IllegalArgumentException("metadataKey must not be blank");
            }
            this.metadataKey = key;
            return this;
        }

        /**
         * Period of the background quota check. Default: 60 seconds
         */
        public Builder withCheckInterval(Duration interval) {
            Objects.requireNonNull(interval, "interval must not be null");
            if (interval.isNegative() || interval.isZero()) {
                throw new IllegalArgumentException("checkInterval must be positive, got: " + interval);
            }
            this.checkInterval = interval;
            return this;
        }

        /**
         * Evict least recently used items instead of rejecting writes.
         * Default: true
         */
        public Builder withAutoCleanup(boolean enable) {
            this.autoCleanup = enable;
            return this;
        }

        /**
         * Usage percentage cleanup aims for. Default: 70
         */
        public Builder withCleanupTarget(int percent) {
            this.cleanupTargetPercent = percent;
            return this;
        }

        /**
         * Categories never evicted by cleanup.
         * Default: settings, encrypted keys and the job queue
         */
        public Builder withProtectedCategories(Set<StorageCategory> categories) {
            Objects.requireNonNull(categories, "categories must not be null");
            this.protectedCategories = categories.isEmpty()
                    ? EnumSet.noneOf(StorageCategory.class)
                    : EnumSet.copyOf(categories);
            return this;
        }

        public StorageManagerConfig build() {
            checkPercent("warningThreshold", warningThresholdPercent);
            checkPercent("criticalThreshold", criticalThresholdPercent);
            checkPercent("writeHeadroom", writeHeadroomPercent);
            checkPercent("cleanupTarget", cleanupTargetPercent);
            if (warningThresholdPercent > criticalThresholdPercent) {
                throw new IllegalArgumentException(String.format(
                        "warningThreshold (%d) must not exceed criticalThreshold (%d)",
                        warningThresholdPercent, criticalThresholdPercent));
            }
            return new StorageManagerConfig(this);
        }

        private static void checkPercent(String name, int value) {
            if (value < 0 || value > 100) {
                throw new IllegalArgumentException(name + " must be within 0-100, got: " + value);
            }
        }
    }
}
