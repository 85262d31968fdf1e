package com.umitunal.tasklite.core;

import java.util.Objects;

/**
 * Per-job overrides applied at enqueue time.
 */
public class EnqueueOptions {
    private final JobPriority priority;
    private final Integer maxRetries;

    private EnqueueOptions(Builder builder) {
        this.priority = builder.priority;
        this.maxRetries = builder.maxRetries;
    }

    public JobPriority getPriority() { return priority; }

    /**
     * Retry limit, or null to use the queue default.
     */
    public Integer getMaxRetries() { return maxRetries; }

    public static EnqueueOptions defaults() {
        return newBuilder().build();
    }

    public static EnqueueOptions withPriority(JobPriority priority) {
        return newBuilder().withPriority(priority).build();
    }

    public static Builder newBuilder() {
        return new Builder();
    }

    public static class Builder {
        private JobPriority priority = JobPriority.NORMAL;
        private Integer maxRetries;

        private Builder() {
        }

        /**
         * Default: normal
         */
        public Builder withPriority(JobPriority priority) {
            this.priority = Objects.requireNonNull(priority, "priority must not be null");
            return this;
        }

        public Builder withMaxRetries(int maxRetries) {
            if (maxRetries < 0) {
                throw new IllegalArgumentException("maxRetries must be >= 0, got: " + maxRetries);
            }
            this.maxRetries = maxRetries;
            return this;
        }

        public EnqueueOptions build() {
            return new EnqueueOptions(this);
        }
    }
}
