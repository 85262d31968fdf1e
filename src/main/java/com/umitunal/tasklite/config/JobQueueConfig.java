package com.umitunal.tasklite.config;

import java.time.Duration;
import java.util.Objects;

/**
 * Execution limits and persistence key for the job queue.
 */
public class JobQueueConfig {
    private final int concurrency;
    private final int maxRetries;
    private final Duration retryDelay;
    private final Duration processInterval;
    private final String persistKey;

    private JobQueueConfig(Builder builder) {
        this.concurrency = builder.concurrency;
        this.maxRetries = builder.maxRetries;
        this.retryDelay = builder.retryDelay;
        this.processInterval = builder.processInterval;
        this.persistKey = builder.persistKey;
    }

    public int getConcurrency() { return concurrency; }
    public int getMaxRetries() { return maxRetries; }
    public Duration getRetryDelay() { return retryDelay; }
    public Duration getProcessInterval() { return processInterval; }
    public String getPersistKey() { return persistKey; }

    public static JobQueueConfig defaults() {
        return newBuilder().build();
    }

    public static Builder newBuilder() {
        return new Builder();
    }

    public static class Builder {
        private int concurrency = 2;
        private int maxRetries = 3;
        private Duration retryDelay = Duration.ofSeconds(1);
        private Duration processInterval = Duration.ofSeconds(1);
        private String persistKey = "job_queue";

        private Builder() {
        }

        /**
         * Maximum number of handlers running at once.
         * Default: 2
         */
        public Builder withConcurrency(int concurrency) {
            if (concurrency <= 0) {
                throw new IllegalArgumentException("concurrency must be > 0, got: " + concurrency);
            }
            this.concurrency = concurrency;
            return this;
        }

        /**
         * Retries after the first failed attempt, unless overridden per job.
         * Default: 3
         */
        public Builder withMaxRetries(int maxRetries) {
            if (maxRetries < 0) {
                throw new IllegalArgumentException("maxRetries must be >= 0, got: " + maxRetries);
            }
            this.maxRetries = maxRetries;
            return this;
        }

        /**
         * Base of the exponential retry delay. Default: 1 second
         */
        public Builder withRetryDelay(Duration retryDelay) {
            Objects.requireNonNull(retryDelay, "retryDelay must not be null");
            if (retryDelay.isNegative()) {
                throw new IllegalArgumentException("retryDelay must not be negative, got: " + retryDelay);
            }
            this.retryDelay = retryDelay;
            return this;
        }

        /**
         * Period of the scheduling tick. Default: 1 second
         */
        public Builder withProcessInterval(Duration processInterval) {
            Objects.requireNonNull(processInterval, "processInterval must not be null");
            if (processInterval.isNegative() || processInterval.isZero()) {
                throw new IllegalArgumentException("processInterval must be positive, got: " + processInterval);
            }
            this.processInterval = processInterval;
            return this;
        }

        /**
         * Storage key holding the job list. Default: "job_queue"
         */
        public Builder withPersistKey(String persistKey) {
            if (persistKey == null || persistKey.isBlank()) {
                throw new IllegalArgumentException("persistKey must not be blank");
            }
            this.persistKey = persistKey;
            return this;
        }

        public JobQueueConfig build() {
            return new JobQueueConfig(this);
        }
    }
}
