package com.umitunal.tasklite.retry;

import java.io.IOException;
import java.time.Duration;
import java.util.Objects;
import java.util.function.Predicate;

/**
 * Retry budget and backoff for {@link Retry}.
 */
public class RetryConfig {

    /**
     * Retries rate-limited and server-side failures, failures explicitly
     * marked recoverable, and I/O (network) failures.
     */
    public static final Predicate<Throwable> DEFAULT_RETRY_PREDICATE = RetryConfig::isRetryableByDefault;

    private final int maxRetries;
    private final long baseDelayMs;
    private final long maxDelayMs;
    private final Predicate<Throwable> retryOn;

    private RetryConfig(Builder builder) {
        this.maxRetries = builder.maxRetries;
        this.baseDelayMs = builder.baseDelayMs;
        this.maxDelayMs = builder.maxDelayMs;
        this.retryOn = builder.retryOn != null ? builder.retryOn : DEFAULT_RETRY_PREDICATE;
    }

    public int getMaxRetries() { return maxRetries; }
    public long getBaseDelayMs() { return baseDelayMs; }
    public long getMaxDelayMs() { return maxDelayMs; }
    public Predicate<Throwable> getRetryOn() { return retryOn; }

    /**
     * Delay before the retry that follows failed attempt {@code attempt} (0-based).
     * A retry-after hint on the failure wins; otherwise
     * {@code min(maxDelay, baseDelay * 2^attempt)} with 10% jitter.
     */
    public long delayBeforeRetry(int attempt, Throwable failure) {
        if (failure instanceof ApiCallException && ((ApiCallException) failure).getRetryAfter() != null) {
            return ((ApiCallException) failure).getRetryAfter().toMillis();
        }
        return Backoff.withJitter(Backoff.exponential(baseDelayMs, attempt, maxDelayMs));
    }

    public static RetryConfig defaults() {
        return newBuilder().build();
    }

    public static Builder newBuilder() {
        return new Builder();
    }

    private static boolean isRetryableByDefault(Throwable error) {
        if (error instanceof ApiCallException) {
            ApiCallException api = (ApiCallException) error;
            if (api.isRateLimited() || api.getStatusCode() >= 500) {
                return true;
            }
            return api.isRecoverable();
        }
        if (error instanceof RecoverableException) {
            return ((RecoverableException) error).isRecoverable();
        }
        return error instanceof IOException;
    }

    @Override
    public String toString() {
        return String.format("RetryConfig{maxRetries=%d, baseDelayMs=%d, maxDelayMs=%d}",
                maxRetries, baseDelayMs, maxDelayMs);
    }

    public static class Builder {
        private int maxRetries = 3;
        private long baseDelayMs = 1000;
        private long maxDelayMs = 30000;
        private Predicate<Throwable> retryOn;

        private Builder() {
        }

        /**
         * Retries after the first attempt; total attempts are {@code maxRetries + 1}.
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
         * Delay before the first retry.
         * Default: 1 second
         */
        public Builder withBaseDelay(Duration baseDelay) {
            this.baseDelayMs = requireNonNegative(baseDelay, "baseDelay");
            return this;
        }

        /**
         * Upper bound of the computed backoff.
         * Default: 30 seconds
         */
        public Builder withMaxDelay(Duration maxDelay) {
            this.maxDelayMs = requireNonNegative(maxDelay, "maxDelay");
            return this;
        }

        /**
         * Custom retry eligibility. Default: {@link #DEFAULT_RETRY_PREDICATE}.
         */
        public Builder withRetryOn(Predicate<Throwable> retryOn) {
            this.retryOn = retryOn;
            return this;
        }

        public RetryConfig build() {
            if (maxDelayMs < baseDelayMs) {
                throw new IllegalArgumentException("maxDelay must be >= baseDelay");
            }
            return new RetryConfig(this);
        }

        private static long requireNonNegative(Duration value, String name) {
            Objects.requireNonNull(value, name + " must not be null");
            if (value.isNegative()) {
                throw new IllegalArgumentException(name + " must not be negative");
            }
            return value.toMillis();
        }
    }
}
