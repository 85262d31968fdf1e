package com.umitunal.tasklite.retry;

import java.util.concurrent.ThreadLocalRandom;

/**
 * Exponential backoff arithmetic shared by the retry helper and the job queue.
 */
public final class Backoff {

    /** Jitter applied by {@link #withJitter(long)}: plus or minus 10%. */
    public static final double JITTER_FACTOR = 0.1;

    private Backoff() {
    }

    /**
     * {@code min(maxDelayMs, baseDelayMs * 2^exponent)} without overflow.
     *
     * @param exponent zero-based; negative values are treated as 0
     */
    public static long exponential(long baseDelayMs, int exponent, long maxDelayMs) {
        if (baseDelayMs <= 0) {
            return 0L;
        }
        int exp = Math.max(0, exponent);
        long expDelay;
        if (exp >= 62) {
            expDelay = Long.MAX_VALUE;
        } else {
            long shift = 1L << exp;
            // Guard against overflow: if shift exceeds Long.MAX_VALUE/baseDelayMs, cap directly
            expDelay = shift > Long.MAX_VALUE / baseDelayMs ? Long.MAX_VALUE : baseDelayMs * shift;
        }
        return Math.min(maxDelayMs, expDelay);
    }

    /**
     * Spread a delay uniformly over {@code [delay * 0.9, delay * 1.1]}.
     */
    public static long withJitter(long delayMs) {
        if (delayMs <= 0) {
            return 0L;
        }
        double jitter = delayMs * JITTER_FACTOR * ThreadLocalRandom.current().nextDouble(-1.0, 1.0);
        return Math.max(0L, Math.round(delayMs + jitter));
    }
}
