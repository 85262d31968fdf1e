package com.umitunal.tasklite.ratelimit;

import java.util.concurrent.CancellationException;

/**
 * Completes throttled calls that were still queued when the limiter was
 * cleared or closed.
 */
public class RateLimiterClearedException extends CancellationException {

    public RateLimiterClearedException(String message) {
        super(message);
    }
}
