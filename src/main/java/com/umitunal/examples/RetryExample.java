package com.umitunal.examples;

import com.umitunal.tasklite.event.EventBus;
import com.umitunal.tasklite.event.EventType;
import com.umitunal.tasklite.event.payload.RateLimited;
import com.umitunal.tasklite.ratelimit.RateLimiter;
import com.umitunal.tasklite.retry.ApiCallException;
import com.umitunal.tasklite.retry.Retry;
import com.umitunal.tasklite.retry.RetryConfig;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Retry and rate limiting example - a flaky API called through a limiter.
 */
public class RetryExample {

    public static void main(String[] args) throws Exception {
        System.out.println("=== Retry Example ===\n");

        AtomicInteger calls = new AtomicInteger();
        RetryConfig retry = RetryConfig.newBuilder()
                .withMaxRetries(3)
                .withBaseDelay(Duration.ofMillis(200))
                .withMaxDelay(Duration.ofSeconds(2))
                .build();

        String answer = Retry.withRetry(() -> {
            int attempt = calls.incrementAndGet();
            System.out.println("Attempt " + attempt);
            if (attempt < 3) {
                throw ApiCallException.fromResponse(503, "Service unavailable", null);
            }
            return "42";
        }, retry);
        System.out.println("Answer after " + calls.get() + " attempts: " + answer);

        try (EventBus bus = new EventBus();
             RateLimiter limiter = new RateLimiter("ai-api", Duration.ofMillis(500), bus)) {

            bus.subscribe(EventType.RATE_LIMITED, event -> {
                RateLimited waiting = event.payload(RateLimited.class);
                System.out.println("  Throttled " + waiting.getDestination() + " for " + waiting.getWaitMs() + "ms");
            });

            List<CompletableFuture<String>> results = new ArrayList<>();
            for (int i = 1; i <= 4; i++) {
                int n = i;
                results.add(limiter.throttle(() -> "prompt #" + n + " at " + System.currentTimeMillis()));
            }
            for (CompletableFuture<String> result : results) {
                System.out.println(result.get());
            }
        }
    }
}
