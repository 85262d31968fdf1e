package com.umitunal.tasklite.ratelimit;

import com.umitunal.tasklite.event.EventBus;
import com.umitunal.tasklite.event.EventType;
import com.umitunal.tasklite.event.payload.RateLimited;
import com.umitunal.tasklite.util.DaemonThreadFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.Callable;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.function.Function;
import java.util.function.Supplier;

/**
 * Serializes calls to one destination so that consecutive calls start at
 * least {@code minInterval} apart.
 *
 * <p>Calls are queued in strict FIFO order and executed one at a time by a
 * single drain thread. A failing call only fails its own future.
 *
 * <pre>{@code
 * RateLimiter limiter = new RateLimiter(Duration.ofMillis(500));
 * CompletableFuture<String> a = limiter.throttle(() -> api.query("one"));
 * CompletableFuture<String> b = limiter.throttle(() -> api.query("two")); // starts >= 500ms after a
 * }</pre>
 */
public class RateLimiter implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(RateLimiter.class);

    private final String name;
    private final Duration minInterval;
    private final long minIntervalNanos;
    private final EventBus eventBus;
    private final ExecutorService drainExecutor;
    private final Deque<QueuedCall<?>> queue = new ArrayDeque<>();

    private boolean draining;
    private boolean closed;
    private boolean called;
    private long lastCallNanos;

    public RateLimiter(Duration minInterval) {
        this("default", minInterval, null);
    }

    /**
     * @param name        destination name used in thread names, logs and events
     * @param minInterval minimum spacing between call starts
     * @param eventBus    receives {@link EventType#RATE_LIMITED} when a call has to wait; may be null
     * @throws IllegalArgumentException if {@code minInterval} is negative
     */
    public RateLimiter(String name, Duration minInterval, EventBus eventBus) {
        this.name = Objects.requireNonNull(name, "name must not be null");
        Objects.requireNonNull(minInterval, "minInterval must not be null");
        if (minInterval.isNegative()) {
            throw new IllegalArgumentException("minInterval must be non-negative, got: " + minInterval);
        }
        this.minInterval = minInterval;
        this.minIntervalNanos = minInterval.toNanos();
        this.eventBus = eventBus;
        this.drainExecutor = Executors.newSingleThreadExecutor(
                new DaemonThreadFactory("tasklite-ratelimit-" + name + "-"));
    }

    /**
     * Queue a blocking call. It runs on the limiter's drain thread.
     */
    public <T> CompletableFuture<T> throttle(Callable<T> fn) {
        Objects.requireNonNull(fn, "fn must not be null");
        return throttleAsync(() -> {
            try {
                return CompletableFuture.completedFuture(fn.call());
            } catch (Exception e) {
                return CompletableFuture.failedFuture(e);
            }
        });
    }

    /**
     * Queue an asynchronous call. The next queued call does not start before
     * the returned stage completes.
     */
    public <T> CompletableFuture<T> throttleAsync(Supplier<? extends CompletionStage<T>> fn) {
        Objects.requireNonNull(fn, "fn must not be null");
        CompletableFuture<T> future = new CompletableFuture<>();
        boolean startDrain;
        synchronized (this) {
            if (closed) {
                future.completeExceptionally(new RateLimiterClearedException("Rate limiter " + name + " is closed"));
                return future;
            }
            queue.addLast(new QueuedCall<>(fn, future));
            startDrain = !draining;
            draining = true;
        }
        if (startDrain) {
            drainExecutor.execute(this::drain);
        }
        return future;
    }

    /**
     * Rate-limited version of a function.
     */
    public <A, T> Function<A, CompletableFuture<T>> wrap(Function<A, T> fn) {
        return arg -> throttle(() -> fn.apply(arg));
    }

    /**
     * Calls waiting to be executed, excluding one in flight.
     */
    public synchronized int queueLength() {
        return queue.size();
    }

    /**
     * Time until the next call may start.
     */
    public synchronized Duration timeUntilNext() {
        return Duration.ofNanos(remainingNanos());
    }

    public Duration getMinInterval() {
        return minInterval;
    }

    public String getName() {
        return name;
    }

    /**
     * Fail every queued call with {@link RateLimiterClearedException}. A call
     * already in flight is not affected.
     *
     * @return number of calls rejected
     */
    public int clear() {
        List<QueuedCall<?>> rejected;
        synchronized (this) {
            rejected = new ArrayList<>(queue);
            queue.clear();
        }
        RateLimiterClearedException error = new RateLimiterClearedException("Rate limiter queue cleared");
        for (QueuedCall<?> call : rejected) {
            call.future.completeExceptionally(error);
        }
        if (!rejected.isEmpty()) {
            log.debug("Rate limiter {} cleared {} queued calls", name, rejected.size());
        }
        return rejected.size();
    }

    @Override
    public void close() {
        synchronized (this) {
            closed = true;
        }
        clear();
        drainExecutor.shutdownNow();
    }

    private void drain() {
        try {
            drainQueue();
        } finally {
            synchronized (this) {
                draining = false;
                if (!queue.isEmpty() && !closed) {
                    // A call may have been queued after the loop saw an empty queue.
                    draining = true;
                    drainExecutor.execute(this::drain);
                }
            }
        }
    }

    private void drainQueue() {
        while (true) {
            QueuedCall<?> call = null;
            long waitNanos;
            int waiting;
            synchronized (this) {
                if (queue.isEmpty()) {
                    return;
                }
                waitNanos = remainingNanos();
                waiting = queue.size();
                if (waitNanos <= 0) {
                    call = queue.pollFirst();
                    lastCallNanos = System.nanoTime();
                    called = true;
                }
            }

            if (call == null) {
                announceWait(waitNanos, waiting);
                try {
                    TimeUnit.NANOSECONDS.sleep(waitNanos);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    return;
                }
                continue;
            }

            call.execute();
        }
    }

    private long remainingNanos() {
        if (!called) {
            return 0L;
        }
        long elapsed = System.nanoTime() - lastCallNanos;
        return Math.max(0L, minIntervalNanos - elapsed);
    }

    private void announceWait(long waitNanos, int waiting) {
        long waitMs = TimeUnit.NANOSECONDS.toMillis(waitNanos);
        log.trace("Rate limiter {} waiting {}ms, {} queued", name, waitMs, waiting);
        if (eventBus != null) {
            eventBus.emitNonBlocking(EventType.RATE_LIMITED, new RateLimited(name, waitMs, waiting), "RateLimiter");
        }
    }

    private static final class QueuedCall<T> {
        private final Supplier<? extends CompletionStage<T>> fn;
        private final CompletableFuture<T> future;

        private QueuedCall(Supplier<? extends CompletionStage<T>> fn, CompletableFuture<T> future) {
            this.fn = fn;
            this.future = future;
        }

        private void execute() {
            try {
                CompletionStage<T> stage = fn.get();
                if (stage == null) {
                    throw new IllegalStateException("Throttled function returned null instead of a CompletionStage");
                }
                future.complete(stage.toCompletableFuture().get());
            } catch (ExecutionException e) {
                future.completeExceptionally(e.getCause() != null ? e.getCause() : e);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                future.completeExceptionally(e);
            } catch (Throwable e) {
                future.completeExceptionally(e);
            }
        }
    }
}
