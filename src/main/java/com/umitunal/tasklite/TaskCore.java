package com.umitunal.tasklite;

import com.umitunal.tasklite.config.JobQueueConfig;
import com.umitunal.tasklite.config.StorageConfig;
import com.umitunal.tasklite.config.StorageManagerConfig;
import com.umitunal.tasklite.event.EventBus;
import com.umitunal.tasklite.event.EventErrorHandler;
import com.umitunal.tasklite.ratelimit.RateLimiter;
import com.umitunal.tasklite.scheduler.PersistentJobQueue;
import com.umitunal.tasklite.scheduler.StorageJobStore;
import com.umitunal.tasklite.serialization.JsonCodec;
import com.umitunal.tasklite.storage.KeyValueStore;
import com.umitunal.tasklite.storage.RocksKeyValueStore;
import com.umitunal.tasklite.storage.StorageManager;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Wires the store, event bus, storage manager and job queue together and
 * owns their lifecycle. Components are started in dependency order by
 * {@link Builder#open()} and stopped in reverse order by {@link #close()}.
 *
 * <pre>{@code
 * try (TaskCore core = TaskCore.builder(StorageConfig.newBuilder("/tmp/tasklite").build()).open()) {
 *     core.jobQueue().registerHandler(SCRAPE, (page, job) -> scrape(page));
 *     core.jobQueue().enqueue(SCRAPE, new Page("https://example.com"));
 * }
 * }</pre>
 */
public class TaskCore implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(TaskCore.class);

    private final KeyValueStore store;
    private final EventBus eventBus;
    private final StorageManager storageManager;
    private final PersistentJobQueue jobQueue;
    private final Map<String, RateLimiter> rateLimiters = new ConcurrentHashMap<>();
    private boolean closed;

    private TaskCore(KeyValueStore store, EventBus eventBus, StorageManager storageManager,
                     PersistentJobQueue jobQueue) {
        this.store = store;
        this.eventBus = eventBus;
        this.storageManager = storageManager;
        this.jobQueue = jobQueue;
    }

    public EventBus eventBus() {
        return eventBus;
    }

    public StorageManager storageManager() {
        return storageManager;
    }

    public PersistentJobQueue jobQueue() {
        return jobQueue;
    }

    /**
     * Rate limiter shared by every caller of the same destination. The
     * interval of the first request wins.
     *
     * @throws IllegalStateException if the core is closed
     */
    public synchronized RateLimiter rateLimiter(String destination, Duration minInterval) {
        Objects.requireNonNull(destination, "destination must not be null");
        if (closed) {
            throw new IllegalStateException("Task core is closed");
        }
        RateLimiter limiter = rateLimiters.computeIfAbsent(destination,
                d -> new RateLimiter(d, minInterval, eventBus));
        if (!limiter.getMinInterval().equals(minInterval)) {
            log.warn("Rate limiter for {} already exists with interval {}, ignoring {}",
                    destination, limiter.getMinInterval(), minInterval);
        }
        return limiter;
    }

    @Override
    public synchronized void close() {
        if (closed) {
            return;
        }
        closed = true;
        List<RateLimiter> limiters = new ArrayList<>(rateLimiters.values());
        rateLimiters.clear();
        for (RateLimiter limiter : limiters) {
            limiter.close();
        }
        jobQueue.close();
        storageManager.close();
        eventBus.close();
        store.close();
        log.info("Task core closed");
    }

    public static Builder builder(StorageConfig storageConfig) {
        return new Builder(storageConfig);
    }

    public static class Builder {
        private final StorageConfig storageConfig;
        private StorageManagerConfig storageManagerConfig = StorageManagerConfig.defaults();
        private JobQueueConfig jobQueueConfig = JobQueueConfig.defaults();
        private Clock clock = Clock.systemUTC();
        private EventErrorHandler errorHandler;

        private Builder(StorageConfig storageConfig) {
            this.storageConfig = Objects.requireNonNull(storageConfig, "storageConfig must not be null");
        }

        public Builder withStorageManagerConfig(StorageManagerConfig config) {
            this.storageManagerConfig = Objects.requireNonNull(config, "config must not be null");
            return this;
        }

        public Builder withJobQueueConfig(JobQueueConfig config) {
            this.jobQueueConfig = Objects.requireNonNull(config, "config must not be null");
            return this;
        }

        public Builder withClock(Clock clock) {
            this.clock = Objects.requireNonNull(clock, "clock must not be null");
            return this;
        }

        /**
         * Sink for event handler failures. Default: log at ERROR.
         */
        public Builder withEventErrorHandler(EventErrorHandler errorHandler) {
            this.errorHandler = errorHandler;
            return this;
        }

        /**
         * Open the store and start every component. On failure, whatever was
         * already started is closed again.
         */
        public TaskCore open() {
            JsonCodec codec = new JsonCodec();
            KeyValueStore store = new RocksKeyValueStore(storageConfig);
            EventBus eventBus = null;
            StorageManager storageManager = null;
            PersistentJobQueue jobQueue = null;
            try {
                eventBus = EventBus.builder()
                        .withClock(clock)
                        .withErrorHandler(errorHandler)
                        .build();
                storageManager = new StorageManager(store, eventBus, storageManagerConfig, codec, clock);
                storageManager.init();
                jobQueue = new PersistentJobQueue(
                        new StorageJobStore(storageManager, jobQueueConfig.getPersistKey(), codec),
                        eventBus, jobQueueConfig, codec, clock);
                jobQueue.init();
            } catch (RuntimeException e) {
                if (jobQueue != null) {
                    jobQueue.close();
                }
                if (storageManager != null) {
                    storageManager.close();
                }
                if (eventBus != null) {
                    eventBus.close();
                }
                store.close();
                throw e;
            }
            log.info("Task core opened at {}", storageConfig.getDataDirectory());
            return new TaskCore(store, eventBus, storageManager, jobQueue);
        }
    }
}
