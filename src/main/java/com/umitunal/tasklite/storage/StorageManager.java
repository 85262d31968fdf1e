package com.umitunal.tasklite.storage;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.umitunal.tasklite.config.StorageManagerConfig;
import com.umitunal.tasklite.event.EventBus;
import com.umitunal.tasklite.event.EventType;
import com.umitunal.tasklite.event.payload.QuotaAlert;
import com.umitunal.tasklite.event.payload.StorageCleaned;
import com.umitunal.tasklite.event.payload.SystemNotice;
import com.umitunal.tasklite.serialization.JsonCodec;
import com.umitunal.tasklite.util.DaemonThreadFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.stream.Collectors;

/**
 * Quota-aware front for a {@link KeyValueStore}.
 *
 * <p>Every value is stored as JSON and shadowed by a {@link StorageItemMeta}
 * entry that records its size, category and last access. The metadata map
 * itself is persisted under a reserved key and rebuilt from the store's
 * contents on {@link #init()}. When a write would push usage over the
 * headroom, least recently used items outside the protected categories are
 * evicted until usage falls to the cleanup target.
 *
 * <p>Operations are serialized on this instance. Callers that also hold
 * their own lock must acquire it before calling in.
 */
public class StorageManager implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(StorageManager.class);
    private static final String SOURCE = "StorageManager";

    private static final Comparator<StorageItemMeta> LEAST_RECENTLY_USED =
            Comparator.comparingLong(StorageItemMeta::getLastAccessedAt);

    private final KeyValueStore store;
    private final EventBus eventBus;
    private final StorageManagerConfig config;
    private final JsonCodec codec;
    private final Clock clock;
    private final Map<String, StorageItemMeta> metadata = new LinkedHashMap<>();

    private ScheduledExecutorService monitor;
    private QuotaLevel lastLevel = QuotaLevel.NORMAL;

    public StorageManager(KeyValueStore store, EventBus eventBus, StorageManagerConfig config) {
        this(store, eventBus, config, new JsonCodec(), Clock.systemUTC());
    }

    public StorageManager(KeyValueStore store, EventBus eventBus, StorageManagerConfig config,
                          JsonCodec codec, Clock clock) {
        this.store = Objects.requireNonNull(store, "store must not be null");
        this.eventBus = Objects.requireNonNull(eventBus, "eventBus must not be null");
        this.config = Objects.requireNonNull(config, "config must not be null");
        this.codec = Objects.requireNonNull(codec, "codec must not be null");
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
    }

    /**
     * Load persisted metadata, reconcile it with the store and start the
     * periodic quota check.
     */
    public void init() {
        synchronized (this) {
            loadMetadata();
            syncMetadata();
        }
        startMonitoring();
    }

    /**
     * Store a value under a category inferred from its key.
     */
    public void set(String key, Object value) {
        set(key, value, StorageCategory.infer(requireUserKey(key)));
    }

    /**
     * Store a value. If the write would exceed the headroom, older items are
     * evicted first when auto cleanup is on, otherwise the write is rejected.
     *
     * @throws QuotaExceededException if the write does not fit
     * @throws StorageException       if the underlying store fails
     */
    public synchronized void set(String key, Object value, StorageCategory category) {
        requireUserKey(key);
        Objects.requireNonNull(category, "category must not be null");
        byte[] bytes = codec.encode(value);
        long size = bytes.length;

        long limit = writeLimit();
        if (projectedUsage(key, size) > limit) {
            if (config.isAutoCleanup()) {
                log.info("Write of {} ({}) exceeds headroom, cleaning up", key, StorageUnits.formatBytes(size));
                cleanup(size);
            }
            if (projectedUsage(key, size) > limit) {
                StorageStats stats = getStats();
                eventBus.emitNonBlocking(EventType.STORAGE_QUOTA_EXCEEDED,
                        new QuotaAlert(QuotaLevel.CRITICAL, stats, key, size), SOURCE);
                throw new QuotaExceededException(key, size, String.format(
                        "Storage quota exceeded writing %s (%s), %s in use of %s",
                        key, StorageUnits.formatBytes(size),
                        StorageUnits.formatBytes(stats.getBytesUsed()),
                        StorageUnits.formatBytes(stats.getBytesTotal())));
            }
        }

        store.put(key, bytes);
        long now = clock.millis();
        StorageItemMeta existing = metadata.get(key);
        long createdAt = existing != null ? existing.getCreatedAt() : now;
        metadata.put(key, new StorageItemMeta(key, size, category, createdAt, now));
        saveMetadata();
    }

    /**
     * Read a value and mark it as accessed.
     *
     * @return the decoded value, or null if the key is absent
     */
    public synchronized <T> T get(String key, Class<T> type) {
        requireUserKey(key);
        byte[] bytes = store.get(key);
        if (bytes == null) {
            return null;
        }
        T value = codec.decode(bytes, type);
        StorageItemMeta meta = metadata.get(key);
        if (meta != null) {
            meta.touch(clock.millis());
            saveMetadata();
        }
        return value;
    }

    public synchronized void remove(String key) {
        requireUserKey(key);
        store.remove(key);
        if (metadata.remove(key) != null) {
            saveMetadata();
        }
    }

    /**
     * Remove several keys in one store batch.
     */
    public synchronized void removeMany(Collection<String> keys) {
        if (keys.isEmpty()) {
            return;
        }
        for (String key : keys) {
            requireUserKey(key);
        }
        store.removeAll(keys);
        for (String key : keys) {
            metadata.remove(key);
        }
        saveMetadata();
    }

    public synchronized StorageStats getStats() {
        Map<StorageCategory, StorageStats.CategoryUsage> byCategory = new EnumMap<>(StorageCategory.class);
        for (StorageItemMeta meta : metadata.values()) {
            byCategory.merge(meta.getCategory(), new StorageStats.CategoryUsage(1, meta.getSize()),
                    (current, added) -> current.plus(added.getSize()));
        }
        return new StorageStats(store.bytesInUse(), store.quotaBytes(), metadata.size(), byCategory);
    }

    /**
     * Evict least recently used items until usage is at or below the
     * cleanup target.
     *
     * @return bytes freed, by metadata size
     */
    public long cleanup() {
        return cleanup(0);
    }

    /**
     * Evict least recently used, unprotected items until at least
     * {@code minBytesToFree} bytes are freed and usage is at or below the
     * cleanup target. Stops early once candidates run out.
     *
     * @return bytes freed, by metadata size
     */
    public synchronized long cleanup(long minBytesToFree) {
        long target = (long) (store.quotaBytes() * (config.getCleanupTargetPercent() / 100.0));
        long bytesToFree = Math.max(minBytesToFree, store.bytesInUse() - target);
        if (bytesToFree <= 0) {
            return 0;
        }

        List<StorageItemMeta> candidates = metadata.values().stream()
                .filter(meta -> !isProtected(meta))
                .sorted(LEAST_RECENTLY_USED)
                .collect(Collectors.toList());

        List<String> victims = new ArrayList<>();
        long freed = 0;
        for (StorageItemMeta candidate : candidates) {
            if (freed >= bytesToFree) {
                break;
            }
            victims.add(candidate.getKey());
            freed += candidate.getSize();
        }

        if (victims.isEmpty()) {
            log.warn("Cleanup needed {} but no evictable items remain", StorageUnits.formatBytes(bytesToFree));
            return 0;
        }

        removeMany(victims);
        log.info("Cleaned up {} items, freed {}", victims.size(), StorageUnits.formatBytes(freed));
        eventBus.emitNonBlocking(EventType.STORAGE_CLEANED, new StorageCleaned(freed, victims.size()), SOURCE);
        return freed;
    }

    public List<StorageItemMeta> getOldestItems(int limit) {
        return snapshot(LEAST_RECENTLY_USED, limit);
    }

    public List<StorageItemMeta> getLargestItems(int limit) {
        return snapshot(Comparator.comparingLong(StorageItemMeta::getSize).reversed(), limit);
    }

    public synchronized List<StorageItemMeta> getItemsByCategory(StorageCategory category) {
        List<StorageItemMeta> items = new ArrayList<>();
        for (StorageItemMeta meta : metadata.values()) {
            if (meta.getCategory() == category) {
                items.add(meta.copy());
            }
        }
        return items;
    }

    /**
     * Compare usage with the thresholds. Emits an event when usage enters the
     * warning or critical band and runs cleanup while critical.
     *
     * @return the level observed before any cleanup
     */
    public QuotaLevel checkQuota() {
        StorageStats stats = getStats();
        QuotaLevel level = levelOf(stats.getPercentUsed());
        QuotaLevel previous;
        synchronized (this) {
            previous = lastLevel;
            lastLevel = level;
        }

        if (level == QuotaLevel.CRITICAL) {
            if (previous != QuotaLevel.CRITICAL) {
                log.warn("Storage usage critical: {}", stats);
                eventBus.emitNonBlocking(EventType.STORAGE_QUOTA_EXCEEDED, new QuotaAlert(level, stats), SOURCE);
            }
            if (config.isAutoCleanup()) {
                cleanup();
                QuotaLevel after = levelOf(getStats().getPercentUsed());
                synchronized (this) {
                    lastLevel = after;
                }
            }
        } else if (level == QuotaLevel.WARNING && previous == QuotaLevel.NORMAL) {
            log.warn("Storage usage high: {}", stats);
            eventBus.emitNonBlocking(EventType.STORAGE_QUOTA_WARNING, new QuotaAlert(level, stats), SOURCE);
        }
        return level;
    }

    public StorageManagerConfig getConfig() {
        return config;
    }

    @Override
    public void close() {
        ScheduledExecutorService current;
        synchronized (this) {
            current = monitor;
            monitor = null;
        }
        if (current != null) {
            current.shutdownNow();
        }
    }

    private synchronized void startMonitoring() {
        if (monitor != null) {
            return;
        }
        long periodMs = config.getCheckInterval().toMillis();
        monitor = Executors.newSingleThreadScheduledExecutor(new DaemonThreadFactory("tasklite-storage-monitor-"));
        monitor.scheduleWithFixedDelay(this::runScheduledCheck, periodMs, periodMs, TimeUnit.MILLISECONDS);
    }

    private void runScheduledCheck() {
        try {
            checkQuota();
        } catch (RuntimeException e) {
            // A throwing task would cancel the schedule.
            log.error("Quota check failed", e);
            eventBus.emitNonBlocking(EventType.SYSTEM_ERROR,
                    new SystemNotice(SOURCE, "Quota check failed: " + e.getMessage(), e), SOURCE);
        }
    }

    private QuotaLevel levelOf(double percentUsed) {
        if (percentUsed >= config.getCriticalThresholdPercent()) {
            return QuotaLevel.CRITICAL;
        }
        if (percentUsed >= config.getWarningThresholdPercent()) {
            return QuotaLevel.WARNING;
        }
        return QuotaLevel.NORMAL;
    }

    private long writeLimit() {
        return (long) (store.quotaBytes() * (config.getWriteHeadroomPercent() / 100.0));
    }

    private long projectedUsage(String key, long size) {
        StorageItemMeta existing = metadata.get(key);
        long replaced = existing != null ? existing.getSize() : 0;
        return store.bytesInUse() - replaced + size;
    }

    private boolean isProtected(StorageItemMeta meta) {
        return meta.getKey().equals(config.getMetadataKey())
                || config.getProtectedCategories().contains(meta.getCategory())
                || config.getProtectedCategories().contains(StorageCategory.infer(meta.getKey()));
    }

    private synchronized List<StorageItemMeta> snapshot(Comparator<StorageItemMeta> order, int limit) {
        return metadata.values().stream()
                .sorted(order)
                .limit(Math.max(0, limit))
                .map(StorageItemMeta::copy)
                .collect(Collectors.toList());
    }

    private String requireUserKey(String key) {
        Objects.requireNonNull(key, "key must not be null");
        if (key.equals(config.getMetadataKey())) {
            throw new IllegalArgumentException("Key is reserved for storage metadata: " + key);
        }
        return key;
    }

    private void loadMetadata() {
        metadata.clear();
        byte[] bytes = store.get(config.getMetadataKey());
        if (bytes == null) {
            return;
        }
        try {
            JsonNode entries = codec.decode(bytes, JsonNode.class);
            for (JsonNode entry : entries) {
                StorageItemMeta meta = codec.fromTree(entry.get(1), StorageItemMeta.class);
                metadata.put(entry.get(0).asText(), meta);
            }
        } catch (RuntimeException e) {
            metadata.clear();
            log.warn("Storage metadata under {} is unreadable, rebuilding from store contents",
                    config.getMetadataKey(), e);
        }
    }

    private void syncMetadata() {
        Map<String, byte[]> entries = store.getAll();
        entries.remove(config.getMetadataKey());
        long now = clock.millis();

        int added = 0;
        for (Map.Entry<String, byte[]> entry : entries.entrySet()) {
            if (!metadata.containsKey(entry.getKey())) {
                metadata.put(entry.getKey(), new StorageItemMeta(entry.getKey(), entry.getValue().length,
                        StorageCategory.infer(entry.getKey()), now, now));
                added++;
            }
        }
        int before = metadata.size();
        metadata.keySet().retainAll(entries.keySet());
        int dropped = before - metadata.size();

        if (added > 0 || dropped > 0) {
            log.info("Synced storage metadata: {} untracked keys added, {} stale entries dropped", added, dropped);
        }
        saveMetadata();
    }

    private void saveMetadata() {
        ArrayNode entries = codec.getMapper().createArrayNode();
        for (Map.Entry<String, StorageItemMeta> entry : metadata.entrySet()) {
            ArrayNode pair = entries.addArray();
            pair.add(entry.getKey());
            pair.add(codec.toTree(entry.getValue()));
        }
        try {
            store.put(config.getMetadataKey(), codec.encode(entries));
        } catch (StorageException e) {
            throw new StorageException("Failed to save storage metadata", e);
        }
    }
}
