package com.umitunal.tasklite.storage;

import com.umitunal.tasklite.config.StorageConfig;
import org.rocksdb.BlockBasedTableConfig;
import org.rocksdb.BloomFilter;
import org.rocksdb.Cache;
import org.rocksdb.CompressionType;
import org.rocksdb.Filter;
import org.rocksdb.LRUCache;
import org.rocksdb.Options;
import org.rocksdb.ReadOptions;
import org.rocksdb.RocksDB;
import org.rocksdb.RocksDBException;
import org.rocksdb.RocksIterator;
import org.rocksdb.WriteBatch;
import org.rocksdb.WriteOptions;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static java.nio.charset.StandardCharsets.UTF_8;

/**
 * RocksDB-backed implementation of KeyValueStore.
 *
 * <p>Usage accounting is kept in memory and recomputed from a full scan on
 * open. All mutations are serialized on this instance, matching the
 * single-writer model of the store.
 */
public class RocksKeyValueStore implements KeyValueStore {
    private static final Logger log = LoggerFactory.getLogger(RocksKeyValueStore.class);

    private final RocksDB database;
    private final WriteOptions writeOpts;
    private final ReadOptions scanReadOpts;
    private final Options dbOptions;
    private final Cache blockCache;
    private final Filter bloomFilter;
    private final long quotaBytes;
    private final String dataDirectory;

    private long bytesInUse;
    private boolean closed;

    public RocksKeyValueStore(StorageConfig config) {
        this.quotaBytes = config.getQuotaBytes();
        this.dataDirectory = config.getDataDirectory();

        RocksDB.loadLibrary();

        this.blockCache = new LRUCache(16 * 1024 * 1024); // 16MB cache
        this.bloomFilter = new BloomFilter(10, false); // 10 bits per key

        BlockBasedTableConfig tableConfig = new BlockBasedTableConfig()
                .setBlockCache(blockCache)
                .setFilterPolicy(bloomFilter)
                .setCacheIndexAndFilterBlocks(true)
                .setPinL0FilterAndIndexBlocksInCache(true);

        this.dbOptions = new Options()
                .setCreateIfMissing(true)
                .setCompressionType(CompressionType.LZ4_COMPRESSION)
                .setWriteBufferSize((long) config.getMemoryBufferSizeMB() * 1024 * 1024)
                .setMaxWriteBufferNumber(config.getMaxMemoryBuffers())
                .setMaxBackgroundJobs(config.getBackgroundThreads())
                .setTableFormatConfig(tableConfig)
                .setMaxOpenFiles(-1);

        this.writeOpts = new WriteOptions()
                .setSync(config.isDurableWrites())
                .setDisableWAL(false);

        // ReadOptions for scans - don't pollute cache with full table scans
        this.scanReadOpts = new ReadOptions()
                .setFillCache(false);

        try {
            Files.createDirectories(Paths.get(dataDirectory));
            this.database = RocksDB.open(dbOptions, dataDirectory);
        } catch (IOException | RocksDBException e) {
            releaseOptions();
            throw new StorageException("Failed to open store at " + dataDirectory, e);
        }

        this.bytesInUse = scanUsage();
        log.info("Opened store at {} usage={} quota={}",
                dataDirectory, StorageUnits.formatBytes(bytesInUse), StorageUnits.formatBytes(quotaBytes));
    }

    @Override
    public synchronized byte[] get(String key) {
        ensureOpen();
        try {
            return database.get(encodeKey(key));
        } catch (RocksDBException e) {
            throw new StorageException("Failed to read key " + key, e);
        }
    }

    @Override
    public synchronized void put(String key, byte[] value) {
        ensureOpen();
        byte[] rawKey = encodeKey(key);
        try {
            byte[] previous = database.get(rawKey);
            long before = previous == null ? 0 : rawKey.length + previous.length;
            long after = rawKey.length + value.length;
            long projected = bytesInUse - before + after;
            if (projected > quotaBytes) {
                throw new StorageException(String.format(
                        "Quota bytes exceeded writing %s: %d > %d", key, projected, quotaBytes));
            }
            database.put(writeOpts, rawKey, value);
            bytesInUse = projected;
        } catch (RocksDBException e) {
            throw new StorageException("Failed to write key " + key, e);
        }
    }

    @Override
    public synchronized void remove(String key) {
        removeAll(List.of(key));
    }

    @Override
    public synchronized void removeAll(Collection<String> keys) {
        ensureOpen();
        if (keys.isEmpty()) {
            return;
        }
        long freed = 0;
        try (final WriteBatch batch = new WriteBatch()) {
            for (String key : keys) {
                byte[] rawKey = encodeKey(key);
                byte[] previous = database.get(rawKey);
                if (previous != null) {
                    freed += rawKey.length + previous.length;
                    batch.delete(rawKey);
                }
            }
            if (batch.count() > 0) {
                database.write(writeOpts, batch);
            }
            bytesInUse -= freed;
        } catch (RocksDBException e) {
            throw new StorageException("Failed to remove " + keys.size() + " keys", e);
        }
    }

    @Override
    public synchronized List<String> keys() {
        ensureOpen();
        List<String> keys = new ArrayList<>();
        try (final RocksIterator iter = database.newIterator(scanReadOpts)) {
            iter.seekToFirst();
            while (iter.isValid()) {
                keys.add(new String(iter.key(), UTF_8));
                iter.next();
            }
        }
        return keys;
    }

    @Override
    public synchronized Map<String, byte[]> getAll() {
        ensureOpen();
        Map<String, byte[]> entries = new LinkedHashMap<>();
        try (final RocksIterator iter = database.newIterator(scanReadOpts)) {
            iter.seekToFirst();
            while (iter.isValid()) {
                entries.put(new String(iter.key(), UTF_8), iter.value());
                iter.next();
            }
        }
        return entries;
    }

    @Override
    public synchronized long bytesInUse() {
        return bytesInUse;
    }

    @Override
    public long quotaBytes() {
        return quotaBytes;
    }

    @Override
    public synchronized void close() {
        if (closed) {
            return;
        }
        closed = true;
        database.close();
        releaseOptions();
        log.info("Closed store at {}", dataDirectory);
    }

    private long scanUsage() {
        long total = 0;
        try (final RocksIterator iter = database.newIterator(scanReadOpts)) {
            iter.seekToFirst();
            while (iter.isValid()) {
                total += iter.key().length + iter.value().length;
                iter.next();
            }
        }
        return total;
    }

    private void ensureOpen() {
        if (closed) {
            throw new StorageException("Store at " + dataDirectory + " is closed");
        }
    }

    private void releaseOptions() {
        scanReadOpts.close();
        writeOpts.close();
        dbOptions.close();
        // BlockBasedTableConfig has no close(); it goes away with Options
        blockCache.close();
        bloomFilter.close();
    }

    private static byte[] encodeKey(String key) {
        if (key == null || key.isEmpty()) {
            throw new IllegalArgumentException("key must not be empty");
        }
        return key.getBytes(UTF_8);
    }
}
