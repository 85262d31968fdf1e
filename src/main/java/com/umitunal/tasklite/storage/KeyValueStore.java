package com.umitunal.tasklite.storage;

import java.util.Collection;
import java.util.List;
import java.util.Map;

/**
 * Capacity-bounded key/value mapping that backs every persisted value.
 *
 * <p>Usage is measured as key bytes (UTF-8) plus value bytes. A write that
 * would exceed {@link #quotaBytes()} fails with {@link StorageException}.
 */
public interface KeyValueStore extends AutoCloseable {

    /**
     * Read a value.
     *
     * @return the stored bytes, or null if the key is absent
     */
    byte[] get(String key);

    /**
     * Write a value, replacing any previous one.
     */
    void put(String key, byte[] value);

    void remove(String key);

    /**
     * Remove several keys in one atomic batch.
     */
    void removeAll(Collection<String> keys);

    /**
     * All keys currently present, in store order.
     */
    List<String> keys();

    /**
     * Snapshot of every entry, in store order.
     */
    Map<String, byte[]> getAll();

    /**
     * Bytes currently in use.
     */
    long bytesInUse();

    /**
     * Capacity ceiling in bytes.
     */
    long quotaBytes();

    @Override
    void close();
}
