package com.umitunal.tasklite.storage;

/**
 * Thrown when a write would take the store past its usable capacity.
 */
public class QuotaExceededException extends StorageException {
    private final String key;
    private final long requestedBytes;

    public QuotaExceededException(String key, long requestedBytes, String message) {
        super(message);
        this.key = key;
        this.requestedBytes = requestedBytes;
    }

    public String getKey() {
        return key;
    }

    public long getRequestedBytes() {
        return requestedBytes;
    }
}
