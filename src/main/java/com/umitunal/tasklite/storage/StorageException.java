package com.umitunal.tasklite.storage;

/**
 * Failure reading from or writing to the persistent store.
 */
public class StorageException extends RuntimeException {

    public StorageException(String message) {
        super(message);
    }

    public StorageException(String message, Throwable cause) {
        super(message, cause);
    }
}
