package com.umitunal.tasklite.serialization;

/**
 * Raised when a value cannot be converted to or from its stored JSON form.
 */
public class SerializationException extends RuntimeException {

    public SerializationException(String message, Throwable cause) {
        super(message, cause);
    }
}
