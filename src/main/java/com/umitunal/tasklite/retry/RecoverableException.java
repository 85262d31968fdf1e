package com.umitunal.tasklite.retry;

/**
 * Failure that states whether trying again can help. The default retry
 * predicate honours {@link #isRecoverable()}.
 */
public class RecoverableException extends RuntimeException {
    private final String code;
    private final boolean recoverable;

    public RecoverableException(String message, String code, boolean recoverable) {
        super(message);
        this.code = code;
        this.recoverable = recoverable;
    }

    public RecoverableException(String message, String code, boolean recoverable, Throwable cause) {
        super(message, cause);
        this.code = code;
        this.recoverable = recoverable;
    }

    public String getCode() {
        return code;
    }

    public boolean isRecoverable() {
        return recoverable;
    }
}
