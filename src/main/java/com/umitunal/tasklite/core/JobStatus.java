package com.umitunal.tasklite.core;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Lifecycle state of a job.
 * <pre>
 * pending -> running -> completed | failed
 * running -> pending              (retry while retries remain)
 * pending -> cancelled
 * </pre>
 */
public enum JobStatus {
    PENDING,
    RUNNING,
    COMPLETED,
    FAILED,
    CANCELLED;

    /**
     * Whether no further transition is possible.
     */
    public boolean isTerminal() {
        return this == COMPLETED || this == FAILED || this == CANCELLED;
    }

    @JsonValue
    public String tag() {
        return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static JobStatus fromTag(String tag) {
        return valueOf(tag.toUpperCase(Locale.ROOT));
    }
}
