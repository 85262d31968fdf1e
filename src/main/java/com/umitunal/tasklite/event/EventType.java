package com.umitunal.tasklite.event;

import com.umitunal.tasklite.event.payload.EventPayload;
import com.umitunal.tasklite.event.payload.JobCompleted;
import com.umitunal.tasklite.event.payload.JobFailed;
import com.umitunal.tasklite.event.payload.JobLifecycle;
import com.umitunal.tasklite.event.payload.JobRetryScheduled;
import com.umitunal.tasklite.event.payload.QuotaAlert;
import com.umitunal.tasklite.event.payload.RateLimited;
import com.umitunal.tasklite.event.payload.StorageCleaned;
import com.umitunal.tasklite.event.payload.SystemNotice;

/**
 * Closed set of event types. Every concrete type carries exactly one payload
 * class; {@link #ANY} matches all of them and is only valid for subscriptions.
 */
public enum EventType {
    JOB_ENQUEUED("job:enqueued", JobLifecycle.class),
    JOB_STARTED("job:started", JobLifecycle.class),
    JOB_COMPLETED("job:completed", JobCompleted.class),
    JOB_RETRY_SCHEDULED("job:retry", JobRetryScheduled.class),
    JOB_FAILED("job:failed", JobFailed.class),
    JOB_CANCELLED("job:cancelled", JobLifecycle.class),
    JOB_RECOVERED("job:recovered", JobLifecycle.class),

    STORAGE_QUOTA_WARNING("storage:quota:warning", QuotaAlert.class),
    STORAGE_QUOTA_EXCEEDED("storage:quota:exceeded", QuotaAlert.class),
    STORAGE_CLEANED("storage:cleaned", StorageCleaned.class),

    RATE_LIMITED("ai:ratelimited", RateLimited.class),

    SYSTEM_ERROR("system:error", SystemNotice.class),
    SYSTEM_WARNING("system:warning", SystemNotice.class),

    ANY("*", EventPayload.class);

    private final String tag;
    private final Class<? extends EventPayload> payloadType;

    EventType(String tag, Class<? extends EventPayload> payloadType) {
        this.tag = tag;
        this.payloadType = payloadType;
    }

    public String tag() {
        return tag;
    }

    public Class<? extends EventPayload> payloadType() {
        return payloadType;
    }

    public boolean isWildcard() {
        return this == ANY;
    }
}
