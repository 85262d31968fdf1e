package com.umitunal.tasklite.core;

import com.fasterxml.jackson.annotation.JsonAutoDetect;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.JsonNode;

import java.util.Objects;

/**
 * A unit of deferred work with full state management.
 *
 * <p>Instances held by the queue are mutated only by its execution loop and
 * by cancel. Callers receive copies.
 */
@JsonAutoDetect(fieldVisibility = JsonAutoDetect.Visibility.ANY,
        getterVisibility = JsonAutoDetect.Visibility.NONE,
        isGetterVisibility = JsonAutoDetect.Visibility.NONE)
@JsonInclude(JsonInclude.Include.NON_NULL)
public class Job {
    private String id;
    private String type;
    private JsonNode payload;
    private JobPriority priority;
    private JobStatus status;
    private long createdAt;
    private Long startedAt;
    private Long completedAt;
    private String error;
    private JsonNode result;
    private int retries;
    private int maxRetries;

    // Jackson
    private Job() {
    }

    public Job(String id, String type, JsonNode payload, JobPriority priority, int maxRetries, long createdAt) {
        this.id = Objects.requireNonNull(id, "id must not be null");
        this.type = Objects.requireNonNull(type, "type must not be null");
        this.payload = payload;
        this.priority = Objects.requireNonNull(priority, "priority must not be null");
        this.maxRetries = maxRetries;
        this.createdAt = createdAt;
        this.status = JobStatus.PENDING;
        this.retries = 0;
    }

    public String getId() { return id; }
    public String getType() { return type; }
    public JsonNode getPayload() { return payload; }
    public JobPriority getPriority() { return priority; }
    public JobStatus getStatus() { return status; }
    public long getCreatedAt() { return createdAt; }
    public Long getStartedAt() { return startedAt; }
    public Long getCompletedAt() { return completedAt; }
    public String getError() { return error; }
    public JsonNode getResult() { return result; }
    public int getRetries() { return retries; }
    public int getMaxRetries() { return maxRetries; }

    /**
     * Whether another attempt is allowed after the current one fails.
     */
    public boolean canRetry() {
        return retries < maxRetries;
    }

    public void markRunning(long now) {
        this.status = JobStatus.RUNNING;
        this.startedAt = now;
    }

    public void markCompleted(JsonNode result, long now) {
        this.status = JobStatus.COMPLETED;
        this.result = result;
        this.completedAt = now;
    }

    /**
     * Return to pending after a failed attempt, consuming one retry.
     */
    public void scheduleRetry(String error) {
        this.retries++;
        this.status = JobStatus.PENDING;
        this.error = error;
    }

    public void markFailed(String error, long now) {
        this.status = JobStatus.FAILED;
        this.error = error;
        this.completedAt = now;
    }

    public void markCancelled(long now) {
        this.status = JobStatus.CANCELLED;
        this.completedAt = now;
    }

    /**
     * Reset a job that was running when the process stopped.
     */
    public void resetAfterInterruption() {
        this.status = JobStatus.PENDING;
        this.startedAt = null;
    }

    public Job copy() {
        Job copy = new Job();
        copy.id = id;
        copy.type = type;
        copy.payload = payload == null ? null : payload.deepCopy();
        copy.priority = priority;
        copy.status = status;
        copy.createdAt = createdAt;
        copy.startedAt = startedAt;
        copy.completedAt = completedAt;
        copy.error = error;
        copy.result = result == null ? null : result.deepCopy();
        copy.retries = retries;
        copy.maxRetries = maxRetries;
        return copy;
    }

    @Override
    public String toString() {
        return String.format("Job{id='%s', type='%s', priority=%s, status=%s, retries=%d/%d}",
                id, type, priority.tag(), status.tag(), retries, maxRetries);
    }
}
