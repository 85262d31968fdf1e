package com.umitunal.tasklite.event.payload;

import com.umitunal.tasklite.core.JobPriority;

/**
 * Payload for job state changes that carry no outcome: enqueued, started,
 * cancelled and recovered after a restart.
 */
public final class JobLifecycle implements EventPayload {
    private final String jobId;
    private final String jobType;
    private final JobPriority priority;
    private final int retries;

    public JobLifecycle(String jobId, String jobType, JobPriority priority, int retries) {
        this.jobId = jobId;
        this.jobType = jobType;
        this.priority = priority;
        this.retries = retries;
    }

    public String getJobId() { return jobId; }
    public String getJobType() { return jobType; }
    public JobPriority getPriority() { return priority; }
    public int getRetries() { return retries; }

    @Override
    public String toString() {
        return String.format("JobLifecycle{jobId='%s', type='%s', priority=%s, retries=%d}",
                jobId, jobType, priority, retries);
    }
}
