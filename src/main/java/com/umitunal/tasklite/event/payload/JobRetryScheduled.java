package com.umitunal.tasklite.event.payload;

public final class JobRetryScheduled implements EventPayload {
    private final String jobId;
    private final String jobType;
    private final String error;
    private final int retries;
    private final int maxRetries;
    private final long delayMs;

    public JobRetryScheduled(String jobId, String jobType, String error, int retries, int maxRetries, long delayMs) {
        this.jobId = jobId;
        this.jobType = jobType;
        this.error = error;
        this.retries = retries;
        this.maxRetries = maxRetries;
        this.delayMs = delayMs;
    }

    public String getJobId() { return jobId; }
    public String getJobType() { return jobType; }
    public String getError() { return error; }
    public int getRetries() { return retries; }
    public int getMaxRetries() { return maxRetries; }
    public long getDelayMs() { return delayMs; }

    @Override
    public String toString() {
        return String.format("JobRetryScheduled{jobId='%s', type='%s', retry=%d/%d, delayMs=%d, error='%s'}",
                jobId, jobType, retries, maxRetries, delayMs, error);
    }
}
