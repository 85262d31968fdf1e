package com.umitunal.tasklite.event.payload;

/**
 * Terminal failure of a job: retries exhausted or no handler registered.
 */
public final class JobFailed implements EventPayload {
    private final String jobId;
    private final String jobType;
    private final String error;
    private final int retries;

    public JobFailed(String jobId, String jobType, String error, int retries) {
        this.jobId = jobId;
        this.jobType = jobType;
        this.error = error;
        this.retries = retries;
    }

    public String getJobId() { return jobId; }
    public String getJobType() { return jobType; }
    public String getError() { return error; }
    public int getRetries() { return retries; }

    @Override
    public String toString() {
        return String.format("JobFailed{jobId='%s', type='%s', retries=%d, error='%s'}",
                jobId, jobType, retries, error);
    }
}
