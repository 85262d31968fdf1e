package com.umitunal.tasklite.event.payload;

import com.fasterxml.jackson.databind.JsonNode;

public final class JobCompleted implements EventPayload {
    private final String jobId;
    private final String jobType;
    private final JsonNode result;

    public JobCompleted(String jobId, String jobType, JsonNode result) {
        this.jobId = jobId;
        this.jobType = jobType;
        this.result = result;
    }

    public String getJobId() { return jobId; }
    public String getJobType() { return jobType; }

    /**
     * Handler result as stored on the job, possibly a JSON null node.
     */
    public JsonNode getResult() { return result; }

    @Override
    public String toString() {
        return String.format("JobCompleted{jobId='%s', type='%s'}", jobId, jobType);
    }
}
