package com.umitunal.tasklite.worker;

import com.umitunal.tasklite.core.Job;

/**
 * Executes jobs of one type.
 *
 * @param <P> the payload type
 * @param <R> the result type, stored on the job as JSON
 */
@FunctionalInterface
public interface JobHandler<P, R> {

    /**
     * Process a job and return its result.
     *
     * @param payload the decoded payload
     * @param job     snapshot of the job as it was when execution started
     * @throws Exception if processing fails; the job is retried while retries remain
     */
    R handle(P payload, Job job) throws Exception;
}
