package com.umitunal.tasklite.core;

import com.umitunal.tasklite.worker.JobHandler;
import com.umitunal.tasklite.worker.JobType;

import java.util.List;

/**
 * Persistent priority job queue with bounded concurrency and retry.
 */
public interface JobQueue extends AutoCloseable {

    /**
     * Bind a handler to a job type. Jobs of a type without a handler fail
     * when they are picked for execution.
     */
    <P, R> void registerHandler(JobType<P> type, JobHandler<P, R> handler);

    /**
     * Enqueue a job with normal priority and the default retry limit.
     *
     * @return the new job id
     */
    <P> String enqueue(JobType<P> type, P payload);

    /**
     * Enqueue a job for execution.
     *
     * @return the new job id
     */
    <P> String enqueue(JobType<P> type, P payload, EnqueueOptions options);

    /**
     * Cancel a job that has not started.
     *
     * @return false if the job is unknown or not pending
     */
    boolean cancel(String jobId);

    /**
     * Snapshot of a job, or null if unknown.
     */
    Job getJob(String jobId);

    /**
     * Snapshots of matching jobs in creation order.
     */
    List<Job> getJobs(JobFilter filter);

    /**
     * Remove every completed, failed or cancelled job.
     *
     * @return number of jobs removed
     */
    int clearCompleted();

    JobStats getStats();

    @Override
    void close();
}
