package com.umitunal.tasklite.scheduler;

import com.umitunal.tasklite.core.Job;

import java.util.Collection;
import java.util.List;

/**
 * Durable mirror of the job collection. The whole list is read on start and
 * written back after every change.
 */
public interface JobStore {

    /**
     * @return persisted jobs in their stored order, empty if none
     */
    List<Job> load();

    void save(Collection<Job> jobs);
}
