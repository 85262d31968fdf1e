package com.umitunal.tasklite.core;

import java.util.function.Predicate;

/**
 * Criteria for listing jobs. Unset criteria match everything.
 */
public class JobFilter implements Predicate<Job> {
    private static final JobFilter ALL = new JobFilter(null, null);

    private final JobStatus status;
    private final String type;

    private JobFilter(JobStatus status, String type) {
        this.status = status;
        this.type = type;
    }

    public static JobFilter all() {
        return ALL;
    }

    public static JobFilter byStatus(JobStatus status) {
        return new JobFilter(status, null);
    }

    public static JobFilter byType(String type) {
        return new JobFilter(null, type);
    }

    public JobFilter withStatus(JobStatus status) {
        return new JobFilter(status, type);
    }

    public JobFilter withType(String type) {
        return new JobFilter(status, type);
    }

    @Override
    public boolean test(Job job) {
        return (status == null || job.getStatus() == status)
                && (type == null || job.getType().equals(type));
    }
}
