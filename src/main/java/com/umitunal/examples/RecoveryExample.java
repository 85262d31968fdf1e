package com.umitunal.examples;

import com.umitunal.tasklite.TaskCore;
import com.umitunal.tasklite.config.JobQueueConfig;
import com.umitunal.tasklite.config.StorageConfig;
import com.umitunal.tasklite.core.JobStatus;
import com.umitunal.tasklite.event.EventType;
import com.umitunal.tasklite.event.payload.JobLifecycle;
import com.umitunal.tasklite.worker.JobType;

import java.time.Duration;

/**
 * Recovery example - a job interrupted while running is picked up again on restart.
 */
public class RecoveryExample {

    private static final JobType<String> EXPORT = JobType.of("export", String.class);

    public static void main(String[] args) throws Exception {
        System.out.println("=== Recovery Example ===\n");

        StorageConfig config = StorageConfig.newBuilder("/tmp/tasklite-recovery")
                .withDurableWrites(true)
                .build();
        JobQueueConfig queueConfig = JobQueueConfig.newBuilder()
                .withProcessInterval(Duration.ofMillis(200))
                .build();

        String jobId;
        // First run: the handler never finishes before shutdown
        try (TaskCore core = TaskCore.builder(config).withJobQueueConfig(queueConfig).open()) {
            core.jobQueue().registerHandler(EXPORT, (format, job) -> {
                System.out.println("Exporting as " + format + "... (process stops now)");
                Thread.sleep(60_000);
                return "never";
            });
            jobId = core.jobQueue().enqueue(EXPORT, "csv");
            while (core.jobQueue().getJob(jobId).getStatus() != JobStatus.RUNNING) {
                Thread.sleep(50);
            }
            System.out.println("Status before stop: " + core.jobQueue().getJob(jobId).getStatus());
        }

        // Second run: the job is reset to pending and executed again
        try (TaskCore core = TaskCore.builder(config).withJobQueueConfig(queueConfig).open()) {
            core.eventBus().subscribe(EventType.JOB_RECOVERED, event ->
                    System.out.println("Recovered " + event.payload(JobLifecycle.class).getJobId()));
            core.jobQueue().registerHandler(EXPORT, (format, job) -> "exported as " + format);

            while (core.jobQueue().getJob(jobId).getStatus() != JobStatus.COMPLETED) {
                Thread.sleep(50);
            }
            System.out.println("Result after restart: " + core.jobQueue().getJob(jobId).getResult());
            core.jobQueue().clearCompleted();
        }
    }
}
