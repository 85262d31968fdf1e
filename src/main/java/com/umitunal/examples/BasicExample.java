package com.umitunal.examples;

import com.umitunal.tasklite.TaskCore;
import com.umitunal.tasklite.config.JobQueueConfig;
import com.umitunal.tasklite.config.StorageConfig;
import com.umitunal.tasklite.core.EnqueueOptions;
import com.umitunal.tasklite.core.JobFilter;
import com.umitunal.tasklite.core.JobPriority;
import com.umitunal.tasklite.core.JobStatus;
import com.umitunal.tasklite.event.EventType;
import com.umitunal.tasklite.worker.JobType;

import java.time.Duration;

/**
 * Basic usage example - enqueue jobs with priorities and watch lifecycle events.
 */
public class BasicExample {

    public static class ScrapeRequest {
        public String url;
        public int depth;

        public ScrapeRequest() {
        }

        public ScrapeRequest(String url, int depth) {
            this.url = url;
            this.depth = depth;
        }
    }

    private static final JobType<ScrapeRequest> SCRAPE = JobType.of("scrape", ScrapeRequest.class);

    public static void main(String[] args) throws Exception {
        System.out.println("=== Basic Example ===\n");

        StorageConfig config = StorageConfig.newBuilder("/tmp/tasklite-basic")
                .withDurableWrites(true)
                .build();

        try (TaskCore core = TaskCore.builder(config)
                .withJobQueueConfig(JobQueueConfig.newBuilder().withConcurrency(1).build())
                .open()) {

            core.eventBus().subscribe(EventType.ANY, event ->
                    System.out.println("  [event] " + event.getType().tag() + " " + event.getPayload()));

            core.jobQueue().registerHandler(SCRAPE, (request, job) -> {
                System.out.println("Scraping " + request.url + " (depth " + request.depth + ", " + job.getPriority().tag() + ")");
                Thread.sleep(100); // Simulate work
                return "scraped " + request.url;
            });

            core.jobQueue().enqueue(SCRAPE, new ScrapeRequest("https://example.com/a", 1));
            core.jobQueue().enqueue(SCRAPE, new ScrapeRequest("https://example.com/b", 2),
                    EnqueueOptions.withPriority(JobPriority.LOW));
            core.jobQueue().enqueue(SCRAPE, new ScrapeRequest("https://example.com/urgent", 1),
                    EnqueueOptions.withPriority(JobPriority.CRITICAL));

            System.out.println(core.jobQueue().getStats());

            // Wait for completion
            long deadline = System.nanoTime() + Duration.ofSeconds(10).toNanos();
            while (core.jobQueue().getStats().getCompleted() < 3 && System.nanoTime() < deadline) {
                Thread.sleep(100);
            }

            System.out.println("\nCompleted jobs:");
            core.jobQueue().getJobs(JobFilter.byStatus(JobStatus.COMPLETED))
                    .forEach(job -> System.out.println("  " + job.getId() + " -> " + job.getResult()));

            System.out.println("Cleared " + core.jobQueue().clearCompleted() + " finished jobs");
            System.out.println(core.storageManager().getStats());
        }
    }
}
