package com.umitunal.tasklite;

import com.umitunal.tasklite.config.JobQueueConfig;
import com.umitunal.tasklite.config.StorageConfig;
import com.umitunal.tasklite.core.JobStatus;
import com.umitunal.tasklite.ratelimit.RateLimiter;
import com.umitunal.tasklite.retry.Retry;
import com.umitunal.tasklite.retry.RetryConfig;
import com.umitunal.tasklite.storage.StorageCategory;
import com.umitunal.tasklite.worker.JobType;
import org.junit.jupiter.api.*;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.time.Duration;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.*;
import static org.awaitility.Awaitility.*;

class TaskCoreTest {

    private static final JobType<String> FETCH = JobType.of("fetch", String.class);

    @TempDir
    Path tempDir;

    private TaskCore core;

    private TaskCore open() {
        return TaskCore.builder(StorageConfig.newBuilder(tempDir.toString()).withDurableWrites(false).build())
                .withJobQueueConfig(JobQueueConfig.newBuilder()
                        .withProcessInterval(Duration.ofMillis(100))
                        .withRetryDelay(Duration.ofMillis(20))
                        .build())
                .open();
    }

    @AfterEach
    void tearDown() {
        if (core != null) {
            core.close();
        }
    }

    @Test
    @DisplayName("Should run a handler that goes through a rate limiter and the retry helper")
    void testEndToEnd() {
        // Given
        core = open();
        RateLimiter limiter = core.rateLimiter("ai-api", Duration.ofMillis(20));
        RetryConfig retry = RetryConfig.newBuilder().withMaxRetries(2).withBaseDelay(Duration.ofMillis(10)).build();
        core.jobQueue().registerHandler(FETCH, (url, job) ->
                Retry.withRetry(() -> limiter.throttle(() -> "fetched " + url).get(5, TimeUnit.SECONDS), retry));

        // When
        String id = core.jobQueue().enqueue(FETCH, "https://example.com");

        // Then
        await().atMost(10, TimeUnit.SECONDS)
                .until(() -> core.jobQueue().getJob(id).getStatus() == JobStatus.COMPLETED);
        assertThat(core.jobQueue().getJob(id).getResult().asText()).isEqualTo("fetched https://example.com");
        assertThat(core.storageManager().getItemsByCategory(StorageCategory.JOB_QUEUE))
                .extracting(meta -> meta.getKey())
                .containsExactly("job_queue");
    }

    @Test
    @DisplayName("Should share one rate limiter per destination")
    void testRateLimiterPerDestination() {
        core = open();

        RateLimiter first = core.rateLimiter("ai-api", Duration.ofSeconds(1));
        RateLimiter again = core.rateLimiter("ai-api", Duration.ofSeconds(2));
        RateLimiter other = core.rateLimiter("scraper", Duration.ofSeconds(1));

        assertThat(again).isSameAs(first);
        assertThat(again.getMinInterval()).isEqualTo(Duration.ofSeconds(1));
        assertThat(other).isNotSameAs(first);
    }

    @Test
    @DisplayName("Should refuse to hand out rate limiters after close")
    void testRateLimiterAfterClose() {
        core = open();
        core.close();

        assertThatThrownBy(() -> core.rateLimiter("ai-api", Duration.ofSeconds(1)))
                .isInstanceOf(IllegalStateException.class);
    }

    @Test
    @DisplayName("Should keep jobs and stored values across a reopen")
    void testReopen() {
        // Given
        core = open();
        core.jobQueue().registerHandler(FETCH, (url, job) -> url.length());
        String id = core.jobQueue().enqueue(FETCH, "abc");
        await().atMost(10, TimeUnit.SECONDS)
                .until(() -> core.jobQueue().getJob(id).getStatus() == JobStatus.COMPLETED);
        core.storageManager().set("settings_locale", "en");
        core.close();

        // When
        core = open();

        // Then
        assertThat(core.jobQueue().getJob(id).getResult().asInt()).isEqualTo(3);
        assertThat(core.storageManager().get("settings_locale", String.class)).isEqualTo("en");
    }
}
