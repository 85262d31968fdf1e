package com.umitunal.tasklite.scheduler;

import com.fasterxml.jackson.databind.node.TextNode;
import com.umitunal.tasklite.config.JobQueueConfig;
import com.umitunal.tasklite.config.StorageConfig;
import com.umitunal.tasklite.config.StorageManagerConfig;
import com.umitunal.tasklite.core.EnqueueOptions;
import com.umitunal.tasklite.core.Job;
import com.umitunal.tasklite.core.JobFilter;
import com.umitunal.tasklite.core.JobPriority;
import com.umitunal.tasklite.core.JobStats;
import com.umitunal.tasklite.core.JobStatus;
import com.umitunal.tasklite.event.Event;
import com.umitunal.tasklite.event.EventBus;
import com.umitunal.tasklite.event.EventType;
import com.umitunal.tasklite.event.payload.JobLifecycle;
import com.umitunal.tasklite.event.payload.JobRetryScheduled;
import com.umitunal.tasklite.storage.RocksKeyValueStore;
import com.umitunal.tasklite.storage.StorageManager;
import com.umitunal.tasklite.worker.JobType;
import org.junit.jupiter.api.*;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.*;
import static org.awaitility.Awaitility.*;

class PersistentJobQueueTest {

    private static final JobType<String> ECHO = JobType.of("echo", String.class);
    private static final JobType<String> FLAKY = JobType.of("flaky", String.class);

    @TempDir
    Path tempDir;

    private RocksKeyValueStore store;
    private EventBus bus;
    private StorageManager storage;
    private StorageJobStore jobStore;
    private PersistentJobQueue queue;
    private final CountDownLatch release = new CountDownLatch(1);

    @BeforeEach
    void setUp() {
        store = new RocksKeyValueStore(StorageConfig.newBuilder(tempDir.toString())
                .withDurableWrites(false)
                .build());
        bus = new EventBus();
        storage = new StorageManager(store, bus, StorageManagerConfig.defaults());
        storage.init();
        jobStore = new StorageJobStore(storage, "job_queue");
    }

    @AfterEach
    void tearDown() {
        release.countDown();
        if (queue != null) {
            queue.close();
        }
        storage.close();
        bus.close();
        store.close();
    }

    private PersistentJobQueue openQueue(int concurrency) {
        PersistentJobQueue opened = new PersistentJobQueue(jobStore, bus, JobQueueConfig.newBuilder()
                .withConcurrency(concurrency)
                .withRetryDelay(Duration.ofMillis(50))
                .withProcessInterval(Duration.ofMillis(100))
                .build());
        opened.registerHandler(ECHO, (payload, job) -> payload.toUpperCase());
        return opened;
    }

    private void awaitStatus(String jobId, JobStatus status) {
        await().atMost(10, TimeUnit.SECONDS).until(() -> queue.getJob(jobId).getStatus() == status);
    }

    /**
     * Register a handler that records its payload and blocks until the test releases it.
     */
    private JobType<String> blockingType(List<String> started) {
        JobType<String> type = JobType.of("blocking", String.class);
        queue.registerHandler(type, (payload, job) -> {
            started.add(payload);
            release.await(10, TimeUnit.SECONDS);
            return payload;
        });
        return type;
    }

    @Test
    @DisplayName("Should execute a job, store its result and persist the terminal state")
    void testExecuteAndComplete() {
        // Given
        queue = openQueue(2);
        queue.init();

        // When
        String id = queue.enqueue(ECHO, "hello");

        // Then
        awaitStatus(id, JobStatus.COMPLETED);
        Job job = queue.getJob(id);
        assertThat(id).matches("job_\\d+_\\d+");
        assertThat(job.getResult().asText()).isEqualTo("HELLO");
        assertThat(job.getStartedAt()).isNotNull();
        assertThat(job.getCompletedAt()).isGreaterThanOrEqualTo(job.getStartedAt());
        assertThat(job.getRetries()).isZero();

        assertThat(jobStore.load()).singleElement()
                .satisfies(persisted -> assertThat(persisted.getStatus()).isEqualTo(JobStatus.COMPLETED));

        await().atMost(5, TimeUnit.SECONDS).until(() -> !bus.getHistory(EventType.JOB_COMPLETED, 1).isEmpty());
        assertThat(bus.getHistory(EventType.JOB_ENQUEUED, 10)).hasSize(1);
        assertThat(bus.getHistory(EventType.JOB_STARTED, 10)).hasSize(1);
    }

    @Test
    @DisplayName("Should start pending jobs by priority, oldest first among equals")
    void testPriorityOrder() {
        // Given
        queue = openQueue(1);
        List<String> started = new CopyOnWriteArrayList<>();
        JobType<String> blocking = blockingType(started);
        queue.init();
        queue.enqueue(blocking, "blocker");
        await().atMost(5, TimeUnit.SECONDS).until(() -> started.contains("blocker"));

        // When
        queue.enqueue(blocking, "normal-1");
        queue.enqueue(blocking, "low", EnqueueOptions.withPriority(JobPriority.LOW));
        queue.enqueue(blocking, "normal-2");
        queue.enqueue(blocking, "critical", EnqueueOptions.withPriority(JobPriority.CRITICAL));
        queue.enqueue(blocking, "high", EnqueueOptions.withPriority(JobPriority.HIGH));
        release.countDown();

        // Then
        await().atMost(10, TimeUnit.SECONDS).until(() -> started.size() == 6);
        assertThat(started).containsExactly("blocker", "critical", "high", "normal-1", "normal-2", "low");
    }

    @Test
    @DisplayName("Should never run more handlers than the concurrency limit")
    void testConcurrencyLimit() {
        // Given
        queue = openQueue(2);
        List<String> started = new CopyOnWriteArrayList<>();
        JobType<String> blocking = blockingType(started);
        queue.init();

        // When
        for (int i = 0; i < 4; i++) {
            queue.enqueue(blocking, "job-" + i);
        }

        // Then
        await().atMost(5, TimeUnit.SECONDS).until(() -> started.size() == 2);
        JobStats stats = queue.getStats();
        assertThat(stats.getActiveWorkers()).isEqualTo(2);
        assertThat(stats.getRunning()).isEqualTo(2);
        assertThat(stats.getPending()).isEqualTo(2);
        assertThat(queue.processNext()).isFalse();

        release.countDown();
        await().atMost(10, TimeUnit.SECONDS).until(() -> queue.getStats().getCompleted() == 4);
        assertThat(queue.getStats().getActiveWorkers()).isZero();
    }

    @Test
    @DisplayName("Should retry with exponential backoff and fail after maxRetries retries")
    void testRetryExhaustion() {
        // Given
        queue = openQueue(1);
        AtomicInteger attempts = new AtomicInteger();
        queue.registerHandler(FLAKY, (payload, job) -> {
            attempts.incrementAndGet();
            throw new IllegalStateException("service unavailable");
        });
        queue.init();

        // When
        String id = queue.enqueue(FLAKY, "x", EnqueueOptions.newBuilder().withMaxRetries(2).build());

        // Then
        awaitStatus(id, JobStatus.FAILED);
        Job job = queue.getJob(id);
        assertThat(attempts).hasValue(3);
        assertThat(job.getRetries()).isEqualTo(2);
        assertThat(job.getMaxRetries()).isEqualTo(2);
        assertThat(job.getError()).isEqualTo("service unavailable");
        assertThat(job.getCompletedAt()).isNotNull();

        await().atMost(5, TimeUnit.SECONDS).until(() -> !bus.getHistory(EventType.JOB_FAILED, 1).isEmpty());
        List<Event> retries = bus.getHistory(EventType.JOB_RETRY_SCHEDULED, 10);
        assertThat(retries).extracting(e -> e.payload(JobRetryScheduled.class).getDelayMs())
                .containsExactly(50L, 100L);
    }

    @Test
    @DisplayName("Should complete a job that succeeds on a retry")
    void testRetryThenSuccess() {
        // Given
        queue = openQueue(1);
        AtomicInteger attempts = new AtomicInteger();
        queue.registerHandler(FLAKY, (payload, job) -> {
            if (attempts.incrementAndGet() == 1) {
                throw new IllegalStateException("first attempt failed");
            }
            return "attempt " + attempts.get() + " after " + job.getRetries() + " retries";
        });
        queue.init();

        // When
        String id = queue.enqueue(FLAKY, "x");

        // Then
        awaitStatus(id, JobStatus.COMPLETED);
        Job job = queue.getJob(id);
        assertThat(job.getRetries()).isEqualTo(1);
        assertThat(job.getResult().asText()).isEqualTo("attempt 2 after 1 retries");
    }

    @Test
    @DisplayName("Should fail a job without a registered handler and no retries")
    void testMissingHandler() {
        // Given
        queue = openQueue(1);
        queue.init();

        // When
        String id = queue.enqueue(JobType.of("unknown", String.class), "x");

        // Then
        awaitStatus(id, JobStatus.FAILED);
        Job job = queue.getJob(id);
        assertThat(job.getRetries()).isZero();
        assertThat(job.getError()).contains("No handler registered");
        await().atMost(5, TimeUnit.SECONDS).until(() -> !bus.getHistory(EventType.JOB_FAILED, 1).isEmpty());
    }

    @Test
    @DisplayName("Should cancel only pending jobs")
    void testCancel() {
        // Given
        queue = openQueue(1);
        List<String> started = new CopyOnWriteArrayList<>();
        JobType<String> blocking = blockingType(started);
        queue.init();
        String running = queue.enqueue(blocking, "running");
        await().atMost(5, TimeUnit.SECONDS).until(() -> started.contains("running"));
        String waiting = queue.enqueue(blocking, "waiting");

        // When
        boolean cancelledWaiting = queue.cancel(waiting);
        boolean cancelledRunning = queue.cancel(running);
        release.countDown();

        // Then
        assertThat(cancelledWaiting).isTrue();
        assertThat(cancelledRunning).isFalse();
        assertThat(queue.cancel("job_0_0")).isFalse();
        assertThat(queue.cancel(waiting)).isFalse();
        awaitStatus(running, JobStatus.COMPLETED);
        assertThat(queue.getJob(waiting).getStatus()).isEqualTo(JobStatus.CANCELLED);
        assertThat(started).containsExactly("running");
    }

    @Test
    @DisplayName("Should filter jobs, report stats and clear terminal jobs")
    void testFilterStatsAndClear() {
        // Given
        queue = openQueue(1);
        queue.init();
        String first = queue.enqueue(ECHO, "a");
        String second = queue.enqueue(ECHO, "b");
        awaitStatus(first, JobStatus.COMPLETED);
        awaitStatus(second, JobStatus.COMPLETED);
        String failed = queue.enqueue(JobType.of("unknown", String.class), "c");
        awaitStatus(failed, JobStatus.FAILED);

        // Then
        assertThat(queue.getJobs(JobFilter.all())).extracting(Job::getId).containsExactly(first, second, failed);
        assertThat(queue.getJobs(JobFilter.byStatus(JobStatus.COMPLETED))).hasSize(2);
        assertThat(queue.getJobs(JobFilter.byType("unknown").withStatus(JobStatus.FAILED))).hasSize(1);
        JobStats stats = queue.getStats();
        assertThat(stats.getTotal()).isEqualTo(3);
        assertThat(stats.getCompleted()).isEqualTo(2);
        assertThat(stats.getFailed()).isEqualTo(1);

        // When
        int cleared = queue.clearCompleted();

        // Then
        assertThat(cleared).isEqualTo(3);
        assertThat(queue.getStats().getTotal()).isZero();
        assertThat(jobStore.load()).isEmpty();
        assertThat(queue.getJob(first)).isNull();
    }

    @Test
    @DisplayName("Should return snapshots that do not alias queue state")
    void testSnapshots() {
        // Given
        queue = openQueue(1);
        List<String> started = new CopyOnWriteArrayList<>();
        JobType<String> blocking = blockingType(started);
        queue.init();
        String id = queue.enqueue(blocking, "job");
        await().atMost(5, TimeUnit.SECONDS).until(() -> started.contains("job"));

        // When
        Job snapshot = queue.getJob(id);
        release.countDown();
        awaitStatus(id, JobStatus.COMPLETED);

        // Then
        assertThat(snapshot.getStatus()).isEqualTo(JobStatus.RUNNING);
        assertThat(snapshot.getResult()).isNull();
    }

    @Test
    @DisplayName("Should reset jobs interrupted while running and execute them after restart")
    void testCrashRecovery() {
        // Given: a job persisted as running, as left behind by a crash
        Job interrupted = new Job("job_1_1", "echo", TextNode.valueOf("recovered"), JobPriority.HIGH, 3, 1L);
        interrupted.scheduleRetry("earlier failure");
        interrupted.markRunning(2L);
        Job done = new Job("job_1_2", "echo", TextNode.valueOf("done"), JobPriority.NORMAL, 3, 1L);
        done.markCompleted(TextNode.valueOf("DONE"), 3L);
        jobStore.save(List.of(interrupted, done));

        // When
        queue = openQueue(1);
        queue.init();

        // Then
        awaitStatus("job_1_1", JobStatus.COMPLETED);
        Job recovered = queue.getJob("job_1_1");
        assertThat(recovered.getResult().asText()).isEqualTo("RECOVERED");
        assertThat(recovered.getRetries()).isEqualTo(1);
        assertThat(queue.getJob("job_1_2").getResult().asText()).isEqualTo("DONE");

        await().atMost(5, TimeUnit.SECONDS).until(() -> !bus.getHistory(EventType.JOB_RECOVERED, 1).isEmpty());
        List<Event> recoveredEvents = bus.getHistory(EventType.JOB_RECOVERED, 10);
        assertThat(recoveredEvents).hasSize(1);
        assertThat(recoveredEvents.get(0).payload(JobLifecycle.class).getJobId()).isEqualTo("job_1_1");
    }

    @Test
    @DisplayName("Should hold a recovered job as pending with its start time cleared until a worker is free")
    void testRecoveredStateBeforeExecution() {
        // Given: a blocking job that will hold the only slot, and an interrupted echo job
        Job blocker = new Job("job_1_1", "blocking", TextNode.valueOf("hold"), JobPriority.CRITICAL, 0, 1L);
        Job interrupted = new Job("job_1_2", "echo", TextNode.valueOf("later"), JobPriority.LOW, 3, 2L);
        interrupted.scheduleRetry("earlier failure");
        interrupted.markRunning(3L);
        jobStore.save(List.of(blocker, interrupted));

        queue = openQueue(1);
        List<String> started = new CopyOnWriteArrayList<>();
        blockingType(started);

        // When
        queue.init();
        await().atMost(5, TimeUnit.SECONDS).until(() -> started.contains("hold"));

        // Then
        Job recovered = queue.getJob("job_1_2");
        assertThat(recovered.getStatus()).isEqualTo(JobStatus.PENDING);
        assertThat(recovered.getStartedAt()).isNull();
        assertThat(recovered.getRetries()).isEqualTo(1);
        Job persisted = jobStore.load().stream()
                .filter(job -> job.getId().equals("job_1_2"))
                .findFirst()
                .orElseThrow();
        assertThat(persisted.getStatus()).isEqualTo(JobStatus.PENDING);
        assertThat(persisted.getStartedAt()).isNull();
        assertThat(persisted.getRetries()).isEqualTo(1);

        release.countDown();
        awaitStatus("job_1_2", JobStatus.COMPLETED);
        assertThat(queue.getJob("job_1_2").getRetries()).isEqualTo(1);
    }

    @Test
    @DisplayName("Should fail a job whose handler throws an Error")
    void testHandlerError() {
        // Given
        queue = openQueue(1);
        JobType<String> broken = JobType.of("broken", String.class);
        queue.registerHandler(broken, (payload, job) -> {
            throw new AssertionError("handler bug");
        });
        queue.init();

        // When
        String id = queue.enqueue(broken, "x", EnqueueOptions.newBuilder().withMaxRetries(0).build());

        // Then
        awaitStatus(id, JobStatus.FAILED);
        assertThat(queue.getJob(id).getError()).isEqualTo("handler bug");
        assertThat(queue.getStats().getRunning()).isZero();
        await().atMost(5, TimeUnit.SECONDS).until(() -> !bus.getHistory(EventType.JOB_FAILED, 1).isEmpty());

        String next = queue.enqueue(ECHO, "after");
        awaitStatus(next, JobStatus.COMPLETED);
    }

    @Test
    @DisplayName("Should reject enqueue after close")
    void testClosed() {
        queue = openQueue(1);
        queue.init();
        queue.close();

        assertThatThrownBy(() -> queue.enqueue(ECHO, "late"))
                .isInstanceOf(IllegalStateException.class);
    }
}
