package com.umitunal.tasklite.scheduler;

import com.fasterxml.jackson.databind.JsonNode;
import com.umitunal.tasklite.config.JobQueueConfig;
import com.umitunal.tasklite.core.EnqueueOptions;
import com.umitunal.tasklite.core.Job;
import com.umitunal.tasklite.core.JobFilter;
import com.umitunal.tasklite.core.JobQueue;
import com.umitunal.tasklite.core.JobStats;
import com.umitunal.tasklite.core.JobStatus;
import com.umitunal.tasklite.event.EventBus;
import com.umitunal.tasklite.event.EventType;
import com.umitunal.tasklite.event.payload.JobCompleted;
import com.umitunal.tasklite.event.payload.JobFailed;
import com.umitunal.tasklite.event.payload.JobLifecycle;
import com.umitunal.tasklite.event.payload.JobRetryScheduled;
import com.umitunal.tasklite.event.payload.SystemNotice;
import com.umitunal.tasklite.retry.Backoff;
import com.umitunal.tasklite.serialization.JsonCodec;
import com.umitunal.tasklite.util.DaemonThreadFactory;
import com.umitunal.tasklite.worker.JobHandler;
import com.umitunal.tasklite.worker.JobType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Job queue that mirrors its whole job list into a {@link JobStore} after
 * every state change.
 *
 * <p>Each wake (the periodic tick, an enqueue, a finished job or a retry
 * timer) starts at most one job: the pending job with the highest priority,
 * oldest first among equals, provided fewer than {@code concurrency} handlers
 * are running. Handlers run on a fixed pool of daemon threads.
 *
 * <p>Jobs found {@code running} in the store by {@link #init()} were
 * interrupted by a stop or crash and are reset to {@code pending}, so a job
 * may execute more than once but is never lost.
 *
 * <p>Lock order: this queue, then the store.
 */
public class PersistentJobQueue implements JobQueue {
    private static final Logger log = LoggerFactory.getLogger(PersistentJobQueue.class);
    private static final String SOURCE = "JobQueue";

    private final JobStore store;
    private final EventBus eventBus;
    private final JobQueueConfig config;
    private final JsonCodec codec;
    private final Clock clock;

    private final Map<String, Job> jobs = new LinkedHashMap<>();
    // Earliest System.nanoTime() at which a job waiting for a retry may start again
    private final Map<String, Long> retryNotBefore = new HashMap<>();
    private final Map<String, RegisteredHandler<?, ?>> handlers = new ConcurrentHashMap<>();
    private final AtomicLong sequence = new AtomicLong();
    private final ExecutorService workers;
    private final ScheduledExecutorService scheduler;

    private int running;
    private boolean started;
    private volatile boolean closed;

    public PersistentJobQueue(JobStore store, EventBus eventBus, JobQueueConfig config) {
        this(store, eventBus, config, new JsonCodec(), Clock.systemUTC());
    }

    public PersistentJobQueue(JobStore store, EventBus eventBus, JobQueueConfig config,
                              JsonCodec codec, Clock clock) {
        this.store = Objects.requireNonNull(store, "store must not be null");
        this.eventBus = Objects.requireNonNull(eventBus, "eventBus must not be null");
        this.config = Objects.requireNonNull(config, "config must not be null");
        this.codec = Objects.requireNonNull(codec, "codec must not be null");
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
        this.workers = Executors.newFixedThreadPool(config.getConcurrency(),
                new DaemonThreadFactory("tasklite-job-worker-"));
        this.scheduler = Executors.newSingleThreadScheduledExecutor(
                new DaemonThreadFactory("tasklite-job-scheduler-"));
    }

    /**
     * Restore persisted jobs, reset interrupted ones and start the periodic tick.
     */
    public void init() {
        List<Job> recovered = new ArrayList<>();
        int restored;
        synchronized (this) {
            if (started) {
                return;
            }
            ensureOpen();
            jobs.clear();
            for (Job job : store.load()) {
                if (job.getStatus() == JobStatus.RUNNING) {
                    job.resetAfterInterruption();
                    recovered.add(job);
                }
                jobs.put(job.getId(), job);
            }
            restored = jobs.size();
            if (!recovered.isEmpty()) {
                store.save(jobs.values());
            }
            started = true;
        }

        for (Job job : recovered) {
            log.warn("Job {} ({}) was interrupted while running, reset to pending", job.getId(), job.getType());
            eventBus.emitNonBlocking(EventType.JOB_RECOVERED, lifecycle(job), SOURCE);
        }
        log.info("Job queue started with {} jobs ({} recovered)", restored, recovered.size());

        long intervalMs = config.getProcessInterval().toMillis();
        scheduler.scheduleWithFixedDelay(this::tick, intervalMs, intervalMs, TimeUnit.MILLISECONDS);
        wake();
    }

    @Override
    public <P, R> void registerHandler(JobType<P> type, JobHandler<P, R> handler) {
        Objects.requireNonNull(type, "type must not be null");
        Objects.requireNonNull(handler, "handler must not be null");
        if (handlers.put(type.name(), new RegisteredHandler<>(type, handler)) != null) {
            log.warn("Replaced handler for job type {}", type.name());
        }
    }

    @Override
    public <P> String enqueue(JobType<P> type, P payload) {
        return enqueue(type, payload, EnqueueOptions.defaults());
    }

    @Override
    public <P> String enqueue(JobType<P> type, P payload, EnqueueOptions options) {
        Objects.requireNonNull(type, "type must not be null");
        Objects.requireNonNull(options, "options must not be null");
        JsonNode tree = codec.toTree(payload);

        Job job;
        synchronized (this) {
            ensureOpen();
            int maxRetries = options.getMaxRetries() != null ? options.getMaxRetries() : config.getMaxRetries();
            job = new Job(nextId(), type.name(), tree, options.getPriority(), maxRetries, clock.millis());
            jobs.put(job.getId(), job);
            try {
                store.save(jobs.values());
            } catch (RuntimeException e) {
                jobs.remove(job.getId());
                throw e;
            }
        }

        log.debug("Enqueued {}", job);
        eventBus.emitNonBlocking(EventType.JOB_ENQUEUED, lifecycle(job), SOURCE);
        wake();
        return job.getId();
    }

    @Override
    public boolean cancel(String jobId) {
        Job job;
        synchronized (this) {
            job = jobs.get(jobId);
            if (job == null || job.getStatus() != JobStatus.PENDING) {
                return false;
            }
            job.markCancelled(clock.millis());
            retryNotBefore.remove(jobId);
            persist();
        }
        log.debug("Cancelled {}", job);
        eventBus.emitNonBlocking(EventType.JOB_CANCELLED, lifecycle(job), SOURCE);
        return true;
    }

    @Override
    public synchronized Job getJob(String jobId) {
        Job job = jobs.get(jobId);
        return job == null ? null : job.copy();
    }

    @Override
    public synchronized List<Job> getJobs(JobFilter filter) {
        Objects.requireNonNull(filter, "filter must not be null");
        List<Job> result = new ArrayList<>();
        for (Job job : jobs.values()) {
            if (filter.test(job)) {
                result.add(job.copy());
            }
        }
        return result;
    }

    @Override
    public synchronized int clearCompleted() {
        int count = 0;
        Iterator<Job> it = jobs.values().iterator();
        while (it.hasNext()) {
            if (it.next().getStatus().isTerminal()) {
                it.remove();
                count++;
            }
        }
        if (count > 0) {
            persist();
        }
        return count;
    }

    @Override
    public synchronized JobStats getStats() {
        int pending = 0, runningJobs = 0, completed = 0, failed = 0, cancelled = 0;
        for (Job job : jobs.values()) {
            switch (job.getStatus()) {
                case PENDING: pending++; break;
                case RUNNING: runningJobs++; break;
                case COMPLETED: completed++; break;
                case FAILED: failed++; break;
                case CANCELLED: cancelled++; break;
                default: break;
            }
        }
        return new JobStats(jobs.size(), pending, runningJobs, completed, failed, cancelled, running);
    }

    /**
     * Run one scheduling step: start the best pending job if a slot is free.
     *
     * @return true if a job was picked, including one failed for lack of a handler
     */
    public boolean processNext() {
        Job job;
        Job snapshot;
        RegisteredHandler<?, ?> handler;
        synchronized (this) {
            if (closed || running >= config.getConcurrency()) {
                return false;
            }
            job = selectNext();
            if (job == null) {
                return false;
            }
            handler = handlers.get(job.getType());
            if (handler == null) {
                job.markFailed("No handler registered for job type: " + job.getType(), clock.millis());
                persist();
            } else {
                job.markRunning(clock.millis());
                running++;
                persist();
            }
            snapshot = job.copy();
        }

        if (handler == null) {
            log.error("No handler registered for job type {}, failing {}", job.getType(), job.getId());
            eventBus.emitNonBlocking(EventType.JOB_FAILED,
                    new JobFailed(job.getId(), job.getType(), snapshot.getError(), snapshot.getRetries()), SOURCE);
            wake();
            return true;
        }

        try {
            RegisteredHandler<?, ?> selected = handler;
            workers.execute(() -> execute(job, snapshot, selected));
        } catch (RejectedExecutionException e) {
            synchronized (this) {
                running--;
                job.resetAfterInterruption();
                persist();
            }
            log.warn("Worker pool rejected {}, left pending", job.getId(), e);
            return false;
        }
        return true;
    }

    @Override
    public void close() {
        synchronized (this) {
            if (closed) {
                return;
            }
            closed = true;
        }
        scheduler.shutdownNow();
        workers.shutdown();
        try {
            if (!workers.awaitTermination(5, TimeUnit.SECONDS)) {
                log.warn("Job handlers still running at shutdown, interrupting");
                workers.shutdownNow();
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            workers.shutdownNow();
        }
        log.info("Job queue closed");
    }

    private void execute(Job job, Job snapshot, RegisteredHandler<?, ?> handler) {
        eventBus.emitNonBlocking(EventType.JOB_STARTED, lifecycle(snapshot), SOURCE);
        log.debug("Running {}", snapshot);
        try {
            JsonNode result = codec.toTree(handler.run(codec, snapshot));
            onSuccess(job, result);
        } catch (Throwable e) {
            // Errors from a handler fail the job like any other failure.
            onFailure(job, e);
        } finally {
            synchronized (this) {
                running--;
            }
            wake();
        }
    }

    private void onSuccess(Job job, JsonNode result) {
        synchronized (this) {
            job.markCompleted(result, clock.millis());
            persist();
        }
        log.debug("Completed {}", job);
        eventBus.emitNonBlocking(EventType.JOB_COMPLETED,
                new JobCompleted(job.getId(), job.getType(), result), SOURCE);
    }

    private void onFailure(Job job, Throwable failure) {
        if (closed) {
            // Stays running in the store; init() resets it on the next start.
            log.warn("Job {} ({}) interrupted by shutdown: {}", job.getId(), job.getType(), describe(failure));
            return;
        }
        String error = describe(failure);
        boolean retry;
        int retries;
        long delayMs = 0;
        synchronized (this) {
            retry = job.canRetry();
            if (retry) {
                job.scheduleRetry(error);
                delayMs = Backoff.exponential(config.getRetryDelay().toMillis(), job.getRetries() - 1, Long.MAX_VALUE);
                retryNotBefore.put(job.getId(), System.nanoTime() + TimeUnit.MILLISECONDS.toNanos(delayMs));
            } else {
                job.markFailed(error, clock.millis());
            }
            retries = job.getRetries();
            persist();
        }

        if (retry) {
            log.warn("Job {} ({}) failed, retry {}/{} in {} ms: {}",
                    job.getId(), job.getType(), retries, job.getMaxRetries(), delayMs, error);
            eventBus.emitNonBlocking(EventType.JOB_RETRY_SCHEDULED,
                    new JobRetryScheduled(job.getId(), job.getType(), error, retries, job.getMaxRetries(), delayMs),
                    SOURCE);
            scheduleWake(delayMs);
        } else {
            log.error("Job {} ({}) failed after {} retries", job.getId(), job.getType(), retries, failure);
            eventBus.emitNonBlocking(EventType.JOB_FAILED,
                    new JobFailed(job.getId(), job.getType(), error, retries), SOURCE);
        }
    }

    private Job selectNext() {
        long now = System.nanoTime();
        Job best = null;
        for (Job job : jobs.values()) {
            if (job.getStatus() != JobStatus.PENDING) {
                continue;
            }
            Long notBefore = retryNotBefore.get(job.getId());
            if (notBefore != null) {
                if (notBefore - now > 0) {
                    continue;
                }
                retryNotBefore.remove(job.getId());
            }
            if (best == null
                    || job.getPriority().weight() > best.getPriority().weight()
                    || (job.getPriority() == best.getPriority() && job.getCreatedAt() < best.getCreatedAt())) {
                best = job;
            }
        }
        return best;
    }

    private void tick() {
        try {
            processNext();
        } catch (RuntimeException e) {
            // A throwing task would cancel the schedule.
            log.error("Job queue tick failed", e);
            eventBus.emitNonBlocking(EventType.SYSTEM_ERROR,
                    new SystemNotice(SOURCE, "Scheduling failed: " + e.getMessage(), e), SOURCE);
        }
    }

    private void wake() {
        scheduleWake(0);
    }

    private void scheduleWake(long delayMs) {
        if (closed) {
            return;
        }
        try {
            scheduler.schedule(this::tick, delayMs, TimeUnit.MILLISECONDS);
        } catch (RejectedExecutionException e) {
            log.debug("Scheduler is shut down, wake dropped");
        }
    }

    /**
     * Write the job list, reporting rather than propagating a failure. The
     * in-memory state stays authoritative and is written again on the next change.
     */
    private void persist() {
        try {
            store.save(jobs.values());
        } catch (RuntimeException e) {
            log.error("Failed to persist job queue", e);
            eventBus.emitNonBlocking(EventType.SYSTEM_ERROR,
                    new SystemNotice(SOURCE, "Failed to persist job queue: " + e.getMessage(), e), SOURCE);
        }
    }

    private void ensureOpen() {
        if (closed) {
            throw new IllegalStateException("Job queue is closed");
        }
    }

    private String nextId() {
        return "job_" + clock.millis() + "_" + sequence.incrementAndGet();
    }

    private static JobLifecycle lifecycle(Job job) {
        return new JobLifecycle(job.getId(), job.getType(), job.getPriority(), job.getRetries());
    }

    private static String describe(Throwable failure) {
        return failure.getMessage() != null ? failure.getMessage() : failure.getClass().getSimpleName();
    }

    private static final class RegisteredHandler<P, R> {
        private final JobType<P> type;
        private final JobHandler<P, R> handler;

        private RegisteredHandler(JobType<P> type, JobHandler<P, R> handler) {
            this.type = type;
            this.handler = handler;
        }

        private R run(JsonCodec codec, Job snapshot) throws Exception {
            P payload = codec.fromTree(snapshot.getPayload(), type.payloadType());
            return handler.handle(payload, snapshot);
        }
    }
}
