package com.umitunal.tasklite.core;

/**
 * Job counts per status, plus the number of handlers currently executing.
 */
public class JobStats {
    private final int total;
    private final int pending;
    private final int running;
    private final int completed;
    private final int failed;
    private final int cancelled;
    private final int activeWorkers;

    public JobStats(int total, int pending, int running, int completed, int failed, int cancelled, int activeWorkers) {
        this.total = total;
        this.pending = pending;
        this.running = running;
        this.completed = completed;
        this.failed = failed;
        this.cancelled = cancelled;
        this.activeWorkers = activeWorkers;
    }

    public int getTotal() { return total; }
    public int getPending() { return pending; }
    public int getRunning() { return running; }
    public int getCompleted() { return completed; }
    public int getFailed() { return failed; }
    public int getCancelled() { return cancelled; }
    public int getActiveWorkers() { return activeWorkers; }

    @Override
    public String toString() {
        return String.format(
            "JobStats{total=%d, pending=%d, running=%d, completed=%d, failed=%d, cancelled=%d, active=%d}",
            total, pending, running, completed, failed, cancelled, activeWorkers
        );
    }
}
