package com.umitunal.tasklite.event.payload;

/**
 * A throttled call had to wait for its slot.
 */
public final class RateLimited implements EventPayload {
    private final String destination;
    private final long waitMs;
    private final int queueLength;

    public RateLimited(String destination, long waitMs, int queueLength) {
        this.destination = destination;
        this.waitMs = waitMs;
        this.queueLength = queueLength;
    }

    public String getDestination() { return destination; }
    public long getWaitMs() { return waitMs; }
    public int getQueueLength() { return queueLength; }

    @Override
    public String toString() {
        return String.format("RateLimited{destination='%s', waitMs=%d, queueLength=%d}",
                destination, waitMs, queueLength);
    }
}
