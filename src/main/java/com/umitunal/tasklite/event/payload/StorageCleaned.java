package com.umitunal.tasklite.event.payload;

public final class StorageCleaned implements EventPayload {
    private final long freedBytes;
    private final int removedCount;

    public StorageCleaned(long freedBytes, int removedCount) {
        this.freedBytes = freedBytes;
        this.removedCount = removedCount;
    }

    public long getFreedBytes() { return freedBytes; }
    public int getRemovedCount() { return removedCount; }

    @Override
    public String toString() {
        return String.format("StorageCleaned{freedBytes=%d, removedCount=%d}", freedBytes, removedCount);
    }
}
