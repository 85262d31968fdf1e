package com.umitunal.tasklite.event;

/**
 * Handle returned by subscribe calls. Unsubscribing twice is a no-op.
 */
@FunctionalInterface
public interface Subscription {

    void unsubscribe();
}
