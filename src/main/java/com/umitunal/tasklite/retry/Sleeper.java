package com.umitunal.tasklite.retry;

/**
 * Waits between retry attempts. Replaceable so callers can observe or skip
 * the delays.
 */
@FunctionalInterface
public interface Sleeper {

    Sleeper THREAD_SLEEP = Thread::sleep;

    void sleep(long millis) throws InterruptedException;
}
