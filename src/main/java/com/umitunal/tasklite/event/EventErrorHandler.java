package com.umitunal.tasklite.event;

@FunctionalInterface
public interface EventErrorHandler {

    /**
     * @param error the failure raised by a handler or by background dispatch
     * @param event the event being delivered
     */
    void onError(Throwable error, Event event);
}
