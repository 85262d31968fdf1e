package com.umitunal.tasklite.event;

/**
 * Subscriber callback. Exceptions are isolated by the bus and routed to its
 * {@link EventErrorHandler}.
 */
@FunctionalInterface
public interface EventHandler {

    void onEvent(Event event) throws Exception;
}
