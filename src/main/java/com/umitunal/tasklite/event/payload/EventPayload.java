package com.umitunal.tasklite.event.payload;

/**
 * Marker for the typed payloads carried by events. Each
 * {@link com.umitunal.tasklite.event.EventType} names the payload class it carries.
 */
public interface EventPayload {
}
