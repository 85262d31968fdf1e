package com.umitunal.tasklite.event;

import com.umitunal.tasklite.event.payload.EventPayload;

import java.util.Objects;

/**
 * Immutable record of one emission.
 */
public final class Event {
    private final EventType type;
    private final EventPayload payload;
    private final long timestamp;
    private final String source;

    public Event(EventType type, EventPayload payload, long timestamp, String source) {
        this.type = Objects.requireNonNull(type, "type must not be null");
        this.payload = Objects.requireNonNull(payload, "payload must not be null");
        this.timestamp = timestamp;
        this.source = source;
    }

    public EventType getType() { return type; }
    public EventPayload getPayload() { return payload; }
    public long getTimestamp() { return timestamp; }

    /**
     * @return the emitting component, or null if none was given
     */
    public String getSource() { return source; }

    /**
     * Typed access to the payload.
     *
     * @throws ClassCastException if the payload is not of the requested class
     */
    public <P extends EventPayload> P payload(Class<P> payloadType) {
        return payloadType.cast(payload);
    }

    @Override
    public String toString() {
        return String.format("Event{type=%s, source='%s', timestamp=%d, payload=%s}",
                type.tag(), source, timestamp, payload);
    }
}
