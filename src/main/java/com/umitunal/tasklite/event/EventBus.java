package com.umitunal.tasklite.event;

import com.umitunal.tasklite.event.payload.EventPayload;
import com.umitunal.tasklite.util.DaemonThreadFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.Deque;
import java.util.EnumMap;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;

/**
 * In-process publish/subscribe dispatcher with priority ordering, wildcard
 * subscriptions, per-handler error isolation and a bounded event history.
 *
 * <p>{@link #emit} delivers on the caller's thread and returns once every
 * handler has run. {@link #emitNonBlocking} hands the same work to a single
 * background dispatcher thread, so events emitted that way are delivered in
 * submission order.
 */
public class EventBus implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(EventBus.class);

    public static final int DEFAULT_HISTORY_CAPACITY = 100;
    public static final int DEFAULT_MAX_LISTENERS = 100;
    public static final int DEFAULT_DISPATCH_QUEUE_CAPACITY = 1024;

    private static final Comparator<Registration> DELIVERY_ORDER =
            Comparator.comparingInt((Registration r) -> r.priority).reversed()
                    .thenComparingLong(r -> r.id);

    private final Map<EventType, List<Registration>> handlers = new EnumMap<>(EventType.class);
    private final Deque<Event> history = new ArrayDeque<>();
    private final AtomicLong registrationIds = new AtomicLong();
    private final int historyCapacity;
    private final int maxListeners;
    private final EventErrorHandler errorHandler;
    private final Clock clock;
    private final ThreadPoolExecutor dispatcher;

    public EventBus() {
        this(builder());
    }

    private EventBus(Builder builder) {
        this.historyCapacity = builder.historyCapacity;
        this.maxListeners = builder.maxListeners;
        this.errorHandler = builder.errorHandler != null ? builder.errorHandler : EventBus::logHandlerError;
        this.clock = builder.clock;
        this.dispatcher = new ThreadPoolExecutor(1, 1, 0L, TimeUnit.MILLISECONDS,
                new ArrayBlockingQueue<>(builder.dispatchQueueCapacity),
                new DaemonThreadFactory("tasklite-events-"),
                new ThreadPoolExecutor.AbortPolicy());
    }

    /**
     * Subscribe with default priority 0.
     */
    public Subscription subscribe(EventType type, EventHandler handler) {
        return subscribe(type, handler, 0);
    }

    /**
     * Subscribe to an event type, or to {@link EventType#ANY} for all events.
     *
     * @param priority higher priority handlers run first
     * @return handle that removes this registration
     */
    public Subscription subscribe(EventType type, EventHandler handler, int priority) {
        return addHandler(type, handler, priority, false);
    }

    public Subscription subscribeOnce(EventType type, EventHandler handler) {
        return subscribeOnce(type, handler, 0);
    }

    /**
     * Subscribe for a single delivery. The registration is dropped after its
     * first invocation, whether the handler succeeded or threw.
     */
    public Subscription subscribeOnce(EventType type, EventHandler handler, int priority) {
        return addHandler(type, handler, priority, true);
    }

    /**
     * Remove the first registration of {@code handler} for {@code type}.
     */
    public synchronized void unsubscribe(EventType type, EventHandler handler) {
        List<Registration> registrations = handlers.get(type);
        if (registrations == null) {
            return;
        }
        Iterator<Registration> it = registrations.iterator();
        while (it.hasNext()) {
            if (it.next().handler == handler) {
                it.remove();
                return;
            }
        }
    }

    /**
     * Emit an event and run every matching handler before returning.
     *
     * @throws IllegalArgumentException if the payload does not belong to the type,
     *                                  or the type is the wildcard
     */
    public void emit(EventType type, EventPayload payload, String source) {
        dispatch(createEvent(type, payload, source));
    }

    /**
     * Emit without waiting for handlers. Failures of the background delivery,
     * including a full dispatch queue, go to the error handler.
     */
    public void emitNonBlocking(EventType type, EventPayload payload, String source) {
        Event event = createEvent(type, payload, source);
        try {
            dispatcher.execute(() -> {
                try {
                    dispatch(event);
                } catch (RuntimeException e) {
                    reportError(e, event);
                }
            });
        } catch (RejectedExecutionException e) {
            reportError(e, event);
        }
    }

    /**
     * Most recent events, oldest first.
     *
     * @param type  filter, or null / {@link EventType#ANY} for all types
     * @param limit maximum number of events returned
     */
    public synchronized List<Event> getHistory(EventType type, int limit) {
        List<Event> matching = new ArrayList<>();
        for (Event event : history) {
            if (type == null || type.isWildcard() || event.getType() == type) {
                matching.add(event);
            }
        }
        int from = Math.max(0, matching.size() - Math.max(0, limit));
        return new ArrayList<>(matching.subList(from, matching.size()));
    }

    public List<Event> getHistory() {
        return getHistory(null, 10);
    }

    public synchronized void clearHistory() {
        history.clear();
    }

    /**
     * Number of handlers that would receive an event of this type. For
     * {@link EventType#ANY} only wildcard handlers are counted.
     */
    public synchronized int listenerCount(EventType type) {
        int wildcard = sizeOf(EventType.ANY);
        if (type.isWildcard()) {
            return wildcard;
        }
        return sizeOf(type) + wildcard;
    }

    /**
     * Remove every handler of a type, or of all types when {@code type} is null.
     */
    public synchronized void removeAllListeners(EventType type) {
        if (type == null) {
            handlers.clear();
        } else {
            handlers.remove(type);
        }
    }

    /**
     * Concrete event types that currently have at least one handler.
     */
    public synchronized List<EventType> eventTypes() {
        List<EventType> types = new ArrayList<>();
        handlers.forEach((type, registrations) -> {
            if (!type.isWildcard() && !registrations.isEmpty()) {
                types.add(type);
            }
        });
        return types;
    }

    @Override
    public void close() {
        dispatcher.shutdown();
        try {
            if (!dispatcher.awaitTermination(5, TimeUnit.SECONDS)) {
                log.warn("Event dispatcher did not drain in time, {} events dropped",
                        dispatcher.shutdownNow().size());
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            dispatcher.shutdownNow();
        }
    }

    private Event createEvent(EventType type, EventPayload payload, String source) {
        Objects.requireNonNull(type, "type must not be null");
        Objects.requireNonNull(payload, "payload must not be null");
        if (type.isWildcard()) {
            throw new IllegalArgumentException("Cannot emit the wildcard type");
        }
        if (!type.payloadType().isInstance(payload)) {
            throw new IllegalArgumentException(String.format("Event %s carries %s, got %s",
                    type, type.payloadType().getSimpleName(), payload.getClass().getSimpleName()));
        }
        return new Event(type, payload, clock.millis(), source);
    }

    private void dispatch(Event event) {
        List<Registration> targets;
        synchronized (this) {
            history.addLast(event);
            while (history.size() > historyCapacity) {
                history.removeFirst();
            }
            targets = new ArrayList<>(handlers.getOrDefault(event.getType(), List.of()));
            targets.addAll(handlers.getOrDefault(EventType.ANY, List.of()));
        }
        targets.sort(DELIVERY_ORDER);

        log.trace("Dispatching {} to {} handlers", event, targets.size());
        for (Registration registration : targets) {
            if (registration.once && !registration.fired.compareAndSet(false, true)) {
                continue;
            }
            try {
                registration.handler.onEvent(event);
            } catch (Exception e) {
                reportError(e, event);
            } finally {
                if (registration.once) {
                    removeRegistration(registration);
                }
            }
        }
    }

    private synchronized Subscription addHandler(EventType type, EventHandler handler, int priority, boolean once) {
        Objects.requireNonNull(type, "type must not be null");
        Objects.requireNonNull(handler, "handler must not be null");
        Registration registration = new Registration(type, handler, priority, once, registrationIds.incrementAndGet());
        List<Registration> registrations = handlers.computeIfAbsent(type, t -> new ArrayList<>());
        if (registrations.size() >= maxListeners) {
            log.warn("Max listeners ({}) reached for {}", maxListeners, type.tag());
        }
        registrations.add(registration);
        return () -> removeRegistration(registration);
    }

    private synchronized void removeRegistration(Registration registration) {
        List<Registration> registrations = handlers.get(registration.type);
        if (registrations != null) {
            registrations.remove(registration);
        }
    }

    private int sizeOf(EventType type) {
        List<Registration> registrations = handlers.get(type);
        return registrations == null ? 0 : registrations.size();
    }

    private void reportError(Throwable error, Event event) {
        try {
            errorHandler.onError(error, event);
        } catch (RuntimeException sinkFailure) {
            log.error("Event error handler failed for {}", event.getType().tag(), sinkFailure);
        }
    }

    private static void logHandlerError(Throwable error, Event event) {
        log.error("Error in handler for {} from {}", event.getType().tag(), event.getSource(), error);
    }

    public static Builder builder() {
        return new Builder();
    }

    private static final class Registration {
        private final EventType type;
        private final EventHandler handler;
        private final int priority;
        private final boolean once;
        private final long id;
        private final AtomicBoolean fired = new AtomicBoolean(false);

        private Registration(EventType type, EventHandler handler, int priority, boolean once, long id) {
            this.type = type;
            this.handler = handler;
            this.priority = priority;
            this.once = once;
            this.id = id;
        }
    }

    public static class Builder {
        private int historyCapacity = DEFAULT_HISTORY_CAPACITY;
        private int maxListeners = DEFAULT_MAX_LISTENERS;
        private int dispatchQueueCapacity = DEFAULT_DISPATCH_QUEUE_CAPACITY;
        private EventErrorHandler errorHandler;
        private Clock clock = Clock.systemUTC();

        private Builder() {
        }

        /**
         * Number of events retained for diagnostics.
         * Default: 100
         */
        public Builder withHistoryCapacity(int capacity) {
            if (capacity < 0) {
                throw new IllegalArgumentException("historyCapacity must be >= 0, got: " + capacity);
            }
            this.historyCapacity = capacity;
            return this;
        }

        /**
         * Listener count per type above which a warning is logged.
         * Default: 100
         */
        public Builder withMaxListeners(int maxListeners) {
            this.maxListeners = maxListeners;
            return this;
        }

        /**
         * Pending non-blocking emissions before new ones are rejected.
         * Default: 1024
         */
        public Builder withDispatchQueueCapacity(int capacity) {
            if (capacity <= 0) {
                throw new IllegalArgumentException("dispatchQueueCapacity must be > 0, got: " + capacity);
            }
            this.dispatchQueueCapacity = capacity;
            return this;
        }

        /**
         * Sink for handler failures. Default: log at ERROR.
         */
        public Builder withErrorHandler(EventErrorHandler errorHandler) {
            this.errorHandler = errorHandler;
            return this;
        }

        public Builder withClock(Clock clock) {
            this.clock = Objects.requireNonNull(clock, "clock must not be null");
            return this;
        }

        public EventBus build() {
            return new EventBus(this);
        }
    }
}
