package com.umitunal.tasklite.event;

import com.umitunal.tasklite.event.payload.JobFailed;
import com.umitunal.tasklite.event.payload.StorageCleaned;
import com.umitunal.tasklite.event.payload.SystemNotice;
import org.junit.jupiter.api.*;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.*;
import static org.awaitility.Awaitility.*;

class EventBusTest {

    private EventBus bus;
    private List<Throwable> errors;

    @BeforeEach
    void setUp() {
        errors = new CopyOnWriteArrayList<>();
        bus = EventBus.builder()
                .withErrorHandler((error, event) -> errors.add(error))
                .build();
    }

    @AfterEach
    void tearDown() {
        bus.close();
    }

    private static SystemNotice notice(String message) {
        return new SystemNotice("test", message, null);
    }

    @Test
    @DisplayName("Should run handlers by descending priority, then registration order")
    void testPriorityOrder() {
        // Given
        List<String> calls = new CopyOnWriteArrayList<>();
        bus.subscribe(EventType.SYSTEM_WARNING, e -> calls.add("low"), 1);
        bus.subscribe(EventType.SYSTEM_WARNING, e -> calls.add("high"), 10);
        bus.subscribe(EventType.SYSTEM_WARNING, e -> calls.add("first-default"));
        bus.subscribe(EventType.SYSTEM_WARNING, e -> calls.add("second-default"));

        // When
        bus.emit(EventType.SYSTEM_WARNING, notice("disk"), "test");

        // Then
        assertThat(calls).containsExactly("high", "low", "first-default", "second-default");
    }

    @Test
    @DisplayName("Should merge wildcard handlers with type handlers by priority")
    void testWildcardHandlers() {
        // Given
        List<String> calls = new CopyOnWriteArrayList<>();
        bus.subscribe(EventType.ANY, e -> calls.add("any:" + e.getType().tag()), 5);
        bus.subscribe(EventType.STORAGE_CLEANED, e -> calls.add("cleaned"), 0);

        // When
        bus.emit(EventType.STORAGE_CLEANED, new StorageCleaned(10, 1), "test");
        bus.emit(EventType.SYSTEM_WARNING, notice("x"), "test");

        // Then
        assertThat(calls).containsExactly("any:storage:cleaned", "cleaned", "any:system:warning");
    }

    @Test
    @DisplayName("Should isolate a failing handler from the others")
    void testErrorIsolation() {
        // Given
        List<String> calls = new CopyOnWriteArrayList<>();
        bus.subscribe(EventType.SYSTEM_WARNING, e -> { throw new IllegalStateException("boom"); }, 10);
        bus.subscribe(EventType.SYSTEM_WARNING, e -> calls.add("survivor"), 0);

        // When
        bus.emit(EventType.SYSTEM_WARNING, notice("x"), "test");

        // Then
        assertThat(calls).containsExactly("survivor");
        assertThat(errors).hasSize(1);
        assertThat(errors.get(0)).isInstanceOf(IllegalStateException.class).hasMessage("boom");
    }

    @Test
    @DisplayName("Should drop a one-shot handler after its first invocation, even when it throws")
    void testSubscribeOnce() {
        // Given
        List<String> calls = new CopyOnWriteArrayList<>();
        bus.subscribeOnce(EventType.SYSTEM_WARNING, e -> calls.add("once"));
        bus.subscribeOnce(EventType.SYSTEM_WARNING, e -> { throw new RuntimeException("fails once"); });

        // When
        bus.emit(EventType.SYSTEM_WARNING, notice("1"), "test");
        bus.emit(EventType.SYSTEM_WARNING, notice("2"), "test");

        // Then
        assertThat(calls).containsExactly("once");
        assertThat(errors).hasSize(1);
        assertThat(bus.listenerCount(EventType.SYSTEM_WARNING)).isZero();
    }

    @Test
    @DisplayName("Should stop delivery after unsubscribe")
    void testUnsubscribe() {
        // Given
        List<String> calls = new CopyOnWriteArrayList<>();
        EventHandler handler = e -> calls.add("direct");
        bus.subscribe(EventType.SYSTEM_WARNING, handler);
        Subscription subscription = bus.subscribe(EventType.SYSTEM_WARNING, e -> calls.add("handle"));

        // When
        bus.unsubscribe(EventType.SYSTEM_WARNING, handler);
        subscription.unsubscribe();
        bus.emit(EventType.SYSTEM_WARNING, notice("x"), "test");

        // Then
        assertThat(calls).isEmpty();
    }

    @Test
    @DisplayName("Should keep only the most recent events in history")
    void testHistoryRingBuffer() {
        // Given
        EventBus small = EventBus.builder().withHistoryCapacity(3).build();

        // When
        for (int i = 0; i < 5; i++) {
            small.emit(EventType.SYSTEM_WARNING, notice("n" + i), "test");
        }

        // Then
        List<Event> history = small.getHistory(null, 10);
        assertThat(history).hasSize(3);
        assertThat(history).extracting(e -> e.payload(SystemNotice.class).getMessage())
                .containsExactly("n2", "n3", "n4");
        small.close();
    }

    @Test
    @DisplayName("Should filter and limit history")
    void testHistoryFilter() {
        // Given
        bus.emit(EventType.SYSTEM_WARNING, notice("a"), "test");
        bus.emit(EventType.JOB_FAILED, new JobFailed("job_1", "scrape", "oops", 3), "queue");
        bus.emit(EventType.SYSTEM_WARNING, notice("b"), "test");
        bus.emit(EventType.SYSTEM_WARNING, notice("c"), "test");

        // When
        List<Event> warnings = bus.getHistory(EventType.SYSTEM_WARNING, 2);

        // Then
        assertThat(warnings).extracting(e -> e.payload(SystemNotice.class).getMessage())
                .containsExactly("b", "c");
        assertThat(bus.getHistory(EventType.ANY, 100)).hasSize(4);

        bus.clearHistory();
        assertThat(bus.getHistory()).isEmpty();
    }

    @Test
    @DisplayName("Should reject a payload that does not belong to the event type")
    void testPayloadTypeChecked() {
        assertThatThrownBy(() -> bus.emit(EventType.JOB_FAILED, notice("wrong"), "test"))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> bus.emit(EventType.ANY, notice("wildcard"), "test"))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    @DisplayName("Should deliver non-blocking emissions in order on the dispatcher thread")
    void testEmitNonBlocking() {
        // Given
        List<String> calls = new CopyOnWriteArrayList<>();
        List<String> threads = new CopyOnWriteArrayList<>();
        bus.subscribe(EventType.SYSTEM_WARNING, e -> {
            calls.add(e.payload(SystemNotice.class).getMessage());
            threads.add(Thread.currentThread().getName());
        });

        // When
        for (int i = 0; i < 20; i++) {
            bus.emitNonBlocking(EventType.SYSTEM_WARNING, notice("m" + i), "test");
        }

        // Then
        await().atMost(5, TimeUnit.SECONDS).until(() -> calls.size() == 20);
        assertThat(calls).startsWith("m0", "m1", "m2").endsWith("m19");
        assertThat(threads).allMatch(name -> name.startsWith("tasklite-events-"));
    }

    @Test
    @DisplayName("Should route non-blocking handler failures to the error handler")
    void testEmitNonBlockingErrors() {
        // Given
        bus.subscribe(EventType.SYSTEM_WARNING, e -> { throw new Exception("async boom"); });

        // When
        bus.emitNonBlocking(EventType.SYSTEM_WARNING, notice("x"), "test");

        // Then
        await().atMost(5, TimeUnit.SECONDS).until(() -> errors.size() == 1);
        assertThat(errors.get(0)).hasMessage("async boom");
    }

    @Test
    @DisplayName("Should count, list and remove listeners")
    void testListenerManagement() {
        // Given
        bus.subscribe(EventType.SYSTEM_WARNING, e -> { });
        bus.subscribe(EventType.SYSTEM_WARNING, e -> { });
        bus.subscribe(EventType.JOB_FAILED, e -> { });
        bus.subscribe(EventType.ANY, e -> { });

        // Then
        assertThat(bus.listenerCount(EventType.SYSTEM_WARNING)).isEqualTo(3);
        assertThat(bus.listenerCount(EventType.ANY)).isEqualTo(1);
        assertThat(bus.eventTypes()).containsExactlyInAnyOrder(EventType.SYSTEM_WARNING, EventType.JOB_FAILED);

        // When
        bus.removeAllListeners(EventType.SYSTEM_WARNING);

        // Then
        assertThat(bus.listenerCount(EventType.SYSTEM_WARNING)).isEqualTo(1);

        bus.removeAllListeners(null);
        assertThat(bus.listenerCount(EventType.JOB_FAILED)).isZero();
        assertThat(bus.eventTypes()).isEmpty();
    }
}
