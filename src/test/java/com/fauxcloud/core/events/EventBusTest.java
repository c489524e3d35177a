package com.fauxcloud.core.events;

import com.fauxcloud.core.model.InstanceStatus;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for {@link EventBus}.
 */
class EventBusTest {

    private EventBus eventBus;

    @BeforeEach
    void setUp() {
        eventBus = new EventBus();
    }

    private static InstanceEvent event(String type, String instanceId) {
        return new InstanceEvent(type, instanceId, InstanceStatus.RUNNING, Map.of(), Instant.now());
    }

    @Nested
    @DisplayName("subscribe and publish")
    class SubscribeAndPublishTests {

        @Test
        @DisplayName("instance subscriber receives only its instance's events")
        void instanceSubscriberIsScoped() {
            List<InstanceEvent> received = new ArrayList<>();
            eventBus.subscribe("fsc-1", received::add);

            eventBus.publish(event("instance.started", "fsc-1"));
            eventBus.publish(event("instance.started", "fsc-2"));

            assertEquals(1, received.size());
            assertEquals("fsc-1", received.get(0).instanceId());
        }

        @Test
        @DisplayName("global subscriber receives every event")
        void globalSubscriber() {
            List<InstanceEvent> received = new ArrayList<>();
            eventBus.subscribeAll(received::add);

            eventBus.publish(event("instance.created", "fsc-1"));
            eventBus.publish(event("instance.destroyed", "fsc-2"));

            assertEquals(List.of("instance.created", "instance.destroyed"),
                    received.stream().map(InstanceEvent::eventType).toList());
        }

        @Test
        @DisplayName("publishing with no subscribers is a no-op")
        void noSubscribers() {
            assertDoesNotThrow(() -> eventBus.publish(event("instance.created", "fsc-1")));
        }
    }

    @Nested
    @DisplayName("unsubscribe")
    class UnsubscribeTests {

        @Test
        @DisplayName("stops delivery for both subscription kinds")
        void stopsDelivery() {
            List<InstanceEvent> scoped = new ArrayList<>();
            List<InstanceEvent> global = new ArrayList<>();
            var first = eventBus.subscribe("fsc-1", scoped::add);
            var second = eventBus.subscribeAll(global::add);

            first.unsubscribe();
            second.unsubscribe();
            eventBus.publish(event("instance.started", "fsc-1"));

            assertTrue(scoped.isEmpty());
            assertTrue(global.isEmpty());
        }
    }

    @Nested
    @DisplayName("termination")
    class TerminationTests {

        @Test
        @DisplayName("instance listeners get the TERMINATED event and are then dropped")
        void dropsListenersAfterFinalEvent() {
            List<InstanceEvent> scoped = new ArrayList<>();
            List<InstanceEvent> global = new ArrayList<>();
            eventBus.subscribe("fsc-1", scoped::add);
            eventBus.subscribeAll(global::add);
            assertEquals(1, eventBus.listenerCount("fsc-1"));

            eventBus.publish(new InstanceEvent("instance.destroyed", "fsc-1", InstanceStatus.TERMINATED,
                    Map.of(), Instant.now()));
            eventBus.publish(event("instance.created", "fsc-1"));

            assertEquals(1, scoped.size());
            assertTrue(scoped.get(0).isFinal());
            assertEquals(0, eventBus.listenerCount("fsc-1"));
            assertEquals(2, global.size());
        }

        @Test
        @DisplayName("unsubscribing the last listener forgets the instance")
        void unsubscribeClearsEntry() {
            var subscription = eventBus.subscribe("fsc-1", e -> { });
            subscription.unsubscribe();
            subscription.unsubscribe();

            assertEquals(0, eventBus.listenerCount("fsc-1"));
        }
    }

    @Nested
    @DisplayName("error isolation")
    class ErrorIsolationTests {

        @Test
        @DisplayName("a throwing subscriber does not block the others")
        void throwingSubscriber() {
            List<InstanceEvent> received = new ArrayList<>();
            eventBus.subscribe("fsc-1", e -> { throw new IllegalStateException("boom"); });
            eventBus.subscribeAll(received::add);

            eventBus.publish(event("instance.failed", "fsc-1"));

            assertEquals(1, received.size());
        }
    }

    @Test
    @DisplayName("concurrent publishers deliver every event")
    void concurrentPublish() throws Exception {
        List<InstanceEvent> received = new CopyOnWriteArrayList<>();
        eventBus.subscribeAll(received::add);
        int threads = 8;
        var done = new CountDownLatch(threads);

        for (int t = 0; t < threads; t++) {
            String id = "fsc-" + t;
            new Thread(() -> {
                for (int i = 0; i < 50; i++) {
                    eventBus.publish(event("instance.health", id));
                }
                done.countDown();
            }).start();
        }

        assertTrue(done.await(5, TimeUnit.SECONDS));
        assertEquals(threads * 50, received.size());
    }
}
