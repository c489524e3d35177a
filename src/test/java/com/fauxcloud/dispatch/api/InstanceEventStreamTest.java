package com.fauxcloud.dispatch.api;

import com.fauxcloud.core.events.EventBus;
import com.fauxcloud.core.events.InstanceEvent;
import com.fauxcloud.core.model.Instance;
import com.fauxcloud.core.model.InstanceConfig;
import com.fauxcloud.core.model.InstanceStatus;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;

import java.io.IOException;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;

import static org.junit.jupiter.api.Assertions.*;

class InstanceEventStreamTest {

    private static final Instant T0 = Instant.parse("2026-03-01T12:00:00Z");

    private EventBus eventBus;
    private List<RecordingEmitter> emitters;
    private InstanceEventStream stream;

    @BeforeEach
    void setUp() {
        eventBus = new EventBus();
        emitters = new CopyOnWriteArrayList<>();
        stream = new InstanceEventStream(eventBus, 60_000L) {
            @Override
            SseEmitter newEmitter(long timeoutMs) {
                var emitter = new RecordingEmitter();
                emitters.add(emitter);
                return emitter;
            }
        };
    }

    private static Instance instance(String id, InstanceStatus status) {
        var instance = new Instance(id, "demo", InstanceConfig.defaults(), T0, T0.plusSeconds(3600), Map.of());
        instance.setStatus(status);
        return instance;
    }

    private static InstanceEvent event(String type, String id, InstanceStatus status) {
        return new InstanceEvent(type, id, status, Map.of(), T0);
    }

    /** Captures frames instead of writing them to a response. */
    static class RecordingEmitter extends SseEmitter {

        final List<String> frames = new CopyOnWriteArrayList<>();
        volatile boolean completed;
        volatile boolean broken;

        @Override
        public void send(SseEventBuilder builder) throws IOException {
            if (broken) {
                throw new IOException("client went away");
            }
            var frame = new StringBuilder();
            builder.build().forEach(part -> frame.append(part.getData()));
            frames.add(frame.toString());
        }

        @Override
        public void complete() {
            completed = true;
        }
    }

    @Nested
    @DisplayName("open")
    class OpenTests {

        @Test
        @DisplayName("sends a connected comment and the current status first")
        void sendsSnapshot() {
            stream.open(instance("fsc-a", InstanceStatus.STARTING));

            List<String> frames = emitters.get(0).frames;
            assertEquals(2, frames.size());
            assertTrue(frames.get(0).startsWith(":connected"));
            assertTrue(frames.get(1).contains("event:instance.snapshot"));
            assertTrue(frames.get(1).contains("status=STARTING"));
            assertTrue(frames.get(1).contains("expires_at=2026-03-01T13:00:00Z"));
            assertEquals(1, stream.openStreamCount());
            assertEquals(1, eventBus.listenerCount("fsc-a"));
        }
    }

    @Nested
    @DisplayName("relay")
    class RelayTests {

        @Test
        @DisplayName("forwards the instance's events with status and payload")
        void forwardsEvents() {
            stream.open(instance("fsc-a", InstanceStatus.PROVISIONING));

            eventBus.publish(new InstanceEvent("instance.started", "fsc-a", InstanceStatus.STARTING,
                    Map.of("note", "up"), T0));

            String frame = emitters.get(0).frames.get(2);
            assertTrue(frame.contains("event:instance.started"));
            assertTrue(frame.contains("status=STARTING"));
            assertTrue(frame.contains("note=up"));
        }

        @Test
        @DisplayName("ignores events of other instances")
        void ignoresOtherInstances() {
            stream.open(instance("fsc-a", InstanceStatus.RUNNING));

            eventBus.publish(event("instance.stopped", "fsc-b", InstanceStatus.STOPPED));

            assertEquals(2, emitters.get(0).frames.size());
        }

        @Test
        @DisplayName("completes the stream after the TERMINATED event")
        void completesOnTermination() {
            stream.open(instance("fsc-a", InstanceStatus.RUNNING));

            eventBus.publish(event("instance.destroyed", "fsc-a", InstanceStatus.TERMINATED));

            RecordingEmitter emitter = emitters.get(0);
            assertTrue(emitter.frames.get(2).contains("event:instance.destroyed"));
            assertTrue(emitter.completed);
            assertEquals(0, stream.openStreamCount());
            assertEquals(0, eventBus.listenerCount("fsc-a"));
        }

        @Test
        @DisplayName("drops a stream whose client has gone away")
        void dropsBrokenStream() {
            stream.open(instance("fsc-a", InstanceStatus.RUNNING));
            stream.open(instance("fsc-a", InstanceStatus.RUNNING));
            emitters.get(0).broken = true;

            eventBus.publish(event("instance.stopping", "fsc-a", InstanceStatus.STOPPING));

            assertEquals(1, stream.openStreamCount());
            assertEquals(1, eventBus.listenerCount("fsc-a"));
            assertTrue(emitters.get(1).frames.get(2).contains("event:instance.stopping"));
        }
    }

    @Nested
    @DisplayName("heartbeats")
    class HeartbeatTests {

        @Test
        @DisplayName("reach every open stream and prune broken ones")
        void heartbeat() {
            stream.open(instance("fsc-a", InstanceStatus.RUNNING));
            stream.open(instance("fsc-b", InstanceStatus.RUNNING));
            emitters.get(1).broken = true;

            stream.sendHeartbeats();

            assertTrue(emitters.get(0).frames.get(2).startsWith(":heartbeat"));
            assertEquals(1, stream.openStreamCount());
            assertEquals(0, eventBus.listenerCount("fsc-b"));
        }

        @Test
        @DisplayName("shutdown completes every open stream")
        void stopCompletesStreams() {
            stream.open(instance("fsc-a", InstanceStatus.RUNNING));

            stream.stop();

            assertTrue(emitters.get(0).completed);
            assertEquals(0, stream.openStreamCount());
        }
    }
}
