package com.fauxcloud.dispatch.api;

import com.fauxcloud.core.events.EventBus;
import com.fauxcloud.core.events.InstanceEvent;
import com.fauxcloud.core.model.Instance;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;
import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;

import java.io.IOException;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * Streams one instance's lifecycle events to an HTTP client as server-sent events.
 *
 * <p>A stream opens with an {@code instance.snapshot} event carrying the current status, then relays
 * every {@link InstanceEvent} for that instance. It completes after the {@code TERMINATED} event.
 * Open streams get a comment frame every 30 seconds so idle proxies keep the
 * connection.
 */
@Service
public class InstanceEventStream {

    private static final Logger log = LoggerFactory.getLogger(InstanceEventStream.class);

    private static final long DEFAULT_TIMEOUT_MS = 60 * 60 * 1000L;
    private static final long HEARTBEAT_SECONDS = 30;

    private final EventBus eventBus;
    private final long timeoutMs;
    private final Set<OpenStream> openStreams = ConcurrentHashMap.newKeySet();

    private final ScheduledExecutorService heartbeats = Executors.newSingleThreadScheduledExecutor(r -> {
        Thread t = new Thread(r, "instance-event-heartbeat");
        t.setDaemon(true);
        return t;
    });

    @Autowired
    public InstanceEventStream(EventBus eventBus) {
        this(eventBus, DEFAULT_TIMEOUT_MS);
    }

    InstanceEventStream(EventBus eventBus, long timeoutMs) {
        this.eventBus = eventBus;
        this.timeoutMs = timeoutMs;
    }

    @PostConstruct
    void startHeartbeats() {
        heartbeats.scheduleAtFixedRate(this::sendHeartbeats, HEARTBEAT_SECONDS, HEARTBEAT_SECONDS, TimeUnit.SECONDS);
    }

    @PreDestroy
    void stop() {
        heartbeats.shutdownNow();
        openStreams.forEach(stream -> {
            close(stream);
            stream.emitter.complete();
        });
    }

    public SseEmitter open(Instance instance) {
        String id = instance.getId();
        SseEmitter emitter = newEmitter(timeoutMs);
        var stream = new OpenStream(id, emitter);
        stream.subscription = eventBus.subscribe(id, event -> relay(stream, event));
        openStreams.add(stream);

        emitter.onCompletion(() -> close(stream));
        emitter.onTimeout(() -> close(stream));
        emitter.onError(ex -> {
            log.debug("Event stream for {} failed: {}", id, ex.getMessage());
            close(stream);
        });

        Map<String, Object> snapshot = new LinkedHashMap<>();
        snapshot.put("instance_id", id);
        snapshot.put("status", instance.getStatus().name());
        snapshot.put("expires_at", String.valueOf(instance.getExpiresAt()));
        try {
            emitter.send(SseEmitter.event().comment("connected"));
            emitter.send(SseEmitter.event().name("instance.snapshot").data(snapshot));
        } catch (IOException e) {
            log.debug("Event stream for {} closed before the snapshot: {}", id, e.getMessage());
            close(stream);
        }
        log.info("Opened event stream for {} ({} open)", id, openStreams.size());
        return emitter;
    }

    public int openStreamCount() {
        return openStreams.size();
    }

    SseEmitter newEmitter(long timeoutMs) {
        return new SseEmitter(timeoutMs);
    }

    void sendHeartbeats() {
        for (OpenStream stream : openStreams) {
            try {
                stream.emitter.send(SseEmitter.event().comment("heartbeat"));
            } catch (IOException | IllegalStateException e) {
                log.debug("Heartbeat to {} failed, dropping stream: {}", stream.instanceId, e.getMessage());
                close(stream);
            }
        }
    }

    private void relay(OpenStream stream, InstanceEvent event) {
        Map<String, Object> data = new LinkedHashMap<>();
        data.put("instance_id", event.instanceId());
        data.put("status", event.status().name());
        data.putAll(event.payload());
        data.put("timestamp", event.timestamp().toString());
        try {
            stream.emitter.send(SseEmitter.event().name(event.eventType()).data(data));
        } catch (IOException | IllegalStateException e) {
            log.debug("Dropping event stream for {}: {}", event.instanceId(), e.getMessage());
            close(stream);
            return;
        }
        if (event.isFinal()) {
            close(stream);
            stream.emitter.complete();
        }
    }

    private void close(OpenStream stream) {
        if (openStreams.remove(stream)) {
            EventBus.Subscription subscription = stream.subscription;
            if (subscription != null) {
                subscription.unsubscribe();
            }
            log.debug("Closed event stream for {}", stream.instanceId);
        }
    }

    private static final class OpenStream {

        final String instanceId;
        final SseEmitter emitter;
        volatile EventBus.Subscription subscription;

        OpenStream(String instanceId, SseEmitter emitter) {
            this.instanceId = instanceId;
            this.emitter = emitter;
        }
    }
}
