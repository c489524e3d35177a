package com.fauxcloud.core.events;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Consumer;

/**
 * In-process fan-out of {@link InstanceEvent}s from the lifecycle manager to the event stream
 * endpoint and any other listener.
 *
 * <p>Listeners either follow one instance or every instance. A listener that throws is logged and
 * skipped. Once an instance reaches {@code TERMINATED} its listeners receive that last event and are
 * then dropped, since no further events can follow.
 */
@Service
public class EventBus {

    private static final Logger log = LoggerFactory.getLogger(EventBus.class);

    private final Map<String, List<Consumer<InstanceEvent>>> byInstance = new ConcurrentHashMap<>();
    private final List<Consumer<InstanceEvent>> everyInstance = new CopyOnWriteArrayList<>();

    public void publish(InstanceEvent event) {
        log.debug("{} {} -> {}", event.eventType(), event.instanceId(), event.status());

        List<Consumer<InstanceEvent>> listeners = event.isFinal()
                ? byInstance.remove(event.instanceId())
                : byInstance.get(event.instanceId());
        if (listeners != null) {
            listeners.forEach(listener -> deliver(listener, event));
        }
        everyInstance.forEach(listener -> deliver(listener, event));
    }

    public Subscription subscribe(String instanceId, Consumer<InstanceEvent> listener) {
        byInstance.computeIfAbsent(instanceId, k -> new CopyOnWriteArrayList<>()).add(listener);
        return () -> byInstance.computeIfPresent(instanceId, (k, listeners) -> {
            listeners.remove(listener);
            return listeners.isEmpty() ? null : listeners;
        });
    }

    public Subscription subscribeAll(Consumer<InstanceEvent> listener) {
        everyInstance.add(listener);
        return () -> everyInstance.remove(listener);
    }

    /**
     * Listeners currently following {@code instanceId}, not counting the ones following every instance.
     */
    public int listenerCount(String instanceId) {
        List<Consumer<InstanceEvent>> listeners = byInstance.get(instanceId);
        return listeners == null ? 0 : listeners.size();
    }

    @FunctionalInterface
    public interface Subscription {
        void unsubscribe();
    }

    private static void deliver(Consumer<InstanceEvent> listener, InstanceEvent event) {
        try {
            listener.accept(event);
        } catch (RuntimeException e) {
            log.warn("Listener failed on {} for {}: {}", event.eventType(), event.instanceId(), e.getMessage(), e);
        }
    }
}
