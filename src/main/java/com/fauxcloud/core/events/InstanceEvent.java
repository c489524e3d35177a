package com.fauxcloud.core.events;

import com.fauxcloud.core.model.InstanceStatus;

import java.time.Instant;
import java.util.Map;

/**
 * An event emitted by the lifecycle manager whenever an instance changes state.
 *
 * @param eventType  event type (e.g. "instance.created", "instance.started", "instance.destroyed")
 * @param instanceId the instance this event belongs to
 * @param status     instance status after the change
 * @param payload    arbitrary key-value data associated with the event
 * @param timestamp  when the event occurred
 */
public record InstanceEvent(
    String eventType,
    String instanceId,
    InstanceStatus status,
    Map<String, Object> payload,
    Instant timestamp
) {

    /** True when no further events can follow for this instance. */
    public boolean isFinal() {
        return status != null && status.isTerminal();
    }
}
