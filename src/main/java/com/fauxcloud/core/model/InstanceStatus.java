package com.fauxcloud.core.model;

import java.util.EnumSet;
import java.util.Set;

/**
 * Lifecycle status of an ephemeral instance.
 */
public enum InstanceStatus {
    PENDING,
    PROVISIONING,
    STARTING,
    RUNNING,
    STOPPING,
    STOPPED,
    ERROR,
    TERMINATED;

    private static final Set<InstanceStatus> STARTABLE = EnumSet.of(PENDING, PROVISIONING, STOPPED);

    public boolean isTerminal() {
        return this == TERMINATED;
    }

    public boolean canStart() {
        return STARTABLE.contains(this);
    }
}
