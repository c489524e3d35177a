package com.fauxcloud.core.error;

import com.fauxcloud.core.model.InstanceStatus;

public class InvalidStateException extends InstanceException {

    private final InstanceStatus currentStatus;

    public InvalidStateException(String instanceId, String operation, InstanceStatus currentStatus) {
        super(instanceId, "Instance %s cannot %s from status %s".formatted(instanceId, operation, currentStatus));
        this.currentStatus = currentStatus;
    }

    public InstanceStatus currentStatus() {
        return currentStatus;
    }

    @Override
    public ErrorKind kind() {
        return ErrorKind.INVALID_STATE;
    }
}
