package com.fauxcloud.core.error;

public class InstanceNotFoundException extends InstanceException {

    public InstanceNotFoundException(String instanceId) {
        super(instanceId, "Instance " + instanceId + " not found");
    }

    @Override
    public ErrorKind kind() {
        return ErrorKind.NOT_FOUND;
    }
}
