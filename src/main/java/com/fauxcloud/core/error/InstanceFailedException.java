package com.fauxcloud.core.error;

public class InstanceFailedException extends InstanceException {

    public InstanceFailedException(String instanceId, String message) {
        super(instanceId, message);
    }

    public InstanceFailedException(String instanceId, String message, Throwable cause) {
        super(instanceId, message, cause);
    }

    @Override
    public ErrorKind kind() {
        return ErrorKind.FATAL;
    }
}
