package com.fauxcloud.core.error;

public class ResourceExhaustedException extends InstanceException {

    public ResourceExhaustedException(String message) {
        super(null, message);
    }

    @Override
    public ErrorKind kind() {
        return ErrorKind.RESOURCE_EXHAUSTED;
    }
}
