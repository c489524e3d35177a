package com.fauxcloud.core.error;

import java.time.Duration;

public class ReadyTimeoutException extends InstanceException {

    public ReadyTimeoutException(String instanceId, Duration timeout) {
        super(instanceId, "Instance %s did not become ready within %ds".formatted(instanceId, timeout.toSeconds()));
    }

    @Override
    public ErrorKind kind() {
        return ErrorKind.TIMEOUT;
    }
}
