package com.fauxcloud.core.error;

/**
 * Base class for rejections raised by the lifecycle API. Runtime failures of the container
 * runtime during start are not raised; they are recorded on the instance as {@code ERROR}.
 */
public abstract class InstanceException extends RuntimeException {

    private final String instanceId;

    protected InstanceException(String instanceId, String message) {
        super(message);
        this.instanceId = instanceId;
    }

    protected InstanceException(String instanceId, String message, Throwable cause) {
        super(message, cause);
        this.instanceId = instanceId;
    }

    public abstract ErrorKind kind();

    /**
     * Instance the failure relates to, or null for requests that never produced one.
     */
    public String instanceId() {
        return instanceId;
    }
}
