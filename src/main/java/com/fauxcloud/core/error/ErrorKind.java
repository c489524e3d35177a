package com.fauxcloud.core.error;

/**
 * Failure categories surfaced to callers of the lifecycle API.
 */
public enum ErrorKind {
    /** Unknown instance id. */
    NOT_FOUND,
    /** Transition not legal from the current status. */
    INVALID_STATE,
    /** Malformed creation or extension request. */
    VALIDATION,
    /** No free host ports within the probe budget. */
    RESOURCE_EXHAUSTED,
    /** Readiness deadline exceeded. */
    TIMEOUT,
    /** Instance entered ERROR, or cleanup failed entirely. */
    FATAL
}
