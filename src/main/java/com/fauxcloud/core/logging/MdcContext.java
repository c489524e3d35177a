package com.fauxcloud.core.logging;

import org.slf4j.MDC;

/**
 * Utility for managing instance-scoped MDC keys for structured logging.
 */
public final class MdcContext {

    private MdcContext() {}

    public static void setInstance(String instanceId) {
        MDC.put("instanceId", instanceId);
    }

    public static void setOperation(String instanceId, String operation) {
        MDC.put("instanceId", instanceId);
        MDC.put("operation", operation);
    }

    public static void clear() {
        MDC.remove("instanceId");
        MDC.remove("operation");
    }
}
