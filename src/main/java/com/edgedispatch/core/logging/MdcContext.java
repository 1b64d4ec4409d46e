package com.edgedispatch.core.logging;

import org.slf4j.MDC;

/**
 * Utility for managing execution-specific MDC keys for structured logging.
 */
public final class MdcContext {

    private MdcContext() {}

    public static void setExecution(String executionId, String deviceId) {
        MDC.put("executionId", executionId);
        MDC.put("deviceId", deviceId);
    }

    public static void clear() {
        MDC.remove("executionId");
        MDC.remove("deviceId");
    }
}
