package com.edgedispatch.core.events;

import java.io.Serializable;
import java.time.Instant;
import java.util.Map;

/**
 * An event emitted during an execution's lifecycle, used by the CLI to wait for completion.
 *
 * @param eventType   e.g. "execution.dispatched", "execution.fallback", "execution.completed"
 * @param executionId the execution this event belongs to
 * @param deviceId    target device
 * @param payload     arbitrary key-value data associated with the event
 * @param timestamp   when the event occurred
 */
public record ExecutionEvent(
    String eventType,
    String executionId,
    String deviceId,
    Map<String, Object> payload,
    Instant timestamp
) implements Serializable {

    public static final String DISPATCHED = "execution.dispatched";
    public static final String FALLBACK = "execution.fallback";
    public static final String COMPLETED = "execution.completed";
}
