package com.edgedispatch.core.execution;

import java.time.Instant;

/**
 * Immutable snapshot of an execution's state.
 *
 * @param executionId  the execution this record belongs to
 * @param deviceId     target device
 * @param status       PENDING until the background task completes
 * @param output       captured combined output; empty while pending
 * @param error        error text; empty unless status is ERROR
 * @param failureKind  nullable; set only when status is ERROR
 * @param transport    nullable; the transport that produced the final result
 * @param stage        nullable; furthest step of the transport chain reached
 * @param probeReachable nullable; connectivity probe result, null if the probe never ran
 * @param submittedAt  when dispatch accepted the request
 * @param completedAt  nullable; when the record became terminal
 */
public record ExecutionRecord(
    String executionId,
    String deviceId,
    ExecutionStatus status,
    String output,
    String error,
    ExecutionFailureKind failureKind,
    Transport transport,
    RemoteExecutor.Stage stage,
    Boolean probeReachable,
    Instant submittedAt,
    Instant completedAt
) {

    public static ExecutionRecord pending(String executionId, String deviceId, Instant submittedAt) {
        return new ExecutionRecord(executionId, deviceId, ExecutionStatus.PENDING,
                "", "", null, null, null, null, submittedAt, null);
    }

    /**
     * Returns the terminal form of this record for the given outcome.
     */
    public ExecutionRecord complete(RemoteExecutor.Outcome outcome, Instant completedAt) {
        return new ExecutionRecord(
                executionId,
                deviceId,
                outcome.success() ? ExecutionStatus.SUCCESS : ExecutionStatus.ERROR,
                outcome.output() != null ? outcome.output() : "",
                outcome.error() != null ? outcome.error() : "",
                outcome.success() ? null : outcome.failureKind(),
                outcome.transport(),
                outcome.stage(),
                outcome.probeReachable(),
                submittedAt,
                completedAt);
    }
}
