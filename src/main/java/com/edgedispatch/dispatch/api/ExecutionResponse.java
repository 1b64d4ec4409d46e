package com.edgedispatch.dispatch.api;

import com.edgedispatch.core.execution.ExecutionRecord;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;
import java.util.Locale;

/**
 * JSON response for execution status queries.
 */
public record ExecutionResponse(
    @JsonProperty("execution_id") String executionId,
    @JsonProperty("device_id") String deviceId,
    String status,
    String message,
    String output,
    String error,
    @JsonProperty("failure_kind") String failureKind,
    String transport,
    String stage,
    @JsonProperty("probe_reachable") Boolean probeReachable,
    @JsonProperty("submitted_at") Instant submittedAt,
    @JsonProperty("completed_at") Instant completedAt
) {

    public static ExecutionResponse from(ExecutionRecord record) {
        return new ExecutionResponse(
                record.executionId(),
                record.deviceId(),
                record.status().name().toLowerCase(Locale.ROOT),
                "ok",
                record.output(),
                record.error(),
                record.failureKind() != null ? record.failureKind().name() : null,
                record.transport() != null ? record.transport().name().toLowerCase(Locale.ROOT) : null,
                record.stage() != null ? record.stage().name().toLowerCase(Locale.ROOT) : null,
                record.probeReachable(),
                record.submittedAt(),
                record.completedAt());
    }
}
