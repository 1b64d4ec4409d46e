package com.edgedispatch.dispatch.api;

import com.edgedispatch.core.execution.ExecutionRequest;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Inbound JSON body for POST /api/v1/executions and POST /ssh/exec.
 *
 * @param deviceId overlay hostname of the target device; required
 * @param command  raw command sequence; nullable when a deployment intent is given
 * @param appType  application type; nullable
 * @param appUrl   image reference to deploy; nullable
 */
public record ExecutionSubmitRequest(
    @JsonProperty("device_id") String deviceId,
    List<String> command,
    @JsonProperty("app_type") String appType,
    @JsonProperty("app_url") String appUrl
) {

    public ExecutionRequest toExecutionRequest() {
        return new ExecutionRequest(deviceId, command, appType, appUrl);
    }
}
