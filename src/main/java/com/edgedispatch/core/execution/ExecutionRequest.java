package com.edgedispatch.core.execution;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * A request to run something on a device.
 *
 * <p>Carries either a raw command sequence or a deployment intent
 * ({@code appType} + {@code appReference}). When both are present the deployment intent wins.
 *
 * @param deviceId     overlay network hostname of the target device
 * @param command      raw command sequence; nullable
 * @param appType      application type, e.g. "zed"; nullable
 * @param appReference container image reference, e.g. "dummy-zed:latest"; nullable
 */
public record ExecutionRequest(
    String deviceId,
    List<String> command,
    String appType,
    String appReference
) {

    public ExecutionRequest {
        // Null elements are kept so validation can reject them as a bad request
        command = command == null ? List.of() : Collections.unmodifiableList(new ArrayList<>(command));
    }

    public static ExecutionRequest command(String deviceId, List<String> command) {
        return new ExecutionRequest(deviceId, command, null, null);
    }

    public static ExecutionRequest deployment(String deviceId, String appType, String appReference) {
        return new ExecutionRequest(deviceId, List.of(), appType, appReference);
    }

    public boolean hasDeploymentIntent() {
        return appType != null && !appType.isBlank()
                && appReference != null && !appReference.isBlank();
    }

    public boolean hasCommand() {
        return !command.isEmpty();
    }
}
