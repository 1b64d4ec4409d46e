package com.edgedispatch.core.command;

import com.edgedispatch.core.execution.ExecutionRequest;

/**
 * Converts an {@link ExecutionRequest} into the single shell line run on the device.
 * Pure function, no Spring or network dependencies.
 */
public final class CommandBuilder {

    /** Returned when the request carries neither a usable command nor a complete intent. */
    public static final String UNRECOGNIZED_COMMAND = "echo 'deployment command not recognized'";

    private CommandBuilder() {}

    public static String build(ExecutionRequest request) {
        if (request == null) {
            return UNRECOGNIZED_COMMAND;
        }
        if (request.hasDeploymentIntent()) {
            return deployCommand(request.appType(), request.appReference());
        }
        if (request.hasCommand()) {
            return String.join(" ", request.command());
        }
        return UNRECOGNIZED_COMMAND;
    }

    /**
     * Pulls the image, then runs it detached as {@code <appType>-instance} with an always-restart policy.
     */
    public static String deployCommand(String appType, String appReference) {
        return "docker pull %s && docker run -d --name %s-instance --restart=always %s"
                .formatted(appReference, appType, appReference);
    }
}
