package com.edgedispatch.core.execution;

public class ExecutionNotFoundException extends RuntimeException {

    private final String executionId;

    public ExecutionNotFoundException(String executionId) {
        super("execution id not found: " + executionId);
        this.executionId = executionId;
    }

    public String getExecutionId() {
        return executionId;
    }
}
