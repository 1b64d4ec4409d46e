package com.edgedispatch.core.execution;

public enum ExecutionStatus {
    PENDING,
    SUCCESS,
    ERROR;

    public boolean isTerminal() {
        return this != PENDING;
    }
}
