package com.edgedispatch.core.execution;

/**
 * Malformed submit request. Thrown synchronously by dispatch; no record is created.
 */
public class ExecutionValidationException extends RuntimeException {

    public ExecutionValidationException(String message) {
        super(message);
    }
}
