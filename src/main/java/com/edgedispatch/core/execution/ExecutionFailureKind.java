package com.edgedispatch.core.execution;

/**
 * Why an execution ended in {@link ExecutionStatus#ERROR}.
 */
public enum ExecutionFailureKind {
    /** Overlay network was not ready when the execution ran. */
    NETWORK_UNINITIALIZED,
    /** A transport returned a nonzero exit or failed to run. */
    EXECUTION_FAILURE,
    /** The overall per-execution deadline ran out. */
    TIMEOUT
}
