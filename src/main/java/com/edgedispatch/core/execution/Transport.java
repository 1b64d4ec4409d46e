package com.edgedispatch.core.execution;

/**
 * Remote-shell path that produced an execution's final result.
 */
public enum Transport {
    /** Conventional ssh client. */
    PRIMARY,
    /** The overlay network's own remote shell. */
    OVERLAY
}
