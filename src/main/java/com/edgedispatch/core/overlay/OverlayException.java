package com.edgedispatch.core.overlay;

/**
 * Thrown when the overlay network cannot be brought up.
 */
public class OverlayException extends RuntimeException {

    public OverlayException(String message) {
        super(message);
    }

    public OverlayException(String message, Throwable cause) {
        super(message, cause);
    }
}
