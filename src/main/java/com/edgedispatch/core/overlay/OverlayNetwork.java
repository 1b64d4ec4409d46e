package com.edgedispatch.core.overlay;

import com.edgedispatch.core.process.ProcessResult;

import java.io.Closeable;
import java.io.IOException;
import java.time.Duration;

/**
 * Process-wide access to the private overlay network.
 * Implementations: TailscaleOverlayNetwork (prod), fakes in tests.
 *
 * <p>Initialization happens once at startup and may fail without being fatal; callers
 * re-check readiness per execution through {@link #ensureReady(Duration)}.
 */
public interface OverlayNetwork {

    /**
     * Joins the overlay network with the given credential.
     *
     * @throws OverlayException if the node could not come up
     */
    void initialize(String credential);

    /**
     * @return true once {@link #initialize} has completed successfully
     */
    boolean isReady();

    /**
     * Re-checks readiness, retrying initialization with the last known credential
     * when the startup attempt failed. Never throws, and never waits longer than
     * {@code budget}; a caller that finds another attempt in flight gets {@code false}.
     */
    default boolean ensureReady(Duration budget) {
        return isReady();
    }

    /**
     * Opens a raw TCP connection to {@code target:port} through the overlay.
     * The caller owns the returned connection and must close it.
     */
    Closeable dial(String target, int port, Duration timeout) throws IOException;

    /**
     * Runs {@code command} on {@code user@target} through the overlay's own remote shell.
     * Connection tuning flags are not supported on this path.
     */
    ProcessResult runRemoteShell(String target, String user, String command, Duration timeout)
            throws IOException, InterruptedException;
}
