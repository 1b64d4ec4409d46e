package com.edgedispatch.core.process;

import java.io.IOException;
import java.time.Duration;
import java.util.List;

/**
 * Runs an external executable and captures its combined output.
 * Implementations: SystemProcessRunner (production), fakes in tests.
 */
public interface ProcessRunner {

    /**
     * Runs {@code command} and waits at most {@code timeout} for it to exit.
     * A process that outlives its budget is destroyed and reported as timed out.
     *
     * @throws IOException if the executable could not be started
     * @throws InterruptedException if the calling thread is interrupted while waiting
     */
    ProcessResult run(List<String> command, Duration timeout) throws IOException, InterruptedException;
}
