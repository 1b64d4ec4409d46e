package com.edgedispatch.core.process;

/**
 * Outcome of running an external command.
 *
 * @param exitCode process exit code, or {@code -1} when the process never produced one
 * @param output   combined stdout/stderr
 * @param timedOut true when the process was destroyed because its time budget ran out
 */
public record ProcessResult(
    int exitCode,
    String output,
    boolean timedOut
) {

    public static ProcessResult timeout(String output) {
        return new ProcessResult(-1, output, true);
    }

    public boolean succeeded() {
        return exitCode == 0 && !timedOut;
    }
}
