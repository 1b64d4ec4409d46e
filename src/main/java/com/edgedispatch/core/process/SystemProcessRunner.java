package com.edgedispatch.core.process;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.TimeUnit;
import java.util.regex.Pattern;

/**
 * {@link ProcessRunner} backed by {@link ProcessBuilder}.
 *
 * <p>stderr is merged into stdout. Output is drained on a separate daemon thread so a
 * chatty process cannot block on a full pipe while we wait for it with a timeout.
 */
public class SystemProcessRunner implements ProcessRunner {

    private static final Logger log = LoggerFactory.getLogger(SystemProcessRunner.class);

    /** Masks {@code --authkey=...} style secrets before logging a command line. */
    private static final Pattern SENSITIVE_ARG_PATTERN = Pattern.compile("(--auth-?key=)\\S+");

    /** How long to wait for the drain thread after the process has gone. */
    private static final long DRAIN_JOIN_MILLIS = 2_000;

    @Override
    public ProcessResult run(List<String> command, Duration timeout) throws IOException, InterruptedException {
        log.debug("Running: {}", maskCommand(command));

        var process = new ProcessBuilder(command)
                .redirectErrorStream(true)
                .start();
        process.getOutputStream().close();

        var buffer = new ByteArrayOutputStream();
        var drain = new Thread(() -> copy(process.getInputStream(), buffer), "process-drain");
        drain.setDaemon(true);
        drain.start();

        boolean exited;
        try {
            exited = process.waitFor(Math.max(timeout.toMillis(), 1), TimeUnit.MILLISECONDS);
        } catch (InterruptedException e) {
            process.destroyForcibly();
            throw e;
        }

        if (!exited) {
            log.warn("Process exceeded {}ms, destroying: {}", timeout.toMillis(), maskCommand(command));
            process.destroyForcibly();
            drain.join(DRAIN_JOIN_MILLIS);
            return ProcessResult.timeout(snapshot(buffer));
        }

        drain.join(DRAIN_JOIN_MILLIS);
        int exitCode = process.exitValue();
        if (exitCode != 0) {
            log.debug("Process exited with code {}: {}", exitCode, maskCommand(command));
        }
        return new ProcessResult(exitCode, snapshot(buffer), false);
    }

    private static void copy(InputStream in, ByteArrayOutputStream buffer) {
        byte[] chunk = new byte[4096];
        try (in) {
            int n;
            while ((n = in.read(chunk)) != -1) {
                synchronized (buffer) {
                    buffer.write(chunk, 0, n);
                }
            }
        } catch (IOException e) {
            // Stream closes abruptly when the process is destroyed
            log.debug("Process output stream closed: {}", e.getMessage());
        }
    }

    private static String snapshot(ByteArrayOutputStream buffer) {
        synchronized (buffer) {
            return buffer.toString(StandardCharsets.UTF_8);
        }
    }

    static String maskCommand(List<String> command) {
        return SENSITIVE_ARG_PATTERN.matcher(String.join(" ", command)).replaceAll("$1****");
    }
}
