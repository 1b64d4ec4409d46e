package com.edgedispatch.core.overlay;

import com.edgedispatch.core.process.ProcessResult;
import com.edgedispatch.core.process.ProcessRunner;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.Closeable;
import java.io.IOException;
import java.net.InetSocketAddress;
import java.net.Socket;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.locks.ReentrantLock;

/**
 * {@link OverlayNetwork} backed by the {@code tailscale} CLI.
 *
 * <p>{@link #initialize} runs {@code tailscale up} with the auth key, {@link #dial} opens a
 * plain socket (MagicDNS resolves device hostnames once the node is up), and
 * {@link #runRemoteShell} shells out to {@code tailscale ssh}.
 */
public class TailscaleOverlayNetwork implements OverlayNetwork {

    private static final Logger log = LoggerFactory.getLogger(TailscaleOverlayNetwork.class);

    private final ProcessRunner processRunner;
    private final OverlayProperties properties;

    /** Guards {@code tailscale up}; lazy retries only ever tryLock it. */
    private final ReentrantLock initLock = new ReentrantLock();

    private volatile boolean ready;
    private volatile String lastCredential;

    public TailscaleOverlayNetwork(ProcessRunner processRunner, OverlayProperties properties) {
        this.processRunner = processRunner;
        this.properties = properties;
    }

    @Override
    public void initialize(String credential) {
        initLock.lock();
        try {
            bringUp(credential, Duration.ofSeconds(properties.getInitTimeoutSeconds() + 5L));
        } finally {
            initLock.unlock();
        }
    }

    @Override
    public boolean isReady() {
        return ready;
    }

    /**
     * Retries {@code tailscale up} within {@code budget}. Only one attempt runs at a time;
     * concurrent callers do not queue behind it but report not-ready straight away.
     */
    @Override
    public boolean ensureReady(Duration budget) {
        if (ready) {
            return true;
        }
        if (!properties.isEnabled()) {
            log.debug("Overlay network disabled, not retrying initialization");
            return false;
        }
        String credential = lastCredential != null ? lastCredential : properties.getAuthKey();
        if (credential == null || credential.isBlank()) {
            log.warn("Overlay network still not ready: TS_AUTHKEY not set");
            return false;
        }
        if (budget.toSeconds() < 1) {
            log.warn("Overlay network still not ready: no time left to retry initialization");
            return false;
        }
        if (!initLock.tryLock()) {
            log.warn("Overlay network still not ready: initialization already in progress");
            return false;
        }
        try {
            if (ready) {
                return true;
            }
            bringUp(credential, budget);
            return true;
        } catch (OverlayException e) {
            log.warn("Overlay network still not ready: {}", e.getMessage());
            return false;
        } finally {
            initLock.unlock();
        }
    }

    private void bringUp(String credential, Duration budget) {
        if (credential == null || credential.isBlank()) {
            throw new OverlayException("TS_AUTHKEY not set");
        }
        lastCredential = credential;

        // The CLI gets a little less than the process budget so it can report its own failure
        long processSeconds = Math.min(budget.toSeconds(), properties.getInitTimeoutSeconds() + 5L);
        long cliSeconds = Math.max(1, Math.min(properties.getInitTimeoutSeconds(), processSeconds - 5));

        var command = baseCommand();
        command.add("up");
        command.add("--authkey=" + credential);
        command.add("--hostname=" + properties.getHostname());
        command.add("--timeout=" + cliSeconds + "s");

        ProcessResult result;
        try {
            result = processRunner.run(command, Duration.ofSeconds(processSeconds));
        } catch (IOException e) {
            throw new OverlayException("tailscale up failed to start: " + e.getMessage(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new OverlayException("tailscale up interrupted", e);
        }

        if (!result.succeeded()) {
            throw new OverlayException("tailscale up failed (exit %d): %s"
                    .formatted(result.exitCode(), result.output().strip()));
        }
        ready = true;
        log.info("Overlay network initialized as {}", properties.getHostname());
    }

    @Override
    public Closeable dial(String target, int port, Duration timeout) throws IOException {
        var socket = new Socket();
        try {
            socket.connect(new InetSocketAddress(target, port), (int) Math.max(timeout.toMillis(), 1));
            return socket;
        } catch (IOException e) {
            socket.close();
            throw e;
        }
    }

    @Override
    public ProcessResult runRemoteShell(String target, String user, String command, Duration timeout)
            throws IOException, InterruptedException {
        var args = baseCommand();
        args.add("ssh");
        args.add(user + "@" + target);
        args.add(command);
        return processRunner.run(args, timeout);
    }

    private List<String> baseCommand() {
        var command = new ArrayList<String>();
        command.add(properties.getCli());
        if (properties.getSocket() != null && !properties.getSocket().isBlank()) {
            command.add("--socket=" + properties.getSocket());
        }
        return command;
    }
}
