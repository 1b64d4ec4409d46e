package com.edgedispatch.core.execution;

import com.edgedispatch.core.events.EventBus;
import com.edgedispatch.core.events.ExecutionEvent;
import com.edgedispatch.core.metrics.EdgeDispatchMetrics;
import com.edgedispatch.core.overlay.OverlayNetwork;
import com.edgedispatch.core.probe.ConnectivityProber;
import com.edgedispatch.core.process.ProcessResult;
import com.edgedispatch.core.process.ProcessRunner;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * Runs one built command line on a device, falling back from the conventional ssh client
 * to the overlay network's own remote shell when the overlay's access policy rejects the first.
 *
 * <p>Flow, every step bounded by the same deadline:
 * <ol>
 *   <li>Re-check overlay readiness (lazy re-initialization)</li>
 *   <li>Probe the device (logged, never gating)</li>
 *   <li>Primary transport: {@code ssh} with relaxed host-key checks and short timeouts</li>
 *   <li>On a policy denial only, the overlay shell, at most once; its result is final</li>
 * </ol>
 *
 * <p>Unreachable devices are not retried on the overlay shell: the fallback routes around
 * policy-only rejections, not transport failures.
 */
@Component
public class RemoteExecutor {

    private static final Logger log = LoggerFactory.getLogger(RemoteExecutor.class);

    /**
     * Furthest step of the chain an execution reached. Whether it ended in success or
     * failure is carried by {@link Outcome#success()}.
     */
    public enum Stage {
        NOT_STARTED,
        PROBE_ATTEMPTED,
        PRIMARY_ATTEMPTED,
        FALLBACK_ATTEMPTED
    }

    /**
     * Result of one pass through the chain.
     *
     * @param success     true when the final attempt exited 0
     * @param output      combined output of the attempt that produced the final result
     * @param error       error text; empty on success
     * @param failureKind nullable; set when {@code success} is false
     * @param transport   nullable; the transport whose result is final
     * @param stage       furthest stage reached; null when the chain never reported back
     * @param probeReachable result of the connectivity probe, null if it never ran
     */
    public record Outcome(
        boolean success,
        String output,
        String error,
        ExecutionFailureKind failureKind,
        Transport transport,
        Stage stage,
        Boolean probeReachable
    ) {

        static Outcome success(String output, Transport transport, Boolean probeReachable) {
            Stage stage = transport == Transport.OVERLAY ? Stage.FALLBACK_ATTEMPTED : Stage.PRIMARY_ATTEMPTED;
            return new Outcome(true, output, "", null, transport, stage, probeReachable);
        }

        public static Outcome failure(ExecutionFailureKind kind, String output, String error,
                                      Stage stage, Transport transport, Boolean probeReachable) {
            return new Outcome(false, output, error, kind, transport, stage, probeReachable);
        }
    }

    private final OverlayNetwork overlayNetwork;
    private final ConnectivityProber prober;
    private final ProcessRunner processRunner;
    private final PolicyDenialClassifier policyDenialClassifier;
    private final ExecutionProperties properties;
    private final EventBus eventBus;
    private final EdgeDispatchMetrics metrics;
    private final Clock clock;

    @Autowired
    public RemoteExecutor(OverlayNetwork overlayNetwork,
                          ConnectivityProber prober,
                          ProcessRunner processRunner,
                          PolicyDenialClassifier policyDenialClassifier,
                          ExecutionProperties properties,
                          @Autowired(required = false) EventBus eventBus,
                          @Autowired(required = false) EdgeDispatchMetrics metrics) {
        this(overlayNetwork, prober, processRunner, policyDenialClassifier, properties,
                eventBus, metrics, Clock.systemUTC());
    }

    RemoteExecutor(OverlayNetwork overlayNetwork,
                   ConnectivityProber prober,
                   ProcessRunner processRunner,
                   PolicyDenialClassifier policyDenialClassifier,
                   ExecutionProperties properties,
                   EventBus eventBus,
                   EdgeDispatchMetrics metrics,
                   Clock clock) {
        this.overlayNetwork = overlayNetwork;
        this.prober = prober;
        this.processRunner = processRunner;
        this.policyDenialClassifier = policyDenialClassifier;
        this.properties = properties;
        this.eventBus = eventBus;
        this.metrics = metrics;
        this.clock = clock;
    }

    /**
     * Runs {@code commandLine} on {@code deviceId}. Never throws; every failure becomes an
     * unsuccessful {@link Outcome}.
     */
    public Outcome execute(String executionId, String deviceId, String commandLine, Instant deadline) {
        if (!overlayNetwork.ensureReady(remaining(deadline))) {
            log.warn("Overlay network not initialized, failing execution {}", executionId);
            return Outcome.failure(ExecutionFailureKind.NETWORK_UNINITIALIZED, "",
                    "overlay network not initialized", Stage.NOT_STARTED, null, null);
        }

        boolean reachable = prober.probe(deviceId, remaining(deadline));
        if (!reachable) {
            log.warn("Connectivity probe to {} failed, attempting remote shell anyway", deviceId);
        }

        String user = properties.getSshUser();
        if (isExpired(deadline)) {
            return deadlineExceeded("", Stage.PROBE_ATTEMPTED, null, reachable);
        }

        log.info("Attempting system SSH to {}@{}: {}", user, deviceId, commandLine);
        ProcessResult primary;
        try {
            primary = processRunner.run(primaryCommand(user, deviceId, commandLine), remaining(deadline));
        } catch (IOException e) {
            log.error("Primary transport could not start: {}", e.getMessage());
            return Outcome.failure(ExecutionFailureKind.EXECUTION_FAILURE, "",
                    "ssh failed to start: " + e.getMessage(), Stage.PRIMARY_ATTEMPTED, Transport.PRIMARY, reachable);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return Outcome.failure(ExecutionFailureKind.EXECUTION_FAILURE, "",
                    "execution interrupted", Stage.PRIMARY_ATTEMPTED, Transport.PRIMARY, reachable);
        }

        if (primary.succeeded()) {
            log.info("SSH completed successfully: {}", primary.output());
            return Outcome.success(primary.output(), Transport.PRIMARY, reachable);
        }
        if (primary.timedOut()) {
            return deadlineExceeded(primary.output(), Stage.PRIMARY_ATTEMPTED, Transport.PRIMARY, reachable);
        }

        if (!policyDenialClassifier.isPolicyDenial(primary.output())) {
            log.info("SSH completed with status {}, output: {}", primary.exitCode(), primary.output());
            return Outcome.failure(ExecutionFailureKind.EXECUTION_FAILURE, primary.output(),
                    exitStatus(primary), Stage.PRIMARY_ATTEMPTED, Transport.PRIMARY, reachable);
        }

        return fallback(executionId, user, deviceId, commandLine, deadline, reachable);
    }

    private Outcome fallback(String executionId, String user, String deviceId, String commandLine,
                             Instant deadline, boolean reachable) {
        log.info("SSH blocked by policy, trying overlay ssh instead");
        if (metrics != null) {
            metrics.recordFallback();
        }
        if (eventBus != null) {
            eventBus.publish(new ExecutionEvent(ExecutionEvent.FALLBACK, executionId, deviceId,
                    Map.of("transport", Transport.OVERLAY.name()), clock.instant()));
        }
        if (isExpired(deadline)) {
            return deadlineExceeded("", Stage.PRIMARY_ATTEMPTED, Transport.PRIMARY, reachable);
        }

        ProcessResult secondary;
        try {
            secondary = overlayNetwork.runRemoteShell(deviceId, user, commandLine, remaining(deadline));
        } catch (IOException e) {
            log.error("Overlay shell could not start: {}", e.getMessage());
            return Outcome.failure(ExecutionFailureKind.EXECUTION_FAILURE, "",
                    "overlay ssh failed to start: " + e.getMessage(), Stage.FALLBACK_ATTEMPTED, Transport.OVERLAY, reachable);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return Outcome.failure(ExecutionFailureKind.EXECUTION_FAILURE, "",
                    "execution interrupted", Stage.FALLBACK_ATTEMPTED, Transport.OVERLAY, reachable);
        }

        log.info("Overlay SSH completed with status {}, output: {}", secondary.exitCode(), secondary.output());
        if (secondary.succeeded()) {
            return Outcome.success(secondary.output(), Transport.OVERLAY, reachable);
        }
        if (secondary.timedOut()) {
            return deadlineExceeded(secondary.output(), Stage.FALLBACK_ATTEMPTED, Transport.OVERLAY, reachable);
        }
        return Outcome.failure(ExecutionFailureKind.EXECUTION_FAILURE, secondary.output(),
                exitStatus(secondary), Stage.FALLBACK_ATTEMPTED, Transport.OVERLAY, reachable);
    }

    /**
     * Builds the ssh invocation. Host identity is already established by the overlay,
     * so host-key verification is relaxed.
     */
    List<String> primaryCommand(String user, String deviceId, String commandLine) {
        return List.of(
                properties.getSshBinary(),
                "-o", "StrictHostKeyChecking=no",
                "-o", "UserKnownHostsFile=/dev/null",
                "-o", "ConnectTimeout=" + properties.getConnectTimeoutSeconds(),
                "-o", "ServerAliveInterval=" + properties.getServerAliveIntervalSeconds(),
                "-o", "BatchMode=yes",
                user + "@" + deviceId,
                commandLine
        );
    }

    private Outcome deadlineExceeded(String output, Stage stage, Transport transport, boolean reachable) {
        String error = "execution exceeded deadline of %dms".formatted(properties.getOverallTimeoutMillis());
        log.warn(error);
        return Outcome.failure(ExecutionFailureKind.TIMEOUT, output, error, stage, transport, reachable);
    }

    private static String exitStatus(ProcessResult result) {
        return "exit status " + result.exitCode();
    }

    private Duration remaining(Instant deadline) {
        Duration left = Duration.between(clock.instant(), deadline);
        return left.isNegative() ? Duration.ZERO : left;
    }

    private boolean isExpired(Instant deadline) {
        return !clock.instant().isBefore(deadline);
    }
}
