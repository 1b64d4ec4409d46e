package com.edgedispatch.core.probe;

import com.edgedispatch.core.execution.ExecutionProperties;
import com.edgedispatch.core.metrics.EdgeDispatchMetrics;
import com.edgedispatch.core.overlay.OverlayNetwork;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.time.Duration;

/**
 * Best-effort TCP reachability check against a device's remote-shell port.
 *
 * <p>Diagnostic only: overlay reachability can report false negatives (NAT traversal,
 * lazy peer discovery), so the result is logged and never gates an execution.
 */
@Component
public class ConnectivityProber {

    private static final Logger log = LoggerFactory.getLogger(ConnectivityProber.class);

    private final OverlayNetwork overlayNetwork;
    private final ExecutionProperties properties;
    private final EdgeDispatchMetrics metrics;

    public ConnectivityProber(OverlayNetwork overlayNetwork,
                              ExecutionProperties properties,
                              @Autowired(required = false) EdgeDispatchMetrics metrics) {
        this.overlayNetwork = overlayNetwork;
        this.properties = properties;
        this.metrics = metrics;
    }

    public boolean probe(String deviceId) {
        return probe(deviceId, properties.getProbeTimeout());
    }

    /**
     * @param timeout upper bound for the dial; capped to the configured probe timeout
     * @return true if a TCP connection could be opened; never throws
     */
    public boolean probe(String deviceId, Duration timeout) {
        Duration budget = timeout.compareTo(properties.getProbeTimeout()) < 0 ? timeout : properties.getProbeTimeout();
        int port = properties.getSshPort();
        log.info("Testing connectivity to {}:{}...", deviceId, port);

        boolean reachable;
        try (var ignored = overlayNetwork.dial(deviceId, port, budget)) {
            log.info("TCP connection to {}:{} successful", deviceId, port);
            reachable = true;
        } catch (Exception e) {
            log.warn("Direct TCP connection to {}:{} failed: {}", deviceId, port, e.getMessage());
            reachable = false;
        }

        if (metrics != null) {
            metrics.recordProbe(reachable);
        }
        return reachable;
    }
}
