package com.edgedispatch.core.health;

import com.edgedispatch.core.execution.ExecutionDispatcher;
import com.edgedispatch.core.overlay.OverlayNetwork;
import com.edgedispatch.core.overlay.OverlayProperties;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

@Service
public class HealthCheckService {

    private final OverlayNetwork overlayNetwork;
    private final OverlayProperties overlayProperties;
    private final ExecutionDispatcher dispatcher;

    public HealthCheckService(
            @Autowired(required = false) OverlayNetwork overlayNetwork,
            @Autowired(required = false) OverlayProperties overlayProperties,
            @Autowired(required = false) ExecutionDispatcher dispatcher) {
        this.overlayNetwork = overlayNetwork;
        this.overlayProperties = overlayProperties;
        this.dispatcher = dispatcher;
    }

    public List<HealthStatus> checkAll() {
        var results = new ArrayList<HealthStatus>();
        results.add(checkOverlay());
        results.add(checkDispatcher());
        return results;
    }

    /**
     * Readiness signal: true once the overlay network finished initialization.
     */
    public boolean isOverlayReady() {
        return overlayNetwork != null && overlayNetwork.isReady();
    }

    private HealthStatus checkOverlay() {
        if (overlayNetwork == null) {
            return new HealthStatus("overlay", HealthStatus.Status.DOWN,
                    "No OverlayNetwork configured", Map.of());
        }
        String hostname = overlayProperties != null ? overlayProperties.getHostname() : "";
        if (overlayProperties != null && !overlayProperties.isEnabled()) {
            return new HealthStatus("overlay", HealthStatus.Status.DOWN,
                    "Overlay network disabled (edgedispatch.overlay.enabled=false)", Map.of("hostname", hostname));
        }
        if (overlayNetwork.isReady()) {
            return new HealthStatus("overlay", HealthStatus.Status.UP,
                    "Overlay network initialized", Map.of("hostname", hostname));
        }
        String detail = overlayProperties != null && !overlayProperties.hasAuthKey()
                ? "Overlay network not initialized (TS_AUTHKEY not set)"
                : "Overlay network not initialized (will retry on exec)";
        return new HealthStatus("overlay", HealthStatus.Status.DOWN, detail, Map.of("hostname", hostname));
    }

    private HealthStatus checkDispatcher() {
        if (dispatcher == null) {
            return new HealthStatus("dispatcher", HealthStatus.Status.DOWN,
                    "ExecutionDispatcher not available", Map.of());
        }
        int inFlight = dispatcher.inFlightCount();
        return new HealthStatus("dispatcher", HealthStatus.Status.UP,
                "Accepting executions (" + inFlight + " in flight)",
                Map.of("inFlight", String.valueOf(inFlight)));
    }
}
