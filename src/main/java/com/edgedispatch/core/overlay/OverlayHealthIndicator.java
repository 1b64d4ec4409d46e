package com.edgedispatch.core.overlay;

import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.stereotype.Component;

/**
 * Actuator health indicator for the overlay network.
 * Reports UP once the node has joined, DOWN while executions would fail as uninitialized,
 * which includes the overlay being switched off by configuration.
 */
@Component("overlayHealthIndicator")
public class OverlayHealthIndicator implements HealthIndicator {

    private final OverlayNetwork overlayNetwork;
    private final OverlayProperties properties;

    public OverlayHealthIndicator(OverlayNetwork overlayNetwork, OverlayProperties properties) {
        this.overlayNetwork = overlayNetwork;
        this.properties = properties;
    }

    @Override
    public Health health() {
        if (!properties.isEnabled()) {
            return Health.down()
                    .withDetail("hostname", properties.getHostname())
                    .withDetail("reason", "disabled")
                    .build();
        }
        var builder = overlayNetwork.isReady() ? Health.up() : Health.down();
        return builder
                .withDetail("hostname", properties.getHostname())
                .withDetail("authKeyConfigured", properties.hasAuthKey())
                .build();
    }
}
