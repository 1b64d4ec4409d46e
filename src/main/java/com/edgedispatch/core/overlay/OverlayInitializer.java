package com.edgedispatch.core.overlay;

import jakarta.annotation.PostConstruct;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Brings the overlay network up once at startup.
 * Failure is logged and left for executions to retry lazily.
 */
@Component
public class OverlayInitializer {

    private static final Logger log = LoggerFactory.getLogger(OverlayInitializer.class);

    private final OverlayNetwork overlayNetwork;
    private final OverlayProperties properties;

    public OverlayInitializer(OverlayNetwork overlayNetwork, OverlayProperties properties) {
        this.overlayNetwork = overlayNetwork;
        this.properties = properties;
    }

    @PostConstruct
    void initialize() {
        if (!properties.isEnabled()) {
            log.info("Overlay network disabled (edgedispatch.overlay.enabled=false)");
            return;
        }
        try {
            overlayNetwork.initialize(properties.getAuthKey());
        } catch (OverlayException e) {
            log.warn("Overlay init warning: {} (will retry on exec)", e.getMessage());
        }
    }
}
