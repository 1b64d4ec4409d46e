package com.edgedispatch.dispatch.api;

import com.edgedispatch.core.health.HealthCheckService;
import com.edgedispatch.core.health.HealthStatus;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * REST controller for readiness.
 */
@RestController
@RequestMapping("/api/v1/health")
public class HealthController {

    private final HealthCheckService healthCheckService;
    private final String version;

    public HealthController(@Autowired(required = false) HealthCheckService healthCheckService,
                            @Value("${edgedispatch.version:0.1.0}") String version) {
        this.healthCheckService = healthCheckService;
        this.version = version;
    }

    /**
     * GET /api/v1/health: Returns 200 when every component is UP (the overlay network
     * has finished initialization), 503 otherwise.
     */
    @GetMapping
    public ResponseEntity<Map<String, Object>> health() {
        Map<String, Object> result = new LinkedHashMap<>();
        result.put("version", version);
        result.put("time", Instant.now().truncatedTo(ChronoUnit.SECONDS).toString());

        if (healthCheckService == null) {
            result.put("status", "DOWN");
            result.put("overlay_ready", false);
            result.put("components", Map.of());
            return ResponseEntity.status(503).body(result);
        }

        var checks = healthCheckService.checkAll();
        boolean anyDown = false;

        Map<String, Object> components = new LinkedHashMap<>();
        for (var check : checks) {
            Map<String, String> componentInfo = new LinkedHashMap<>();
            componentInfo.put("status", check.status().name());
            componentInfo.put("detail", check.detail());
            components.put(check.component(), componentInfo);

            if (check.status() == HealthStatus.Status.DOWN) {
                anyDown = true;
            }
        }

        result.put("status", anyDown ? "DOWN" : "UP");
        result.put("overlay_ready", healthCheckService.isOverlayReady());
        result.put("components", components);

        return anyDown ? ResponseEntity.status(503).body(result)
                       : ResponseEntity.ok(result);
    }
}
