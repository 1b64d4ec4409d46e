package com.edgedispatch.core.metrics;

import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class EdgeDispatchMetricsTest {

    private SimpleMeterRegistry registry;
    private EdgeDispatchMetrics metrics;

    @BeforeEach
    void setUp() {
        registry = new SimpleMeterRegistry();
        metrics = new EdgeDispatchMetrics(registry);
    }

    @Test
    @DisplayName("recordCompleted counts by status and kind and times the execution")
    void recordCompleted() {
        metrics.recordCompleted("SUCCESS", "none", 120);
        metrics.recordCompleted("ERROR", "TIMEOUT", 60_000);
        metrics.recordCompleted("ERROR", "TIMEOUT", 60_000);

        var timeouts = registry.find("edgedispatch.executions.completed")
                .tag("status", "ERROR").tag("kind", "TIMEOUT").counter();
        assertNotNull(timeouts);
        assertEquals(2.0, timeouts.count());

        var timer = registry.find("edgedispatch.execution.duration").tag("status", "SUCCESS").timer();
        assertNotNull(timer);
        assertEquals(1, timer.count());
    }

    @Test
    @DisplayName("recordProbe tags reachability")
    void recordConnectivityCheck() {
        metrics.recordProbe(true);
        metrics.recordProbe(false);
        metrics.recordProbe(false);

        assertEquals(1.0, registry.find("edgedispatch.probe.results").tag("reachable", "true").counter().count());
        assertEquals(2.0, registry.find("edgedispatch.probe.results").tag("reachable", "false").counter().count());
    }

    @Test
    @DisplayName("dispatch and fallback counters increment")
    void counters() {
        metrics.recordDispatched();
        metrics.recordDispatched();
        metrics.recordFallback();

        assertEquals(2.0, registry.find("edgedispatch.executions.dispatched").counter().count());
        assertEquals(1.0, registry.find("edgedispatch.executions.fallbacks").counter().count());
    }
}
