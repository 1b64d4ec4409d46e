package com.edgedispatch.core.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Service;

import java.time.Duration;

/**
 * Centralised Micrometer metrics for remote executions.
 */
@Service
public class EdgeDispatchMetrics {

    private final MeterRegistry registry;

    public EdgeDispatchMetrics(MeterRegistry registry) {
        this.registry = registry;
    }

    public void recordDispatched() {
        Counter.builder("edgedispatch.executions.dispatched")
                .register(registry)
                .increment();
    }

    /**
     * @param status terminal status name
     * @param kind   failure kind name, or "none" on success
     */
    public void recordCompleted(String status, String kind, long ms) {
        Counter.builder("edgedispatch.executions.completed")
                .tag("status", status)
                .tag("kind", kind)
                .register(registry)
                .increment();
        Timer.builder("edgedispatch.execution.duration")
                .tag("status", status)
                .register(registry)
                .record(Duration.ofMillis(ms));
    }

    public void recordFallback() {
        Counter.builder("edgedispatch.executions.fallbacks")
                .description("Executions rerouted to the overlay-native shell after a policy denial")
                .register(registry)
                .increment();
    }

    public void recordProbe(boolean reachable) {
        Counter.builder("edgedispatch.probe.results")
                .tag("reachable", String.valueOf(reachable))
                .register(registry)
                .increment();
    }
}
