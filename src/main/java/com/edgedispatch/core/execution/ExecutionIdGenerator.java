package com.edgedispatch.core.execution;

import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.LongSupplier;

/**
 * Allocates ids of the form {@code exec-<deviceId>-<n>}, where {@code n} is a
 * nanosecond wall-clock reading forced to be strictly increasing within the process.
 */
@Component
public class ExecutionIdGenerator {

    private final LongSupplier nanoClock;
    private final AtomicLong last = new AtomicLong();

    public ExecutionIdGenerator() {
        this(ExecutionIdGenerator::wallClockNanos);
    }

    ExecutionIdGenerator(LongSupplier nanoClock) {
        this.nanoClock = nanoClock;
    }

    public String nextId(String deviceId) {
        long now = nanoClock.getAsLong();
        long stamp = last.updateAndGet(prev -> Math.max(prev + 1, now));
        return "exec-" + deviceId + "-" + stamp;
    }

    private static long wallClockNanos() {
        var now = Instant.now();
        return now.getEpochSecond() * 1_000_000_000L + now.getNano();
    }
}
