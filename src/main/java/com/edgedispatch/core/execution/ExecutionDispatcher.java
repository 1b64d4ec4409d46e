package com.edgedispatch.core.execution;

import com.edgedispatch.core.command.CommandBuilder;
import com.edgedispatch.core.events.EventBus;
import com.edgedispatch.core.events.ExecutionEvent;
import com.edgedispatch.core.logging.MdcContext;
import com.edgedispatch.core.metrics.EdgeDispatchMetrics;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Accepts execution requests and runs them in the background.
 *
 * <p>{@link #dispatch} validates, builds the command line, stores a PENDING record and
 * returns the execution id before any remote work starts. Each call spawns exactly one
 * task on the worker pool; identical requests are not deduplicated, and concurrent
 * executions against the same device are not serialized.
 *
 * <p>A task's result is written back to the {@link ExecutionRecordStore} exactly once.
 * The overall deadline is enforced both inside {@link RemoteExecutor} and around the task,
 * so a record always reaches a terminal state.
 */
@Service
public class ExecutionDispatcher {

    private static final Logger log = LoggerFactory.getLogger(ExecutionDispatcher.class);

    /** Extra time the task wrapper allows beyond the deadline before forcing a TIMEOUT. */
    static final Duration DEADLINE_SLACK = Duration.ofSeconds(1);

    private final ExecutionRecordStore store;
    private final RemoteExecutor remoteExecutor;
    private final ExecutionIdGenerator idGenerator;
    private final ExecutionProperties properties;
    private final EventBus eventBus;
    private final EdgeDispatchMetrics metrics;

    /** Tracks in-flight executions so shutdown can drain them. */
    private final ConcurrentHashMap<String, CompletableFuture<ExecutionRecord>> inFlight = new ConcurrentHashMap<>();

    private final AtomicInteger workerCounter = new AtomicInteger();
    private final ExecutorService workerPool = Executors.newCachedThreadPool(r -> {
        Thread t = new Thread(r, "exec-worker-" + workerCounter.incrementAndGet());
        t.setDaemon(true);
        return t;
    });

    public ExecutionDispatcher(ExecutionRecordStore store,
                               RemoteExecutor remoteExecutor,
                               ExecutionIdGenerator idGenerator,
                               ExecutionProperties properties,
                               @Autowired(required = false) EventBus eventBus,
                               @Autowired(required = false) EdgeDispatchMetrics metrics) {
        this.store = store;
        this.remoteExecutor = remoteExecutor;
        this.idGenerator = idGenerator;
        this.properties = properties;
        this.eventBus = eventBus;
        this.metrics = metrics;
    }

    /**
     * Accepts a request and returns its execution id immediately.
     *
     * @throws ExecutionValidationException if the device id is blank or the request has
     *         neither a command nor a complete deployment intent; no record is created
     */
    public String dispatch(ExecutionRequest request) {
        validate(request);

        String deviceId = request.deviceId();
        String commandLine = CommandBuilder.build(request);
        String executionId = idGenerator.nextId(deviceId);
        Instant submittedAt = Instant.now();

        store.create(ExecutionRecord.pending(executionId, deviceId, submittedAt));
        log.info("Accepted execution {} for {}: {}", executionId, deviceId, commandLine);
        if (metrics != null) {
            metrics.recordDispatched();
        }
        publish(ExecutionEvent.DISPATCHED, executionId, deviceId, Map.of("command", commandLine));

        Duration overall = properties.getOverallTimeout();
        Instant deadline = submittedAt.plus(overall);
        long startNanos = System.nanoTime();

        CompletableFuture<RemoteExecutor.Outcome> task;
        try {
            task = CompletableFuture.supplyAsync(() -> run(executionId, deviceId, commandLine, deadline), workerPool);
        } catch (RejectedExecutionException e) {
            log.error("Worker pool rejected execution {}", executionId);
            task = CompletableFuture.failedFuture(e);
        }

        CompletableFuture<ExecutionRecord> handle = task
                .orTimeout(overall.plus(DEADLINE_SLACK).toMillis(), TimeUnit.MILLISECONDS)
                .exceptionally(ex -> failedOutcome(executionId, deviceId, ex))
                .thenApply(outcome -> finish(executionId, deviceId, outcome, startNanos));
        inFlight.put(executionId, handle);
        handle.whenComplete((record, ex) -> inFlight.remove(executionId, handle));

        return executionId;
    }

    /**
     * Returns the current snapshot without waiting on in-flight work.
     *
     * @throws ExecutionNotFoundException if the id was never issued
     */
    public ExecutionRecord getStatus(String executionId) {
        return store.get(executionId).orElseThrow(() -> new ExecutionNotFoundException(executionId));
    }

    /**
     * @return all records, newest first
     */
    public List<ExecutionRecord> listExecutions() {
        return store.list();
    }

    public int inFlightCount() {
        return inFlight.size();
    }

    /**
     * Waits for every execution in flight at call time to complete.
     *
     * @return true if all completed within {@code timeout}
     */
    public boolean awaitOutstanding(Duration timeout) {
        var pending = inFlight.values().toArray(new CompletableFuture<?>[0]);
        if (pending.length == 0) {
            return true;
        }
        try {
            CompletableFuture.allOf(pending).get(timeout.toMillis(), TimeUnit.MILLISECONDS);
            return true;
        } catch (TimeoutException e) {
            return false;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        } catch (ExecutionException e) {
            // Individual failures are already recorded; all handles are done
            return true;
        }
    }

    @PreDestroy
    void shutdown() {
        int outstanding = inFlight.size();
        if (outstanding > 0) {
            log.info("Draining {} in-flight execution(s)", outstanding);
            if (!awaitOutstanding(Duration.ofSeconds(properties.getShutdownGraceSeconds()))) {
                log.warn("{} execution(s) still running after {}s, interrupting",
                        inFlight.size(), properties.getShutdownGraceSeconds());
            }
        }
        workerPool.shutdownNow();
        log.info("Execution worker pool stopped");
    }

    private void validate(ExecutionRequest request) {
        if (request == null) {
            throw new ExecutionValidationException("request body is required");
        }
        if (request.deviceId() == null || request.deviceId().isBlank()) {
            throw new ExecutionValidationException("device_id is required");
        }
        if (!request.hasDeploymentIntent() && !request.hasCommand()) {
            throw new ExecutionValidationException("either (app_type + app_url) or command array is required");
        }
        if (!request.hasDeploymentIntent()
                && request.command().stream().anyMatch(part -> part == null || part.isBlank())) {
            throw new ExecutionValidationException("command array must not contain null or blank elements");
        }
    }

    private RemoteExecutor.Outcome run(String executionId, String deviceId, String commandLine, Instant deadline) {
        MdcContext.setExecution(executionId, deviceId);
        try {
            return remoteExecutor.execute(executionId, deviceId, commandLine, deadline);
        } catch (Exception e) {
            log.error("Execution {} failed unexpectedly", executionId, e);
            return RemoteExecutor.Outcome.failure(ExecutionFailureKind.EXECUTION_FAILURE, "",
                    e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName(), null, null, null);
        } finally {
            MdcContext.clear();
        }
    }

    private RemoteExecutor.Outcome failedOutcome(String executionId, String deviceId, Throwable ex) {
        Throwable cause = ex.getCause() != null ? ex.getCause() : ex;
        MdcContext.setExecution(executionId, deviceId);
        try {
            if (cause instanceof TimeoutException) {
                log.warn("Execution {} did not finish within {}ms", executionId, properties.getOverallTimeoutMillis());
                return RemoteExecutor.Outcome.failure(ExecutionFailureKind.TIMEOUT, "",
                        "execution exceeded deadline of %dms".formatted(properties.getOverallTimeoutMillis()),
                        null, null, null);
            }
            log.error("Execution {} failed unexpectedly", executionId, cause);
            return RemoteExecutor.Outcome.failure(ExecutionFailureKind.EXECUTION_FAILURE, "",
                    cause.getMessage() != null ? cause.getMessage() : cause.getClass().getSimpleName(),
                    null, null, null);
        } finally {
            MdcContext.clear();
        }
    }

    /**
     * Runs on whichever thread completed the task, including the timeout scheduler,
     * so it sets its own MDC.
     */
    private ExecutionRecord finish(String executionId, String deviceId, RemoteExecutor.Outcome outcome, long startNanos) {
        MdcContext.setExecution(executionId, deviceId);
        try {
            return completeRecord(executionId, deviceId, outcome, startNanos);
        } finally {
            MdcContext.clear();
        }
    }

    private ExecutionRecord completeRecord(String executionId, String deviceId, RemoteExecutor.Outcome outcome, long startNanos) {
        var truncated = new RemoteExecutor.Outcome(
                outcome.success(),
                truncateOutput(outcome.output(), properties.getMaxOutputChars()),
                outcome.error(),
                outcome.failureKind(),
                outcome.transport(),
                outcome.stage(),
                outcome.probeReachable());

        var completed = store.complete(executionId, truncated, Instant.now());
        if (completed.isEmpty()) {
            return store.get(executionId).orElse(null);
        }

        ExecutionRecord record = completed.get();
        long elapsedMs = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - startNanos);
        log.info("Execution {} {} in {}ms", executionId, record.status(), elapsedMs);
        if (metrics != null) {
            metrics.recordCompleted(record.status().name(),
                    record.failureKind() != null ? record.failureKind().name() : "none", elapsedMs);
        }
        publish(ExecutionEvent.COMPLETED, executionId, deviceId, Map.of("status", record.status().name()));
        return record;
    }

    private void publish(String type, String executionId, String deviceId, Map<String, Object> payload) {
        if (eventBus != null) {
            eventBus.publish(new ExecutionEvent(type, executionId, deviceId, payload, Instant.now()));
        }
    }

    /**
     * Truncates output to {@code maxChars} keeping the head and tail for context.
     */
    static String truncateOutput(String output, int maxChars) {
        if (output == null || maxChars <= 0 || output.length() <= maxChars) return output;
        int headSize = maxChars / 2;
        int tailSize = maxChars - headSize;
        return output.substring(0, headSize)
                + "\n\n... [truncated " + (output.length() - maxChars) + " chars] ...\n\n"
                + output.substring(output.length() - tailSize);
    }
}
