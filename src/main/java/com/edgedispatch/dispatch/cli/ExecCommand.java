package com.edgedispatch.dispatch.cli;

import com.edgedispatch.core.events.EventBus;
import com.edgedispatch.core.events.ExecutionEvent;
import com.edgedispatch.core.execution.ExecutionDispatcher;
import com.edgedispatch.core.execution.ExecutionProperties;
import com.edgedispatch.core.execution.ExecutionRecord;
import com.edgedispatch.core.execution.ExecutionRequest;
import com.edgedispatch.core.execution.ExecutionStatus;
import com.edgedispatch.core.execution.ExecutionValidationException;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

/**
 * CLI command: edgedispatch exec --device host [--app-type T --app-url R] [-- cmd...]
 * <p>
 * Dispatches in-process and waits for the completion event.
 * Exit codes: 0 success, 1 execution error or still pending, 2 invalid request.
 */
@Command(name = "exec", mixinStandardHelpOptions = true,
        description = "Run a command or deployment on a device and wait for the result")
@Component
public class ExecCommand implements Callable<Integer> {

    /** Extra wait beyond the execution deadline before giving up on the completion event. */
    private static final long WAIT_SLACK_MILLIS = 5_000;

    @Option(names = {"--device", "-d"}, required = true, description = "Overlay hostname of the device")
    private String deviceId;

    @Option(names = "--app-type", description = "Application type, e.g. zed")
    private String appType;

    @Option(names = "--app-url", description = "Image reference to deploy")
    private String appUrl;

    @Parameters(arity = "0..*", description = "Raw command sequence")
    private List<String> command = new ArrayList<>();

    private final ExecutionDispatcher dispatcher;
    private final EventBus eventBus;
    private final ExecutionProperties properties;

    public ExecCommand(ExecutionDispatcher dispatcher, EventBus eventBus, ExecutionProperties properties) {
        this.dispatcher = dispatcher;
        this.eventBus = eventBus;
        this.properties = properties;
    }

    @Override
    public Integer call() throws InterruptedException {
        ConsoleOutput.printBanner();

        String executionId;
        try {
            executionId = dispatcher.dispatch(new ExecutionRequest(deviceId, command, appType, appUrl));
        } catch (ExecutionValidationException e) {
            ConsoleOutput.error(e.getMessage());
            return 2;
        }
        ConsoleOutput.info("Dispatched " + executionId + ", waiting for result...");

        var done = new CountDownLatch(1);
        var subscription = eventBus.subscribe(executionId, event -> {
            if (ExecutionEvent.COMPLETED.equals(event.eventType())) {
                done.countDown();
            }
        });
        try {
            // Completion may have landed before the subscription
            if (dispatcher.getStatus(executionId).status() == ExecutionStatus.PENDING) {
                done.await(properties.getOverallTimeoutMillis() + WAIT_SLACK_MILLIS, TimeUnit.MILLISECONDS);
            }
        } finally {
            subscription.unsubscribe();
        }

        ExecutionRecord record = dispatcher.getStatus(executionId);
        ConsoleOutput.execution(record);
        return record.status() == ExecutionStatus.SUCCESS ? 0 : 1;
    }
}
