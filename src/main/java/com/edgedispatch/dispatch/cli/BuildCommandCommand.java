package com.edgedispatch.dispatch.cli;

import com.edgedispatch.core.command.CommandBuilder;
import com.edgedispatch.core.execution.ExecutionRequest;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

import java.util.ArrayList;
import java.util.List;

/**
 * CLI command: edgedispatch build-command [--app-type T --app-url R] [-- cmd...]
 * <p>
 * Prints the shell line a request would run on the device. No network access.
 */
@Command(name = "build-command", mixinStandardHelpOptions = true,
        description = "Print the remote command line for a request without running it")
@Component
public class BuildCommandCommand implements Runnable {

    @Option(names = "--app-type", description = "Application type, e.g. zed")
    private String appType;

    @Option(names = "--app-url", description = "Image reference to deploy")
    private String appUrl;

    @Parameters(arity = "0..*", description = "Raw command sequence")
    private List<String> command = new ArrayList<>();

    @Override
    public void run() {
        System.out.println(CommandBuilder.build(new ExecutionRequest("", command, appType, appUrl)));
    }
}
