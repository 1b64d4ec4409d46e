package com.edgedispatch.dispatch.cli;

import org.springframework.stereotype.Component;
import picocli.CommandLine;
import picocli.CommandLine.Command;

/**
 * Top-level CLI command.
 * Routes to subcommands: serve, exec, build-command, health.
 */
@Command(
        name = "edgedispatch",
        mixinStandardHelpOptions = true,
        version = "edgedispatch 0.1.0",
        description = "Run commands and deployments on devices behind a private overlay network",
        subcommands = {
                ServeCommand.class,
                ExecCommand.class,
                BuildCommandCommand.class,
                HealthCommand.class,
                CommandLine.HelpCommand.class
        }
)
@Component
public class EdgeDispatchCommand implements Runnable {

    @Override
    public void run() {
        ConsoleOutput.printBanner();
        new CommandLine(this).usage(System.out);
    }
}
