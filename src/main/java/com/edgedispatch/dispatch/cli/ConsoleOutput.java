package com.edgedispatch.dispatch.cli;

import com.edgedispatch.core.execution.ExecutionRecord;
import picocli.CommandLine;

/**
 * ANSI-colored terminal output utilities for the CLI.
 */
public class ConsoleOutput {

    private ConsoleOutput() {
        // utility class
    }

    public static void printBanner() {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|bold,fg(yellow) EDGEDISPATCH v0.1.0|@"));
        System.out.println("──────────────────────────────────");
    }

    public static void info(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(cyan) [EDGEDISPATCH]|@ " + message));
    }

    public static void success(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(green) +|@ " + message));
    }

    public static void error(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(red) x|@ " + message));
    }

    public static void execution(ExecutionRecord record) {
        String status = switch (record.status()) {
            case SUCCESS -> "@|fg(green) SUCCESS|@";
            case ERROR -> "@|fg(red) ERROR|@";
            case PENDING -> "@|fg(yellow) PENDING|@";
        };
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(magenta) [EXEC]|@ " + record.executionId() + " " + status
                        + (record.transport() != null ? " via " + record.transport().name().toLowerCase() : "")));
        if (record.failureKind() != null) {
            System.out.println("  kind:   " + record.failureKind());
        }
        if (record.error() != null && !record.error().isBlank()) {
            System.out.println("  error:  " + record.error());
        }
        if (record.output() != null && !record.output().isBlank()) {
            System.out.println("  output:");
            for (String line : record.output().strip().split("\n")) {
                System.out.println("    " + line);
            }
        }
    }
}
