package com.edgedispatch.dispatch.cli;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.web.context.WebServerInitializedEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;

/**
 * CLI command: edgedispatch serve
 * <p>
 * Starts the long-running HTTP server. The web server is enabled by
 * {@link com.edgedispatch.EdgeDispatchApplication#main} detecting "serve" in args;
 * {@link CliRunner} skips picocli in that mode, and the banner is printed once
 * Tomcat reports its port.
 * <p>
 * Configure port via: {@code SIDECAR_PORT=9090 edgedispatch serve}
 */
@Command(name = "serve", mixinStandardHelpOptions = true,
        description = "Start the HTTP server")
@Component
public class ServeCommand implements Runnable {

    @Value("${server.port:9000}")
    private int port;

    @Override
    public void run() {
        // Not called in serve mode; kept for subcommand registration and --help
        printBanner(port);
    }

    @EventListener
    public void onWebServerReady(WebServerInitializedEvent event) {
        printBanner(event.getWebServer().getPort());
    }

    private static void printBanner(int port) {
        ConsoleOutput.printBanner();
        ConsoleOutput.info("Sidecar running on port " + port);
        System.out.println();
        System.out.println("  Submit:  POST http://localhost:" + port + "/api/v1/executions");
        System.out.println("  Status:  GET  http://localhost:" + port + "/api/v1/executions/{id}");
        System.out.println("  Health:  GET  http://localhost:" + port + "/api/v1/health");
        System.out.println();
        ConsoleOutput.info("Press Ctrl+C to stop.");
    }

    public int getPort() {
        return port;
    }
}
