package com.warden.dispatch.cli;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.web.context.WebServerInitializedEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;

/**
 * CLI command: warden serve
 * <p>
 * Starts Warden as a long-running HTTP server exposing the sandbox REST API.
 * The web server is enabled by {@link com.warden.WardenApplication#main}
 * detecting "serve" in args; {@link CliRunner} then skips picocli.
 * <p>
 * Configure port via: {@code SERVER_PORT=9090 warden serve}
 */
@Command(name = "serve", mixinStandardHelpOptions = true,
        description = "Start the Warden HTTP server")
@Component
public class ServeCommand implements Runnable {

    @Value("${server.port:8080}")
    private int port;

    @Override
    public void run() {
        // Only reached via picocli (e.g. tests); normal serve mode bypasses picocli.
        printBanner(port);
    }

    @EventListener
    public void onWebServerReady(WebServerInitializedEvent event) {
        printBanner(event.getWebServer().getPort());
    }

    private static void printBanner(int port) {
        ConsoleOutput.printBanner();
        ConsoleOutput.info("Warden server running on port " + port);
        System.out.println();
        System.out.println("  API:        http://localhost:" + port + "/api/v1/sandboxes");
        System.out.println("  Health:     http://localhost:" + port + "/actuator/health");
        System.out.println();
        ConsoleOutput.info("Press Ctrl+C to stop.");
    }
}
