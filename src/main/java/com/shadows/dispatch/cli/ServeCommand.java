package com.shadows.dispatch.cli;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.web.context.WebServerInitializedEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;

/**
 * CLI command: shadows serve
 * <p>
 * Starts the HTTP server exposing the scenario and spawn endpoints to the browser client.
 * {@link com.shadows.ShadowsApplication#main} switches the web server on when "serve" is
 * the subcommand, and {@link CliRunner} then leaves picocli out. The banner is printed
 * once the server is listening.
 */
@Command(name = "serve", mixinStandardHelpOptions = true,
        description = "Start the Shadows HTTP server")
@Component
public class ServeCommand implements Runnable {

    @Value("${server.port:8080}")
    private int port;

    @Override
    public void run() {
        printBanner(port);
    }

    @EventListener
    public void onWebServerReady(WebServerInitializedEvent event) {
        printBanner(event.getWebServer().getPort());
    }

    private static void printBanner(int port) {
        ConsoleOutput.printBanner();
        ConsoleOutput.info("Shadows server running on port " + port);
        System.out.println();
        System.out.println("  Scenarios:  http://localhost:" + port + "/api/v1/scenarios");
        System.out.println("  Spawns:     http://localhost:" + port + "/api/v1/spawns");
        System.out.println();
        ConsoleOutput.info("Press Ctrl+C to stop.");
    }

    public int getPort() {
        return port;
    }
}
