package com.fauxcloud.dispatch.cli;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.web.context.WebServerInitializedEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;

/**
 * CLI command: faux-cloud serve
 * <p>
 * Runs as a long-lived HTTP server exposing the REST API, with the expiry sweeper enabled.
 * The web server is enabled by {@link com.fauxcloud.FauxCloudApplication#main} detecting "serve"
 * in args; {@link CliRunner} then skips picocli. The banner is printed once the server is ready.
 */
@Command(name = "serve", mixinStandardHelpOptions = true,
        description = "Start the HTTP server and the expiry sweeper")
@Component
public class ServeCommand implements Runnable {

    @Value("${server.port:8800}")
    private int port;

    @Override
    public void run() {
        // Not called in serve mode; registered for --help
        printBanner(port);
    }

    @EventListener
    public void onWebServerReady(WebServerInitializedEvent event) {
        printBanner(event.getWebServer().getPort());
    }

    private static void printBanner(int port) {
        ConsoleOutput.printBanner();
        ConsoleOutput.info("Faux Cloud server running on port " + port);
        System.out.println();
        System.out.println("  API:        http://localhost:" + port + "/api/v1/instances");
        System.out.println("  Health:     http://localhost:" + port + "/api/v1/health");
        System.out.println();
        ConsoleOutput.info("Press Ctrl+C to stop.");
    }

    public int getPort() {
        return port;
    }
}
