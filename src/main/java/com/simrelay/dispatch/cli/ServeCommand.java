package com.simrelay.dispatch.cli;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.web.context.WebServerInitializedEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;

/**
 * CLI command: simrelay serve
 * <p>
 * Starts the relay HTTP server. The web server is enabled by
 * {@link com.simrelay.SimRelayApplication#main} detecting "serve" in args, and
 * {@link CliRunner} skips picocli so Tomcat keeps the JVM alive.
 * <p>
 * Configure port via: {@code SERVER_PORT=9090 simrelay serve}
 */
@Command(name = "serve", mixinStandardHelpOptions = true,
        description = "Start the SimRelay HTTP server")
@Component
public class ServeCommand implements Runnable {

    @Value("${server.port:8080}")
    private int port;

    @Override
    public void run() {
        // Not called in serve mode; kept for subcommand registration and --help.
        printBanner(port);
    }

    @EventListener
    public void onWebServerReady(WebServerInitializedEvent event) {
        printBanner(event.getWebServer().getPort());
    }

    private static void printBanner(int port) {
        ConsoleOutput.printBanner();
        ConsoleOutput.info("SimRelay server running on port " + port);
        System.out.println();
        System.out.println("  State:     http://localhost:" + port + "/api/state");
        System.out.println("  Commands:  http://localhost:" + port + "/api/commands");
        System.out.println("  Health:    http://localhost:" + port + "/api/health");
        System.out.println();
        ConsoleOutput.info("Press Ctrl+C to stop.");
    }
}
