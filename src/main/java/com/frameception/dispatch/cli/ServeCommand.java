package com.frameception.dispatch.cli;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.web.context.WebServerInitializedEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;

/**
 * CLI command: frameception serve
 * <p>
 * Starts the REST API and SSE event stream. The web server is enabled by
 * {@link com.frameception.FrameceptionApplication#main} detecting "serve" in args;
 * {@link CliRunner} then skips picocli and the banner is printed once Tomcat is ready.
 */
@Command(name = "serve", mixinStandardHelpOptions = true,
        description = "Start the Frameception dashboard HTTP server")
@Component
public class ServeCommand implements Runnable {

    @Value("${server.port:8080}")
    private int port;

    @Override
    public void run() {
        // Only reached through --help style invocations; serve mode bypasses picocli.
        printBanner(port);
    }

    @EventListener
    public void onWebServerReady(WebServerInitializedEvent event) {
        printBanner(event.getWebServer().getPort());
    }

    private static void printBanner(int port) {
        ConsoleOutput.printBanner();
        ConsoleOutput.info("Dashboard server running on port " + port);
        System.out.println();
        System.out.println("  Dashboard:  http://localhost:" + port + "/api/v1/dashboard");
        System.out.println("  Events:     http://localhost:" + port + "/api/v1/dashboard/events");
        System.out.println();
        ConsoleOutput.info("Press Ctrl+C to stop.");
    }
}
