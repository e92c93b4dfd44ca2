package com.switchboard.dispatch.cli;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.web.context.WebServerInitializedEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;

/**
 * CLI command: switchboard serve
 * <p>
 * Runs Switchboard as an HTTP server. {@code SwitchboardApplication#main} enables the web server
 * when "serve" is present and {@link CliRunner} skips picocli, so {@link #run()} only prints the
 * banner for {@code --help} style use.
 */
@Command(name = "serve", mixinStandardHelpOptions = true,
        description = "Start the Switchboard HTTP server")
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
        ConsoleOutput.info("Switchboard server running on port " + port);
        System.out.println();
        System.out.println("  API:      http://localhost:" + port + "/api/v1");
        System.out.println("  Metrics:  http://localhost:" + port + "/actuator/metrics");
        System.out.println();
        ConsoleOutput.info("Press Ctrl+C to stop.");
    }
}
