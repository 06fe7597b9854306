package com.wirevizweb.dispatch.cli;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.web.context.WebServerInitializedEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;

/**
 * CLI command: wireviz-web serve
 * <p>
 * Starts the HTTP server exposing {@code POST /render} and
 * {@code GET /plantuml/{imagetype}/{encoded}}. The web server is enabled by
 * {@link com.wirevizweb.WirevizWebApplication#main} detecting "serve" in args.
 * <p>
 * Configure port via: {@code SERVER_PORT=9090 wireviz-web serve}
 * or {@code java -Dserver.port=9090 -jar wireviz-web.jar serve}
 */
@Command(name = "serve", mixinStandardHelpOptions = true,
        description = "Start the WireViz-Web HTTP server")
@Component
public class ServeCommand implements Runnable {

    @Value("${server.port:8080}")
    private int port;

    @Override
    public void run() {
        // Not called in serve mode; CliRunner skips picocli.
        // Kept for picocli subcommand registration and --help.
        printBanner(port);
    }

    @EventListener
    public void onWebServerReady(WebServerInitializedEvent event) {
        printBanner(event.getWebServer().getPort());
    }

    private static void printBanner(int port) {
        ConsoleOutput.printBanner();
        ConsoleOutput.info("WireViz-Web server running on port " + port);
        System.out.println();
        System.out.println("  Render:    POST http://localhost:" + port + "/render");
        System.out.println("  PlantUML:  GET  http://localhost:" + port + "/plantuml/{svg|png}/{encoded}");
        System.out.println("  Health:    GET  http://localhost:" + port + "/api/v1/health");
        System.out.println();
        ConsoleOutput.info("Press Ctrl+C to stop.");
    }

    public int getPort() {
        return port;
    }
}
