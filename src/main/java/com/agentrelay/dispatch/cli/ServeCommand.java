package com.agentrelay.dispatch.cli;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.web.context.WebServerInitializedEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;

/**
 * CLI command: agentrelay serve
 * <p>
 * Starts the HTTP boundary. The web server is enabled by
 * {@link com.agentrelay.AgentRelayApplication#main} detecting "serve" in args, and
 * {@link CliRunner} skips picocli in that mode. The banner is printed once Tomcat is ready.
 */
@Command(name = "serve", mixinStandardHelpOptions = true,
        description = "Start the AgentRelay HTTP server")
@Component
public class ServeCommand implements Runnable {

    @Value("${server.port:8080}")
    private int port;

    @Override
    public void run() {
        // Only reached via --help style invocations; CliRunner skips picocli in serve mode
        printBanner(port);
    }

    @EventListener
    public void onWebServerReady(WebServerInitializedEvent event) {
        printBanner(event.getWebServer().getPort());
    }

    private static void printBanner(int port) {
        ConsoleOutput.printBanner();
        ConsoleOutput.info("AgentRelay server running on port " + port);
        System.out.println();
        System.out.println("  Prompt:   POST http://localhost:" + port + "/agent/prompt");
        System.out.println("  Stream:   POST http://localhost:" + port + "/agent/prompt/stream");
        System.out.println("  Health:   GET  http://localhost:" + port + "/health");
        System.out.println();
        ConsoleOutput.info("Press Ctrl+C to stop.");
    }
}
