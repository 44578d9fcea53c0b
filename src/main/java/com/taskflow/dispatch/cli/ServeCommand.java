package com.taskflow.dispatch.cli;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.web.context.WebServerInitializedEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;

/**
 * CLI command: taskflow serve
 * <p>
 * Starts Taskflow as a long-running HTTP server exposing the task API. The web server is
 * enabled by {@link com.taskflow.TaskflowApplication#main} detecting "serve" in args, and
 * {@link CliRunner} skips picocli in that mode. The banner is printed once Tomcat is ready.
 */
@Command(name = "serve", mixinStandardHelpOptions = true,
        description = "Start the Taskflow HTTP server")
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
        ConsoleOutput.info("Taskflow server running on port " + port);
        System.out.println();
        System.out.println("  API:     http://localhost:" + port + "/api/v1/tasks");
        System.out.println("  Health:  http://localhost:" + port + "/actuator/health");
        System.out.println();
        ConsoleOutput.info("Press Ctrl+C to stop.");
    }
}
