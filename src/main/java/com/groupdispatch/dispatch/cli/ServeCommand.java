package com.groupdispatch.dispatch.cli;

import com.groupdispatch.core.dispatch.DispatchProperties;
import org.springframework.boot.web.context.WebServerInitializedEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;

/**
 * CLI command: groupdispatch serve
 * <p>
 * Runs the dispatch engine with the REST API. {@code GroupDispatchApplication} turns on the
 * web server and engine autostart when it sees this command; {@link CliRunner} then skips
 * picocli, so {@link #run()} only executes for {@code --help}-style invocations.
 */
@Command(name = ServeCommand.NAME, mixinStandardHelpOptions = true,
        description = "Start the dispatch engine and HTTP API")
@Component
public class ServeCommand implements Runnable {

    static final String NAME = "serve";

    private final DispatchProperties properties;

    public ServeCommand(DispatchProperties properties) {
        this.properties = properties;
    }

    @Override
    public void run() {
        ConsoleOutput.info("Run 'groupdispatch serve' as the first argument to start the engine.");
    }

    @EventListener
    public void onWebServerReady(WebServerInitializedEvent event) {
        int port = event.getWebServer().getPort();
        ConsoleOutput.printBanner();
        ConsoleOutput.info("Dispatching as @" + properties.getAssistantName()
                + " (main folder: " + properties.getMainFolder() + ")");
        ConsoleOutput.info("API: http://localhost:" + port + "/api/v1");
        ConsoleOutput.info("Press Ctrl+C to stop.");
    }
}
