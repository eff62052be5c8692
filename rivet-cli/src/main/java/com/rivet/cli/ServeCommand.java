package com.rivet.cli;

import com.rivet.core.command.CommandContext;
import com.rivet.core.command.CommandDefinition;
import com.rivet.core.command.CommandDescriptor;
import com.rivet.core.command.CommandRegistry;
import com.rivet.core.command.FlagDefinition;
import com.rivet.core.config.ConfigDocument;
import com.rivet.core.exception.DelegatedFailureException;
import com.rivet.core.exception.RivetException;
import com.rivet.core.process.ProcessInvocation;
import com.rivet.core.process.RunningProcess;
import com.rivet.core.process.SourceWatcher;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.Map;

/**
 * Command to run the application's development server through Maven.
 *
 * <p>With {@code --reload} the source tree is watched and the server restarted after each
 * change.
 */
public class ServeCommand implements CommandFamily {

    private static final Logger log = LoggerFactory.getLogger(ServeCommand.class);
    private static final Duration POLL_INTERVAL = Duration.ofSeconds(1);

    @Override
    public void register(CommandRegistry registry) {
        registry.register(CommandDefinition.builder("serve")
            .description("Start the development server")
            .flag(FlagDefinition.string("host", "Host to bind to").withDefault("127.0.0.1"))
            .flag(FlagDefinition.integer("port", "Port to listen on").withShortName("p").withDefault(8080))
            .flag(FlagDefinition.string("env", "Application environment").withShortName("e"))
            .flag(FlagDefinition.bool("reload", "Restart the server when sources change").withShortName("r"))
            .build(), this::handle);
    }

    private void handle(CommandDescriptor command, CommandContext context) {
        Path root = context.requireProject();
        ConfigDocument config = ProjectSupport.loadConfig(context);
        String host = command.stringFlag("host").orElse("127.0.0.1");
        int port = command.intFlag("port").orElse(8080);
        String env = command.stringFlag("env").orElseGet(() -> ProjectSupport.environment(context, config));

        ProcessInvocation invocation = ProjectSupport.maven(context, config).application()
            .withEnvironment(Map.of("APP_ENV", env, "SERVER_HOST", host, "SERVER_PORT", String.valueOf(port)));

        context.info("Starting development server on http://" + host + ":" + port + " (" + env + ")");
        context.info("Press Ctrl+C to stop the server");

        try {
            if (command.booleanFlag("reload")) {
                serveWithReload(context, invocation, List.of(root.resolve("src/main")));
            } else {
                RunningProcess server = context.processRunner().start(invocation);
                int exitCode = server.waitFor();
                if (exitCode != 0) {
                    throw new DelegatedFailureException(invocation.command(), exitCode, "server exited");
                }
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            context.info("Server stopped");
        }
    }

    private void serveWithReload(CommandContext context, ProcessInvocation invocation, List<Path> roots)
        throws InterruptedException {
        try (SourceWatcher watcher = new SourceWatcher(roots)) {
            RunningProcess server = context.processRunner().start(invocation);
            try {
                while (true) {
                    if (watcher.awaitChange(POLL_INTERVAL)) {
                        context.info("Changes detected, restarting server...");
                        server.stop();
                        server = context.processRunner().start(invocation);
                    } else if (!server.isAlive()) {
                        log.debug("Server process exited, waiting for changes before restarting");
                        while (!watcher.awaitChange(POLL_INTERVAL)) {
                            // idle until the next edit
                        }
                        context.info("Changes detected, restarting server...");
                        server = context.processRunner().start(invocation);
                    }
                }
            } finally {
                server.stop();
            }
        } catch (IOException e) {
            throw new RivetException("Failed to watch sources for changes", e);
        }
    }
}
