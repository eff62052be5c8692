package com.rivet.cli;

import com.rivet.core.command.CommandContext;
import com.rivet.core.config.ConfigDocument;
import com.rivet.core.config.ConfigStore;
import com.rivet.core.exception.RivetException;
import com.rivet.core.layout.ProjectLayout;
import com.rivet.core.process.MavenInvoker;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.List;

/**
 * Project lookups shared by the command handlers.
 */
final class ProjectSupport {

    static final String PRODUCTION = "production";

    private ProjectSupport() {
        // Utility class
    }

    static ConfigStore configStore(CommandContext context) {
        Path root = context.requireProject();
        return new ConfigStore(root.resolve(ProjectLayout.CONFIG_FILE));
    }

    static ConfigDocument loadConfig(CommandContext context) {
        return configStore(context).load();
    }

    static ProjectLayout layout(CommandContext context, ConfigDocument config) {
        return new ProjectLayout(context.requireProject(),
            config.getString("app.package").orElse(ProjectLayout.DEFAULT_PACKAGE));
    }

    static MavenInvoker maven(CommandContext context, ConfigDocument config) {
        return new MavenInvoker(context.requireProject(),
            config.getString("app.package").orElse(ProjectLayout.DEFAULT_PACKAGE));
    }

    /**
     * Resolves the current environment: {@code RIVET_ENV}, then {@code APP_ENV}, then
     * {@code app.env}, then development.
     */
    static String environment(CommandContext context, ConfigDocument config) {
        return context.env("RIVET_ENV")
            .or(() -> context.env("APP_ENV"))
            .or(() -> config.getString("app.env"))
            .orElse("development");
    }

    /**
     * Runs an application task through the project's console kernel in the foreground.
     */
    static void runTask(CommandContext context, String task, List<String> arguments) {
        ConfigDocument config = loadConfig(context);
        context.processRunner().runOrFail(maven(context, config).task(task, arguments).inheritingIo());
    }

    /**
     * Asks the user to type an answer on standard input.
     *
     * @param context command context
     * @param prompt question to print
     * @param expected answer that confirms, compared case-insensitively; null accepts any line
     * @return true if confirmed
     */
    static boolean confirm(CommandContext context, String prompt, String expected) {
        context.out().print(prompt + " ");
        context.out().flush();
        try {
            String line = readLine(context.in());
            if (line == null) {
                return false;
            }
            return expected == null || expected.equalsIgnoreCase(line.trim());
        } catch (IOException e) {
            throw new RivetException("Failed to read confirmation from standard input", e);
        }
    }

    /**
     * Reads one line without reading ahead, so later prompts on the same stream see the
     * following lines.
     *
     * @return the line without its terminator, or null at end of input
     */
    private static String readLine(InputStream in) throws IOException {
        ByteArrayOutputStream line = new ByteArrayOutputStream();
        int b = in.read();
        if (b < 0) {
            return null;
        }
        while (b >= 0 && b != '\n') {
            line.write(b);
            b = in.read();
        }
        String text = line.toString(StandardCharsets.UTF_8);
        return text.endsWith("\r") ? text.substring(0, text.length() - 1) : text;
    }
}
