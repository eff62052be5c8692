package com.rivet.cli;

import com.fasterxml.jackson.databind.JsonNode;
import com.rivet.core.command.CommandContext;
import com.rivet.core.command.CommandDefinition;
import com.rivet.core.command.CommandDescriptor;
import com.rivet.core.command.CommandRegistry;
import com.rivet.core.command.FlagDefinition;
import com.rivet.core.config.ConfigDocument;
import com.rivet.core.config.SensitiveKeys;
import com.rivet.core.exception.RivetException;
import com.rivet.core.layout.ProjectLayout;
import com.rivet.core.process.ProcessInvocation;
import com.rivet.core.process.ProcessResult;
import com.rivet.core.util.FileUtils;

import java.io.IOException;
import java.nio.file.Path;
import java.util.Map;

/**
 * Command to display information about the application and its environment.
 */
public class InfoCommand implements CommandFamily {

    @Override
    public void register(CommandRegistry registry) {
        registry.register(CommandDefinition.builder("info")
            .description("Display application information")
            .flag(FlagDefinition.bool("detailed", "Include configuration, tools and file counts").withShortName("d"))
            .build(), this::handle);
    }

    private void handle(CommandDescriptor command, CommandContext context) {
        Path root = context.requireProject();
        ConfigDocument config = ProjectSupport.loadConfig(context);
        ProjectLayout layout = ProjectSupport.layout(context, config);

        context.out().println("Application:");
        context.out().printf("  Name:        %s%n", config.getString("app.name").orElse(root.getFileName().toString()));
        context.out().printf("  Version:     %s%n", config.getString("app.version").orElse("unknown"));
        context.out().printf("  Package:     %s%n", layout.basePackage());
        context.out().printf("  Environment: %s%n", ProjectSupport.environment(context, config));
        context.out().printf("  Debug:       %s%n", config.getString("app.debug").orElse("false"));
        context.out().printf("  Directory:   %s%n", root);
        context.out().println();
        context.out().println("System:");
        context.out().printf("  Rivet:       %s%n", RivetCommands.VERSION);
        context.out().printf("  Java:        %s%n", System.getProperty("java.version"));
        context.out().printf("  OS:          %s %s%n", System.getProperty("os.name"), System.getProperty("os.arch"));

        if (command.booleanFlag("detailed")) {
            detailed(context, config, layout);
        }
    }

    private void detailed(CommandContext context, ConfigDocument config, ProjectLayout layout) {
        context.out().println();
        context.out().println("Tools:");
        context.out().printf("  Maven:       %s%n", toolVersion(context, ProjectSupport.maven(context, config).executable(), "-v"));
        context.out().printf("  Git:         %s%n", toolVersion(context, "git", "--version"));

        context.out().println();
        context.out().println("Source files:");
        for (Path directory : layout.componentDirectories()) {
            String glob = directory.equals(layout.migrationsDirectory()) ? "*.sql" : "**.java";
            context.out().printf("  %-40s %d%n", layout.display(directory), countFiles(directory, glob));
        }

        context.out().println();
        context.out().println("Configuration:");
        for (Map.Entry<String, JsonNode> leaf : config.leaves().entrySet()) {
            context.out().printf("  %s = %s%n", leaf.getKey(),
                SensitiveKeys.display(leaf.getKey(), ConfigDocument.format(leaf.getValue())));
        }
    }

    private static String toolVersion(CommandContext context, String tool, String flag) {
        if (!context.processRunner().isAvailable(tool)) {
            return "not found";
        }
        ProcessResult result = context.processRunner().run(ProcessInvocation.of(context.workingDirectory(), tool, flag));
        if (!result.succeeded() || result.stdout().isBlank()) {
            return "unknown";
        }
        return result.stdout().lines().findFirst().orElse("unknown").strip();
    }

    private static long countFiles(Path directory, String glob) {
        try {
            return FileUtils.findFiles(directory, glob).size();
        } catch (IOException e) {
            throw new RivetException("Failed to scan " + directory, e);
        }
    }
}
