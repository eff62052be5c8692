package com.rivet.cli;

import com.rivet.core.cache.CacheManager;
import com.rivet.core.command.CommandContext;
import com.rivet.core.command.CommandDefinition;
import com.rivet.core.command.CommandDescriptor;
import com.rivet.core.command.CommandRegistry;
import com.rivet.core.command.FlagDefinition;
import com.rivet.core.config.ConfigDocument;
import com.rivet.core.exception.RivetException;
import com.rivet.core.util.FileUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.ArrayList;
import java.util.List;

/**
 * Command to package the application for an environment.
 */
public class BuildCommand implements CommandFamily {

    private static final Logger log = LoggerFactory.getLogger(BuildCommand.class);

    @Override
    public void register(CommandRegistry registry) {
        registry.register(CommandDefinition.builder("build")
            .description("Build the application for deployment")
            .flag(FlagDefinition.string("env", "Target environment").withShortName("e").withDefault(ProjectSupport.PRODUCTION))
            .flag(FlagDefinition.bool("optimize", "Clean before packaging"))
            .flag(FlagDefinition.string("output", "Directory to copy the packaged jars to").withShortName("o"))
            .build(), this::handle);
    }

    private void handle(CommandDescriptor command, CommandContext context) {
        Path root = context.requireProject();
        ConfigDocument config = ProjectSupport.loadConfig(context);
        String env = command.stringFlag("env").orElse(ProjectSupport.PRODUCTION);
        boolean clean = command.booleanFlag("optimize") || ProjectSupport.PRODUCTION.equals(env);

        context.info("Building application for " + env + "...");
        context.info("Caching configuration...");
        new CacheManager(root).cacheConfig(config);

        List<String> goals = new ArrayList<>();
        if (clean) {
            goals.add("clean");
        }
        goals.add("package");
        goals.add("-DskipTests");
        goals.add("-P" + env);
        context.info("Compiling application...");
        context.processRunner().runOrFail(ProjectSupport.maven(context, config).goals(goals).inheritingIo());

        command.stringFlag("output").ifPresent(output -> {
            Path target = root.resolve(output);
            context.info("Copying build to: " + target);
            int copied = copyArtifacts(root.resolve("target"), target);
            context.info(copied + " artifact(s) copied");
        });

        context.out().println();
        context.out().println("Build summary:");
        context.out().printf("  Environment: %s%n", env);
        context.out().printf("  Clean build: %s%n", clean ? "yes" : "no");
        context.success("Build completed successfully");
    }

    static int copyArtifacts(Path buildDirectory, Path outputDirectory) {
        try {
            List<Path> jars = FileUtils.findFiles(buildDirectory, "*.jar");
            Files.createDirectories(outputDirectory);
            for (Path jar : jars) {
                log.debug("Copying {} to {}", jar, outputDirectory);
                Files.copy(jar, outputDirectory.resolve(jar.getFileName()), StandardCopyOption.REPLACE_EXISTING);
            }
            return jars.size();
        } catch (IOException e) {
            throw new RivetException("Failed to copy build artifacts to " + outputDirectory, e);
        }
    }
}
