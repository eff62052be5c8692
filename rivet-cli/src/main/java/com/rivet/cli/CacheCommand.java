package com.rivet.cli;

import com.rivet.core.cache.CacheManager;
import com.rivet.core.command.CommandContext;
import com.rivet.core.command.CommandDefinition;
import com.rivet.core.command.CommandDescriptor;
import com.rivet.core.command.CommandRegistry;
import com.rivet.core.command.ParameterDefinition;
import com.rivet.core.layout.ProjectLayout;

import java.nio.file.Path;
import java.util.List;

/**
 * Cache commands: {@code cache:clear}, {@code cache:forget} and {@code cache:config}.
 */
public class CacheCommand implements CommandFamily {

    @Override
    public void register(CommandRegistry registry) {
        registry.register(CommandDefinition.builder("cache", "clear")
            .description("Flush the application caches")
            .build(), (command, context) -> {
                int removed = new CacheManager(context.requireProject()).clear();
                context.success("Application cache cleared (" + removed + " entries removed)");
            });
        registry.register(CommandDefinition.builder("cache", "forget")
            .description("Remove an item from the cache")
            .parameter(ParameterDefinition.required("key", "Cache key"))
            .build(), (command, context) -> {
                String key = command.requiredArgument(0);
                ProjectSupport.runTask(context, "cache:forget", List.of(key));
                context.success("Cache key '" + key + "' forgotten");
            });
        registry.register(CommandDefinition.builder("cache", "config")
            .description("Create a cache file for faster configuration loading")
            .build(), CacheCommand::cacheConfig);
    }

    private static void cacheConfig(CommandDescriptor command, CommandContext context) {
        Path root = context.requireProject();
        Path written = new CacheManager(root).cacheConfig(ProjectSupport.loadConfig(context));
        context.success("Configuration cached (" + new ProjectLayout(root, ProjectLayout.DEFAULT_PACKAGE).display(written) + ")");
    }
}
