package com.rivet.cli;

import com.fasterxml.jackson.databind.JsonNode;
import com.rivet.core.command.CommandContext;
import com.rivet.core.command.CommandDefinition;
import com.rivet.core.command.CommandDescriptor;
import com.rivet.core.command.CommandRegistry;
import com.rivet.core.command.FlagDefinition;
import com.rivet.core.command.ParameterDefinition;
import com.rivet.core.config.AppKeyGenerator;
import com.rivet.core.config.ConfigDefaults;
import com.rivet.core.config.ConfigDocument;
import com.rivet.core.config.ConfigStore;
import com.rivet.core.config.ConfigValidator;
import com.rivet.core.config.SensitiveKeys;
import com.rivet.core.config.ValidationReport;
import com.rivet.core.exception.ConfigValidationException;
import com.rivet.core.layout.ProjectLayout;

import java.util.Map;

/**
 * Commands reading and writing {@code rivet.yaml}.
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * rivet config:get database.connections.default.port
 * rivet config:set app.debug false
 * rivet config:generate-key
 * rivet config:validate
 * }</pre>
 */
public class ConfigCommand implements CommandFamily {

    @Override
    public void register(CommandRegistry registry) {
        registry.register(CommandDefinition.builder("config", "show")
            .description("Show all configuration values")
            .build(), this::show);
        registry.register(CommandDefinition.builder("config", "get")
            .description("Get a configuration value")
            .parameter(ParameterDefinition.required("key", "Dotted key, e.g. app.name"))
            .build(), this::get);
        registry.register(CommandDefinition.builder("config", "set")
            .description("Set a configuration value")
            .parameter(ParameterDefinition.required("key", "Dotted key, e.g. app.debug"))
            .parameter(ParameterDefinition.required("value", "New value"))
            .build(), this::set);
        registry.register(CommandDefinition.builder("config", "generate-key")
            .description("Generate a new application key")
            .build(), this::generateKey);
        registry.register(CommandDefinition.builder("config", "validate")
            .description("Validate the configuration")
            .build(), this::validate);
        registry.register(CommandDefinition.builder("config", "reset")
            .description("Reset the configuration to defaults")
            .flag(FlagDefinition.bool("force", "Skip the confirmation prompt").withShortName("f"))
            .build(), this::reset);
    }

    private void show(CommandDescriptor command, CommandContext context) {
        ConfigDocument config = ProjectSupport.loadConfig(context);
        context.out().println("Configuration (" + ProjectLayout.CONFIG_FILE + "):");
        for (Map.Entry<String, JsonNode> leaf : config.leaves().entrySet()) {
            String value = SensitiveKeys.display(leaf.getKey(), ConfigDocument.format(leaf.getValue()));
            context.out().printf("  %s = %s%n", leaf.getKey(), value);
        }
    }

    private void get(CommandDescriptor command, CommandContext context) {
        String key = command.requiredArgument(0);
        JsonNode value = ProjectSupport.configStore(context).get(key);
        context.out().println(key + " = " + ConfigDocument.format(value));
    }

    private void set(CommandDescriptor command, CommandContext context) {
        String key = command.requiredArgument(0);
        Object value = ProjectSupport.configStore(context).set(key, command.requiredArgument(1));
        context.success("Set " + key + " = " + SensitiveKeys.display(key, String.valueOf(value)));
    }

    private void generateKey(CommandDescriptor command, CommandContext context) {
        ConfigStore store = ProjectSupport.configStore(context);
        ConfigDocument config = store.load();
        String key = new AppKeyGenerator().generate();
        config.set("app.key", key);
        store.save(config);
        context.success("Application key set: " + key);
    }

    private void validate(CommandDescriptor command, CommandContext context) {
        ValidationReport report = new ConfigValidator().validate(ProjectSupport.loadConfig(context));
        report.warnings().forEach(context::warning);
        report.errors().forEach(context::error);
        if (!report.isValid()) {
            throw new ConfigValidationException(report.errors());
        }
        if (report.isClean()) {
            context.success("Configuration is valid");
        } else {
            context.success("Configuration is valid with " + report.warnings().size() + " warning(s)");
        }
    }

    private void reset(CommandDescriptor command, CommandContext context) {
        ConfigStore store = ProjectSupport.configStore(context);
        if (!command.booleanFlag("force")
            && !ProjectSupport.confirm(context, "Reset " + ProjectLayout.CONFIG_FILE + " to defaults? Type 'yes' to continue:", "yes")) {
            context.info("Operation cancelled");
            return;
        }
        ConfigDocument current = store.load();
        String name = current.getString("app.name")
            .orElse(context.workingDirectory().getFileName().toString());
        String basePackage = current.getString("app.package").orElse(ProjectLayout.DEFAULT_PACKAGE);
        store.save(ConfigDefaults.create(name, basePackage));
        context.success("Configuration reset to defaults");
    }
}
