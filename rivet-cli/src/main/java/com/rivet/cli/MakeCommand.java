package com.rivet.cli;

import com.rivet.core.command.CommandContext;
import com.rivet.core.command.CommandDefinition;
import com.rivet.core.command.CommandDescriptor;
import com.rivet.core.command.CommandRegistry;
import com.rivet.core.command.FlagDefinition;
import com.rivet.core.command.ParameterDefinition;
import com.rivet.core.config.ConfigDocument;
import com.rivet.core.generator.ComponentSpec;
import com.rivet.core.generator.GeneratedComponent;
import com.rivet.core.generator.GeneratorEngine;
import com.rivet.core.generator.Modifier;
import com.rivet.core.layout.ComponentKind;
import com.rivet.core.layout.ProjectLayout;
import com.rivet.core.template.TemplateRenderer;

import java.util.ArrayList;
import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Commands that generate application components: {@code make:<kind> <Name>}.
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * rivet make:controller UserController --resource --model User
 * rivet make:model Post -m --factory --seeder
 * rivet make:migration add_email_to_users_table
 * rivet make:test CheckoutTest --integration
 * }</pre>
 */
public class MakeCommand implements CommandFamily {

    private static final FlagDefinition FORCE = FlagDefinition.bool("force", "Overwrite existing files");

    @Override
    public void register(CommandRegistry registry) {
        for (ComponentKind kind : ComponentKind.values()) {
            CommandDefinition.Builder builder = CommandDefinition.builder("make", kind.id())
                .description(description(kind))
                .parameter(ParameterDefinition.required("name", "Name of the " + kind.id()));
            flags(kind).forEach(builder::flag);
            builder.flag(FORCE);
            registry.register(builder.build(), this::handle);
        }
    }

    private void handle(CommandDescriptor command, CommandContext context) {
        ComponentKind kind = ComponentKind.fromId(command.noun())
            .orElseThrow(() -> new IllegalStateException("No component kind " + command.noun()));
        generate(context, toSpec(kind, command));
    }

    /**
     * Generates a component and reports each written file.
     *
     * @param context command context
     * @param spec generation request
     * @return written files
     */
    static List<GeneratedComponent> generate(CommandContext context, ComponentSpec spec) {
        context.requireProject();
        ConfigDocument config = ProjectSupport.loadConfig(context);
        ProjectLayout layout = ProjectSupport.layout(context, config);
        GeneratorEngine engine = new GeneratorEngine(layout, new TemplateRenderer(), context.clock());

        List<GeneratedComponent> generated = engine.generate(spec);
        for (GeneratedComponent component : generated) {
            String verb = component.overwritten() ? "Overwrote" : "Created";
            context.success(verb + " " + component.kind().id() + " " + component.name()
                + " (" + layout.display(component.path()) + ")");
        }
        if (spec.kind() == ComponentKind.CONTROLLER && (spec.has(Modifier.RESOURCE) || spec.has(Modifier.API))) {
            context.info(spec.has(Modifier.API)
                ? "API controller created with methods: index, store, show, update, destroy"
                : "Resource controller created with methods: index, create, store, show, edit, update, destroy");
        }
        return generated;
    }

    static ComponentSpec toSpec(ComponentKind kind, CommandDescriptor command) {
        Set<Modifier> modifiers = EnumSet.noneOf(Modifier.class);
        Map<String, String> options = new LinkedHashMap<>();
        for (Map.Entry<String, Object> flag : command.flags().entrySet()) {
            if (Boolean.TRUE.equals(flag.getValue())) {
                Modifier.fromFlag(flag.getKey()).ifPresent(modifiers::add);
            } else if (flag.getValue() instanceof String value) {
                options.put(flag.getKey(), value);
            }
        }
        return new ComponentSpec(kind, command.requiredArgument(0), modifiers, options, command.booleanFlag("force"));
    }

    private static List<FlagDefinition> flags(ComponentKind kind) {
        List<FlagDefinition> flags = new ArrayList<>();
        switch (kind) {
            case CONTROLLER -> {
                flags.add(modifier(Modifier.RESOURCE, "Generate a resource controller").withShortName("r"));
                flags.add(modifier(Modifier.API, "Generate an API controller without create/edit"));
                flags.add(option(ComponentSpec.MODEL, "Model the controller works on").withShortName("m"));
            }
            case MODEL -> {
                flags.add(modifier(Modifier.MIGRATION, "Also create a migration").withShortName("m"));
                flags.add(modifier(Modifier.FACTORY, "Also create a factory"));
                flags.add(modifier(Modifier.SEEDER, "Also create a seeder").withShortName("s"));
            }
            case MIGRATION -> {
                flags.add(option(ComponentSpec.CREATE, "Table to create"));
                flags.add(option(ComponentSpec.TABLE, "Table to alter"));
            }
            case RESOURCE -> flags.add(modifier(Modifier.COLLECTION, "Generate a resource collection").withShortName("c"));
            case SEEDER, FACTORY, POLICY -> flags.add(option(ComponentSpec.MODEL, "Model to use").withShortName("m"));
            case JOB -> flags.add(modifier(Modifier.SYNC, "Generate a synchronous job"));
            case LISTENER -> flags.add(option(ComponentSpec.EVENT, "Event to listen for").withShortName("e"));
            case TEST -> {
                flags.add(modifier(Modifier.UNIT, "Generate a unit test").withShortName("u"));
                flags.add(modifier(Modifier.INTEGRATION, "Generate an integration test").withShortName("i"));
            }
            default -> {
                // middleware, request, event, command take no extra flags
            }
        }
        return flags;
    }

    private static FlagDefinition modifier(Modifier modifier, String description) {
        return FlagDefinition.bool(modifier.flag(), description);
    }

    private static FlagDefinition option(String name, String description) {
        return FlagDefinition.string(name, description);
    }

    private static String description(ComponentKind kind) {
        return switch (kind) {
            case CONTROLLER -> "Create a new controller class";
            case MODEL -> "Create a new model class";
            case MIDDLEWARE -> "Create a new middleware class";
            case REQUEST -> "Create a new form request class";
            case RESOURCE -> "Create a new API resource";
            case SEEDER -> "Create a new seeder class";
            case FACTORY -> "Create a new model factory";
            case JOB -> "Create a new job class";
            case EVENT -> "Create a new event class";
            case LISTENER -> "Create a new event listener";
            case MIGRATION -> "Create a new migration file";
            case COMMAND -> "Create a new console command";
            case POLICY -> "Create a new policy class";
            case TEST -> "Create a new test class";
        };
    }
}
