package com.rivet.cli;

import com.rivet.core.command.CommandContext;
import com.rivet.core.command.CommandDefinition;
import com.rivet.core.command.CommandDescriptor;
import com.rivet.core.command.CommandRegistry;
import com.rivet.core.command.FlagDefinition;
import com.rivet.core.command.ParameterDefinition;
import com.rivet.core.exception.ParseException;
import com.rivet.core.generator.ComponentSpec;
import com.rivet.core.layout.ComponentKind;

import java.util.ArrayList;
import java.util.List;

/**
 * Migration commands, delegated to the application's console kernel.
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * rivet migrate
 * rivet migrate down --steps 2
 * rivet migrate:status
 * rivet migrate:make create_posts_table
 * }</pre>
 */
public class MigrateCommand implements CommandFamily {

    @Override
    public void register(CommandRegistry registry) {
        registry.register(CommandDefinition.builder("migrate")
            .description("Run database migrations")
            .parameter(ParameterDefinition.optional("direction", "up (default) or down"))
            .flag(FlagDefinition.integer("steps", "Number of migrations to roll back"))
            .build(), this::migrate);
        registry.register(CommandDefinition.builder("migrate", "reset")
            .description("Roll back all database migrations")
            .build(), (command, context) -> run(context, "migrate:reset", List.of(), "Database migrations reset"));
        registry.register(CommandDefinition.builder("migrate", "refresh")
            .description("Reset and re-run all migrations")
            .build(), (command, context) -> run(context, "migrate:refresh", List.of(), "Database migrations refreshed"));
        registry.register(CommandDefinition.builder("migrate", "status")
            .description("Show the status of each migration")
            .build(), (command, context) -> ProjectSupport.runTask(context, "migrate:status", List.of()));
        registry.register(CommandDefinition.builder("migrate", "make")
            .description("Create a new migration file")
            .parameter(ParameterDefinition.required("name", "Migration name"))
            .flag(FlagDefinition.string(ComponentSpec.CREATE, "Table to create"))
            .flag(FlagDefinition.string(ComponentSpec.TABLE, "Table to alter"))
            .build(), this::make);
    }

    private void migrate(CommandDescriptor command, CommandContext context) {
        String direction = command.argument(0).orElse("up");
        switch (direction) {
            case "up" -> run(context, "migrate", List.of(), "Database migrations completed");
            case "down" -> {
                List<String> arguments = new ArrayList<>();
                command.intFlag("steps").ifPresent(steps -> {
                    arguments.add("--steps");
                    arguments.add(String.valueOf(steps));
                });
                run(context, "migrate:rollback", arguments, "Database migrations rolled back");
            }
            default -> throw new ParseException("Unknown migration direction '" + direction + "', expected up or down");
        }
    }

    private void make(CommandDescriptor command, CommandContext context) {
        CommandDescriptor alias = new CommandDescriptor("make", ComponentKind.MIGRATION.id(),
            command.arguments(), command.flags(), false);
        MakeCommand.generate(context, MakeCommand.toSpec(ComponentKind.MIGRATION, alias));
    }

    private static void run(CommandContext context, String task, List<String> arguments, String done) {
        context.info("Running " + task + "...");
        ProjectSupport.runTask(context, task, arguments);
        context.success(done);
    }
}
