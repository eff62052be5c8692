package com.rivet.cli;

import com.rivet.core.command.CommandContext;
import com.rivet.core.command.CommandDefinition;
import com.rivet.core.command.CommandDescriptor;
import com.rivet.core.command.CommandRegistry;
import com.rivet.core.command.FlagDefinition;
import com.rivet.core.config.ConfigDocument;
import com.rivet.core.config.SensitiveKeys;
import com.rivet.core.database.DatabaseClient;
import com.rivet.core.database.DatabaseConnection;
import com.rivet.core.exception.RivetException;
import com.rivet.core.process.ProcessResult;

import java.util.List;

/**
 * Database management commands: {@code db:status}, {@code db:create}, {@code db:drop},
 * {@code db:reset} and {@code db:seed}.
 */
public class DbCommand implements CommandFamily {

    private static final FlagDefinition FORCE = FlagDefinition.bool("force", "Skip the confirmation prompt");

    @Override
    public void register(CommandRegistry registry) {
        registry.register(CommandDefinition.builder("db", "status")
            .description("Show database connection status")
            .build(), this::status);
        registry.register(CommandDefinition.builder("db", "create")
            .description("Create the configured database")
            .build(), this::create);
        registry.register(CommandDefinition.builder("db", "drop")
            .description("Drop the configured database")
            .flag(FORCE)
            .build(), this::drop);
        registry.register(CommandDefinition.builder("db", "reset")
            .description("Drop, recreate and migrate the database")
            .flag(FORCE)
            .build(), this::reset);
        registry.register(CommandDefinition.builder("db", "seed")
            .description("Seed the database with records")
            .flag(FlagDefinition.string("class", "Seeder class to run").withDefault("DatabaseSeeder"))
            .build(), (command, context) -> ProjectSupport.runTask(context, "seed",
                List.of("--class", command.stringFlag("class").orElse("DatabaseSeeder"))));
    }

    private void status(CommandDescriptor command, CommandContext context) {
        ConfigDocument config = ProjectSupport.loadConfig(context);
        DatabaseConnection connection = DatabaseConnection.fromConfig(config);

        context.out().println("Database connection:");
        context.out().printf("  Driver:   %s%n", connection.driver());
        context.out().printf("  Host:     %s:%s%n", connection.host(), connection.port());
        context.out().printf("  Database: %s%n", connection.database());
        context.out().printf("  Username: %s%n", connection.username());
        context.out().printf("  Password: %s%n",
            SensitiveKeys.display("database.connections.default.password", connection.password()));

        ProcessResult probe = client(context, connection).probe();
        if (probe.succeeded()) {
            context.success("Database connection successful");
        } else {
            context.warning("Could not connect to the database: " + probe.stderr().strip());
        }
    }

    private void create(CommandDescriptor command, CommandContext context) {
        DatabaseConnection connection = DatabaseConnection.fromConfig(ProjectSupport.loadConfig(context));
        client(context, connection).create();
        context.success("Database '" + connection.database() + "' created");
    }

    private void drop(CommandDescriptor command, CommandContext context) {
        ConfigDocument config = ProjectSupport.loadConfig(context);
        DatabaseConnection connection = DatabaseConnection.fromConfig(config);
        if (!confirmDestructive(command, context, config, "drop database '" + connection.database() + "'")) {
            context.info("Operation cancelled");
            return;
        }
        client(context, connection).drop();
        context.success("Database '" + connection.database() + "' dropped");
    }

    private void reset(CommandDescriptor command, CommandContext context) {
        ConfigDocument config = ProjectSupport.loadConfig(context);
        DatabaseConnection connection = DatabaseConnection.fromConfig(config);
        if (!confirmDestructive(command, context, config, "reset database '" + connection.database() + "'")) {
            context.info("Operation cancelled");
            return;
        }
        DatabaseClient client = client(context, connection);
        client.drop();
        client.create();
        ProjectSupport.runTask(context, "migrate", List.of());
        context.success("Database '" + connection.database() + "' reset");
    }

    /**
     * Guards destructive operations: refused in production without {@code --force},
     * otherwise confirmed on standard input unless forced.
     */
    private static boolean confirmDestructive(CommandDescriptor command, CommandContext context,
                                              ConfigDocument config, String action) {
        if (command.booleanFlag("force")) {
            return true;
        }
        if (ProjectSupport.PRODUCTION.equals(ProjectSupport.environment(context, config))) {
            throw new RivetException("Refusing to " + action + " in production without --force");
        }
        return ProjectSupport.confirm(context, "Are you sure you want to " + action + "? Type 'yes' to continue:", "yes");
    }

    private static DatabaseClient client(CommandContext context, DatabaseConnection connection) {
        return new DatabaseClient(connection, context.processRunner(), context.requireProject());
    }
}
