package com.rivet.cli;

import com.rivet.core.command.CommandDispatcher;
import com.rivet.core.command.CommandRegistry;
import com.rivet.core.deploy.HealthCheck;
import com.rivet.core.deploy.HttpHealthCheck;

import java.util.List;

/**
 * Assembles the full {@code rivet} command table.
 */
public final class RivetCommands {

    public static final String PROGRAM_NAME = "rivet";
    public static final String VERSION = "0.1.0";

    private RivetCommands() {
        // Utility class
    }

    public static CommandDispatcher dispatcher() {
        return dispatcher(new HttpHealthCheck());
    }

    /**
     * Builds a dispatcher with every command family registered.
     *
     * @param healthCheck health check used after deployments
     * @return dispatcher
     */
    public static CommandDispatcher dispatcher(HealthCheck healthCheck) {
        CommandRegistry registry = new CommandRegistry();
        List<CommandFamily> families = List.of(
            new NewCommand(),
            new ServeCommand(),
            new MakeCommand(),
            new DbCommand(),
            new MigrateCommand(),
            new SeedCommand(),
            new CacheCommand(),
            new RouteCommand(),
            new QueueCommand(),
            new ConfigCommand(),
            new TestCommand(),
            new BuildCommand(),
            new DeployCommand(healthCheck),
            new InfoCommand(),
            new ListCommand()
        );
        families.forEach(family -> family.register(registry));
        return new CommandDispatcher(registry, PROGRAM_NAME);
    }
}
