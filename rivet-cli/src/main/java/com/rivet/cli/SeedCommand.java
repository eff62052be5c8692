package com.rivet.cli;

import com.rivet.core.command.CommandContext;
import com.rivet.core.command.CommandDefinition;
import com.rivet.core.command.CommandDescriptor;
import com.rivet.core.command.CommandRegistry;
import com.rivet.core.command.FlagDefinition;
import com.rivet.core.config.ConfigDocument;
import com.rivet.core.exception.RivetException;

import java.util.List;

/**
 * Command to run a database seeder through the console kernel.
 */
public class SeedCommand implements CommandFamily {

    static final String DEFAULT_SEEDER = "DatabaseSeeder";

    @Override
    public void register(CommandRegistry registry) {
        registry.register(CommandDefinition.builder("seed")
            .description("Seed the database with records")
            .flag(FlagDefinition.string("class", "Seeder class to run").withShortName("c").withDefault(DEFAULT_SEEDER))
            .flag(FlagDefinition.bool("force", "Allow seeding in production"))
            .build(), this::handle);
    }

    private void handle(CommandDescriptor command, CommandContext context) {
        ConfigDocument config = ProjectSupport.loadConfig(context);
        if (ProjectSupport.PRODUCTION.equals(ProjectSupport.environment(context, config))
            && !command.booleanFlag("force")) {
            throw new RivetException("Refusing to seed in production without --force");
        }
        String seeder = command.stringFlag("class").orElse(DEFAULT_SEEDER);
        context.info("Seeding database with " + seeder + "...");
        ProjectSupport.runTask(context, "seed", List.of("--class", seeder));
        context.success("Database seeded");
    }
}
