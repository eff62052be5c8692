package com.rivet.cli;

import com.rivet.core.command.CommandContext;
import com.rivet.core.command.CommandDefinition;
import com.rivet.core.command.CommandDescriptor;
import com.rivet.core.command.CommandRegistry;
import com.rivet.core.command.FlagDefinition;
import com.rivet.core.command.ParameterDefinition;
import com.rivet.core.config.ConfigDocument;
import com.rivet.core.exception.ParseException;

import java.util.ArrayList;
import java.util.List;

/**
 * Command to run the application's tests through Maven.
 *
 * <p>Unit tests run under Surefire ({@code mvn test}); integration tests, tagged
 * {@code integration}, run under Failsafe ({@code mvn verify}).
 */
public class TestCommand implements CommandFamily {

    @Override
    public void register(CommandRegistry registry) {
        registry.register(CommandDefinition.builder("test")
            .description("Run the application tests")
            .parameter(ParameterDefinition.optional("name", "Test class or method filter"))
            .flag(FlagDefinition.bool("unit", "Run unit tests only").withShortName("u"))
            .flag(FlagDefinition.bool("integration", "Run integration tests only").withShortName("i"))
            .build(), this::handle);
    }

    private void handle(CommandDescriptor command, CommandContext context) {
        ConfigDocument config = ProjectSupport.loadConfig(context);
        List<String> goals = goals(command);
        context.info("Running " + scope(command) + " tests...");
        context.processRunner().runOrFail(ProjectSupport.maven(context, config).goals(goals).inheritingIo());
        context.success("Tests completed successfully");
    }

    static List<String> goals(CommandDescriptor command) {
        boolean unit = command.booleanFlag("unit");
        boolean integration = command.booleanFlag("integration");
        if (unit && integration) {
            throw new ParseException("--unit and --integration cannot be combined");
        }

        List<String> goals = new ArrayList<>();
        if (integration) {
            goals.add("verify");
            goals.add("-DskipTests=false");
            goals.add("-Dsurefire.skip=true");
        } else {
            goals.add(unit ? "test" : "verify");
        }
        command.argument(0).ifPresent(filter -> {
            goals.add((integration ? "-Dit.test=" : "-Dtest=") + filter);
            goals.add("-Dsurefire.failIfNoSpecifiedTests=false");
            if (integration) {
                goals.add("-Dfailsafe.failIfNoSpecifiedTests=false");
            }
        });
        return goals;
    }

    private static String scope(CommandDescriptor command) {
        if (command.booleanFlag("unit")) {
            return "unit";
        }
        return command.booleanFlag("integration") ? "integration" : "all";
    }
}
