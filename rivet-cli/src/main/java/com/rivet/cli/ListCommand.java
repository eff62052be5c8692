package com.rivet.cli;

import com.rivet.core.command.CommandDefinition;
import com.rivet.core.command.CommandRegistry;
import com.rivet.core.command.CommandParser;

/**
 * Command to list every registered command.
 */
public class ListCommand implements CommandFamily {

    @Override
    public void register(CommandRegistry registry) {
        registry.register(CommandDefinition.builder("list")
            .description("List all available commands")
            .build(), (command, context) -> context.out().print(
                new CommandParser(registry, RivetCommands.PROGRAM_NAME).commandList()));
    }
}
