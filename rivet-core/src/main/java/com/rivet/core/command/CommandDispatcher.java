package com.rivet.core.command;

import com.rivet.core.exception.UnknownCommandException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Objects;

/**
 * Routes parsed commands to their registered handlers.
 *
 * <p>Dispatch is a lookup from {@code (verb, noun)} to handler; the dispatcher itself does
 * no I/O beyond argument validation and printing usage when asked for it. Failures from
 * parsing or handlers propagate to the caller unchanged.
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * CommandDispatcher dispatcher = new CommandDispatcher(registry, "rivet");
 * dispatcher.execute(List.of("make:model", "User", "--migration"), context);
 * }</pre>
 */
public class CommandDispatcher {

    private static final Logger log = LoggerFactory.getLogger(CommandDispatcher.class);

    private final CommandRegistry registry;
    private final CommandParser parser;

    public CommandDispatcher(CommandRegistry registry, String programName) {
        this.registry = Objects.requireNonNull(registry, "registry must not be null");
        this.parser = new CommandParser(registry, programName);
    }

    /**
     * Parses and dispatches one invocation. With no tokens, prints the command list.
     *
     * @param tokens command-line tokens after the program name
     * @param context execution context
     */
    public void execute(List<String> tokens, CommandContext context) {
        if (tokens == null || tokens.isEmpty()) {
            context.out().print(parser.commandList());
            return;
        }
        dispatch(parser.parse(tokens), context);
    }

    /**
     * Invokes the handler registered for a parsed command.
     *
     * @param command parsed command
     * @param context execution context
     * @throws UnknownCommandException if no handler is registered for the command
     */
    public void dispatch(CommandDescriptor command, CommandContext context) {
        CommandRegistry.Entry entry = registry.lookup(command.verb(), command.noun())
            .orElseThrow(() -> new UnknownCommandException(command.name()));

        if (command.helpRequested()) {
            context.out().print(parser.commandUsage(entry.definition()));
            return;
        }

        log.debug("Dispatching {} with arguments {} and flags {}", command.name(), command.arguments(), command.flags());
        entry.handler().handle(command, context);
    }

    public CommandRegistry registry() {
        return registry;
    }
}
