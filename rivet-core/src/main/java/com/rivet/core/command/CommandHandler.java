package com.rivet.core.command;

/**
 * Performs the work of one registered command.
 *
 * <p>Handlers report failure by throwing a {@link com.rivet.core.exception.RivetException};
 * returning normally means success.
 */
@FunctionalInterface
public interface CommandHandler {

    /**
     * Executes the command.
     *
     * @param command parsed command line
     * @param context working directory, output streams and process runner
     */
    void handle(CommandDescriptor command, CommandContext context);
}
