package com.rivet.core.exception;

/**
 * Thrown when no handler is registered for a {@code verb[:noun]} pair.
 */
public class UnknownCommandException extends RivetException {

    private final String command;

    public UnknownCommandException(String command) {
        super("Command \"" + command + "\" is not defined. Run 'rivet list' to see available commands.",
            null, EXIT_USAGE);
        this.command = command;
    }

    public String command() {
        return command;
    }
}
