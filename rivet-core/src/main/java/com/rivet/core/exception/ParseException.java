package com.rivet.core.exception;

/**
 * Thrown when command-line tokens cannot be turned into a command descriptor:
 * malformed or unknown flags, wrong value types, missing or surplus arguments.
 */
public class ParseException extends RivetException {

    public ParseException(String message) {
        super(message, null, EXIT_USAGE);
    }
}
