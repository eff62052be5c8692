package com.rivet.core.exception;

/**
 * Base type for every failure reported by the {@code rivet} tool.
 *
 * <p>Exceptions propagate unchanged to the CLI entry point, which prints the message
 * and exits with {@link #exitCode()}. Subclasses exist for each failure the user can
 * act on; generic I/O failures use this class directly with the {@link java.io.IOException}
 * as cause.
 */
public class RivetException extends RuntimeException {

    /** Exit code for handler failures. */
    public static final int EXIT_FAILURE = 1;

    /** Exit code for bad command-line input. */
    public static final int EXIT_USAGE = 2;

    private final int exitCode;

    public RivetException(String message) {
        this(message, null, EXIT_FAILURE);
    }

    public RivetException(String message, Throwable cause) {
        this(message, cause, EXIT_FAILURE);
    }

    protected RivetException(String message, Throwable cause, int exitCode) {
        super(message, cause);
        this.exitCode = exitCode;
    }

    /**
     * Returns the process exit code the CLI should terminate with.
     *
     * @return non-zero exit code
     */
    public int exitCode() {
        return exitCode;
    }
}
