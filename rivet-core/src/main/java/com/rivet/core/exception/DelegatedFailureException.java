package com.rivet.core.exception;

import java.util.List;

/**
 * Thrown when an external tool (Maven, git, a database client, docker...) fails.
 *
 * <p>The message carries the command line and whatever the tool wrote to stderr.
 */
public class DelegatedFailureException extends RivetException {

    private final List<String> command;
    private final int toolExitCode;

    public DelegatedFailureException(List<String> command, int toolExitCode, String detail) {
        super(describe(command, toolExitCode, detail));
        this.command = List.copyOf(command);
        this.toolExitCode = toolExitCode;
    }

    public DelegatedFailureException(List<String> command, Throwable cause) {
        super("Failed to run '" + String.join(" ", command) + "': " + cause.getMessage(), cause);
        this.command = List.copyOf(command);
        this.toolExitCode = -1;
    }

    public List<String> command() {
        return command;
    }

    /**
     * Returns the exit code reported by the external tool, or -1 if it never started.
     *
     * @return tool exit code
     */
    public int toolExitCode() {
        return toolExitCode;
    }

    private static String describe(List<String> command, int exitCode, String detail) {
        StringBuilder message = new StringBuilder("Command '")
            .append(String.join(" ", command))
            .append("' failed with exit code ")
            .append(exitCode);
        if (detail != null && !detail.isBlank()) {
            message.append(": ").append(detail.strip());
        }
        return message.toString();
    }
}
