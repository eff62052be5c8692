package com.rivet.core.process;

import java.nio.file.Path;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * An external command to run, with its working directory and extra environment.
 *
 * @param command program and arguments
 * @param workingDirectory directory to run in
 * @param environment variables added to the inherited environment
 * @param inheritIo whether the child writes straight to this process's terminal
 */
public record ProcessInvocation(
    List<String> command,
    Path workingDirectory,
    Map<String, String> environment,
    boolean inheritIo
) {
    /**
     * Compact constructor with validation.
     */
    public ProcessInvocation {
        Objects.requireNonNull(command, "command must not be null");
        Objects.requireNonNull(workingDirectory, "workingDirectory must not be null");
        if (command.isEmpty()) {
            throw new IllegalArgumentException("command must not be empty");
        }
        command = List.copyOf(command);
        environment = environment == null ? Map.of() : Map.copyOf(environment);
    }

    public static ProcessInvocation of(Path workingDirectory, String... command) {
        return new ProcessInvocation(Arrays.asList(command), workingDirectory, Map.of(), false);
    }

    public static ProcessInvocation of(Path workingDirectory, List<String> command) {
        return new ProcessInvocation(command, workingDirectory, Map.of(), false);
    }

    /**
     * Returns a copy with additional environment variables.
     *
     * @param variables variables to add
     * @return new invocation
     */
    public ProcessInvocation withEnvironment(Map<String, String> variables) {
        Map<String, String> merged = new LinkedHashMap<>(environment);
        merged.putAll(variables);
        return new ProcessInvocation(command, workingDirectory, merged, inheritIo);
    }

    /**
     * Returns a copy whose output goes straight to the terminal.
     *
     * @return new invocation
     */
    public ProcessInvocation inheritingIo() {
        return new ProcessInvocation(command, workingDirectory, environment, true);
    }

    /**
     * Returns the command line as a single display string.
     *
     * @return space-joined command
     */
    public String commandLine() {
        return String.join(" ", command);
    }
}
