package com.rivet.core.command;

import com.rivet.core.exception.NotInProjectException;
import com.rivet.core.layout.ProjectLayout;
import com.rivet.core.process.ProcessRunner;

import java.io.InputStream;
import java.io.PrintStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Everything a handler may touch: working directory, terminal streams, environment,
 * clock and the runner for external tools.
 *
 * <p>Handlers never reach for {@link System#out} or {@link System#getenv()} directly, so
 * tests can run them against a temp directory and captured streams.
 *
 * @param workingDirectory directory the command runs in (the project root for project commands)
 * @param out standard output
 * @param err standard error
 * @param in standard input, for confirmations
 * @param processRunner runner for delegated tools
 * @param environment environment variables
 * @param clock clock for timestamps
 */
public record CommandContext(
    Path workingDirectory,
    PrintStream out,
    PrintStream err,
    InputStream in,
    ProcessRunner processRunner,
    Map<String, String> environment,
    Clock clock
) {
    /**
     * Compact constructor with validation.
     */
    public CommandContext {
        Objects.requireNonNull(workingDirectory, "workingDirectory must not be null");
        Objects.requireNonNull(out, "out must not be null");
        Objects.requireNonNull(err, "err must not be null");
        Objects.requireNonNull(in, "in must not be null");
        Objects.requireNonNull(processRunner, "processRunner must not be null");
        environment = environment == null ? Map.of() : Map.copyOf(environment);
        if (clock == null) {
            clock = Clock.systemDefaultZone();
        }
    }

    /**
     * Returns whether the working directory is a Rivet project.
     *
     * @return true if both {@code pom.xml} and {@code rivet.yaml} are present
     */
    public boolean isProject() {
        return Files.isRegularFile(workingDirectory.resolve(ProjectLayout.BUILD_FILE))
            && Files.isRegularFile(workingDirectory.resolve(ProjectLayout.CONFIG_FILE));
    }

    /**
     * Returns the project root, failing when not inside a project.
     *
     * @return project root
     * @throws NotInProjectException if the working directory is not a Rivet project
     */
    public Path requireProject() {
        if (!isProject()) {
            throw new NotInProjectException(workingDirectory);
        }
        return workingDirectory;
    }

    public Optional<String> env(String name) {
        return Optional.ofNullable(environment.get(name));
    }

    public void success(String message) {
        out.println("✓ " + message);
    }

    public void info(String message) {
        out.println("ℹ " + message);
    }

    public void warning(String message) {
        out.println("⚠ " + message);
    }

    public void error(String message) {
        err.println("✗ " + message);
    }
}
