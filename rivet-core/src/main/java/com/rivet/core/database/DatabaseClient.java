package com.rivet.core.database;

import com.rivet.core.exception.RivetException;
import com.rivet.core.process.ProcessInvocation;
import com.rivet.core.process.ProcessResult;
import com.rivet.core.process.ProcessRunner;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Creates, drops and probes the project database through the driver's command-line client
 * ({@code mysql}, {@code psql} or {@code sqlite3}).
 *
 * <p>Passwords travel in the client's environment variable ({@code MYSQL_PWD},
 * {@code PGPASSWORD}), never on the command line.
 */
public class DatabaseClient {

    private static final Logger log = LoggerFactory.getLogger(DatabaseClient.class);

    private final DatabaseConnection connection;
    private final ProcessRunner runner;
    private final Path projectRoot;

    public DatabaseClient(DatabaseConnection connection, ProcessRunner runner, Path projectRoot) {
        this.connection = Objects.requireNonNull(connection, "connection must not be null");
        this.runner = Objects.requireNonNull(runner, "runner must not be null");
        this.projectRoot = Objects.requireNonNull(projectRoot, "projectRoot must not be null");
    }

    public void create() {
        switch (connection.driver()) {
            case "mysql" -> runner.runOrFail(mysql("CREATE DATABASE IF NOT EXISTS `" + connection.database() + "`", false));
            case "postgres" -> runner.runOrFail(psql("CREATE DATABASE \"" + connection.database() + "\"", false));
            case "sqlite" -> runner.runOrFail(sqlite("VACUUM;"));
            default -> throw unsupported();
        }
        log.info("Created database {}", connection.database());
    }

    public void drop() {
        switch (connection.driver()) {
            case "mysql" -> runner.runOrFail(mysql("DROP DATABASE IF EXISTS `" + connection.database() + "`", false));
            case "postgres" -> runner.runOrFail(psql("DROP DATABASE IF EXISTS \"" + connection.database() + "\"", false));
            case "sqlite" -> deleteSqliteFile();
            default -> throw unsupported();
        }
        log.info("Dropped database {}", connection.database());
    }

    /**
     * Checks that the database accepts connections.
     *
     * @return the client's result; a non-zero exit code means the probe failed
     */
    public ProcessResult probe() {
        return switch (connection.driver()) {
            case "mysql" -> runner.run(mysql("SELECT 1", true));
            case "postgres" -> runner.run(psql("SELECT 1", true));
            case "sqlite" -> runner.run(sqlite("SELECT 1;"));
            default -> throw unsupported();
        };
    }

    ProcessInvocation mysql(String statement, boolean useDatabase) {
        List<String> command = new ArrayList<>(List.of(
            "mysql", "-h", connection.host(), "-P", connection.port(), "-u", connection.username()));
        if (useDatabase) {
            command.add(connection.database());
        }
        command.add("-e");
        command.add(statement);
        return ProcessInvocation.of(projectRoot, command).withEnvironment(password("MYSQL_PWD"));
    }

    ProcessInvocation psql(String statement, boolean useDatabase) {
        List<String> command = List.of(
            "psql", "-h", connection.host(), "-p", connection.port(), "-U", connection.username(),
            "-d", useDatabase ? connection.database() : "postgres", "-c", statement);
        return ProcessInvocation.of(projectRoot, command).withEnvironment(password("PGPASSWORD"));
    }

    ProcessInvocation sqlite(String statement) {
        return ProcessInvocation.of(projectRoot, "sqlite3", sqliteFile().toString(), statement);
    }

    private Path sqliteFile() {
        return projectRoot.resolve(connection.database());
    }

    private void deleteSqliteFile() {
        try {
            Files.deleteIfExists(sqliteFile());
        } catch (IOException e) {
            throw new RivetException("Failed to delete " + sqliteFile(), e);
        }
    }

    private Map<String, String> password(String variable) {
        return connection.password().isEmpty() ? Map.of() : Map.of(variable, connection.password());
    }

    private RivetException unsupported() {
        return new RivetException("Unsupported database driver '" + connection.driver()
            + "'. Supported drivers: mysql, postgres, sqlite");
    }
}
