package com.rivet.core.database;

import com.rivet.core.config.ConfigDocument;
import com.rivet.core.exception.RivetException;

import java.util.Objects;

/**
 * The default database connection from {@code rivet.yaml}.
 *
 * @param driver {@code mysql}, {@code postgres} or {@code sqlite}
 * @param host server host
 * @param port server port
 * @param database database name, or file path for sqlite
 * @param username user name
 * @param password password, may be empty
 */
public record DatabaseConnection(
    String driver,
    String host,
    String port,
    String database,
    String username,
    String password
) {
    static final String PREFIX = "database.connections.default.";

    /**
     * Compact constructor with validation.
     */
    public DatabaseConnection {
        Objects.requireNonNull(driver, "driver must not be null");
        Objects.requireNonNull(database, "database must not be null");
        password = password == null ? "" : password;
    }

    /**
     * Reads the default connection.
     *
     * @param config project configuration
     * @return the connection
     * @throws RivetException if the driver or database name is not configured
     */
    public static DatabaseConnection fromConfig(ConfigDocument config) {
        String driver = config.getString(PREFIX + "driver")
            .orElseThrow(() -> new RivetException("Database driver not configured in rivet.yaml"));
        String database = config.getString(PREFIX + "database")
            .orElseThrow(() -> new RivetException("Database name not configured in rivet.yaml"));
        String defaultPort = "postgres".equals(driver) ? "5432" : "3306";
        return new DatabaseConnection(
            driver,
            config.getString(PREFIX + "host").orElse("localhost"),
            config.getString(PREFIX + "port").orElse(defaultPort),
            database,
            config.getString(PREFIX + "username").orElse("postgres".equals(driver) ? "postgres" : "root"),
            config.getString(PREFIX + "password").orElse("")
        );
    }
}
