package com.rivet.core.config;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Checks a configuration for missing keys and unsafe or unsupported values.
 */
public class ConfigValidator {

    static final List<String> REQUIRED_KEYS = List.of(
        "app.name",
        "app.env",
        "app.key",
        "database.default",
        "database.connections.default.driver",
        "database.connections.default.host",
        "database.connections.default.database"
    );

    static final Set<String> DRIVERS = Set.of("mysql", "postgres", "sqlite");
    static final Set<String> ENVIRONMENTS = Set.of("development", "testing", "production");

    public ValidationReport validate(ConfigDocument config) {
        List<String> errors = new ArrayList<>();
        List<String> warnings = new ArrayList<>();

        for (String key : REQUIRED_KEYS) {
            Optional<JsonNode> value = config.find(key);
            if (value.isEmpty()) {
                errors.add("Required key '" + key + "' is missing");
            } else if (value.get().isValueNode() && value.get().asText().isEmpty()) {
                warnings.add("'" + key + "' is empty");
            }
        }

        config.getString("app.key").filter(key -> !key.isEmpty()).ifPresent(key -> {
            if (!key.startsWith(AppKeyGenerator.PREFIX)) {
                warnings.add("app.key should start with 'base64:' for proper encoding");
            }
            if (key.length() < 32) {
                warnings.add("app.key appears to be too short for security");
            }
        });

        config.getString("database.connections.default.driver")
            .filter(driver -> !DRIVERS.contains(driver))
            .ifPresent(driver -> warnings.add("Unsupported database driver: " + driver));

        Optional<String> env = config.getString("app.env");
        env.filter(value -> !ENVIRONMENTS.contains(value))
            .ifPresent(value -> warnings.add("Unknown environment: " + value));
        if (env.filter("production"::equals).isPresent()) {
            config.find("app.debug")
                .filter(JsonNode::asBoolean)
                .ifPresent(debug -> errors.add("app.debug should be false in production"));
            config.getString("logging.level")
                .filter(level -> level.equals("debug") || level.equals("trace"))
                .ifPresent(level -> warnings.add("Consider using 'info' or 'warn' log level in production"));
        }

        config.find("server.port").filter(JsonNode::isIntegralNumber).ifPresent(port -> {
            long value = port.asLong();
            if (value < 1 || value > 65535) {
                errors.add("server.port must be between 1 and 65535");
            }
        });

        return new ValidationReport(errors, warnings);
    }
}
