package com.rivet.core.config;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.rivet.core.exception.RivetException;
import com.rivet.core.util.TextCase;

import java.io.IOException;
import java.io.InputStream;

/**
 * Builds the default {@code rivet.yaml} for a new project or a reset.
 */
public final class ConfigDefaults {

    private static final String RESOURCE = "/defaults/rivet.yaml";

    private ConfigDefaults() {
        // Utility class
    }

    /**
     * Creates the default document for an application.
     *
     * @param appName application name
     * @param basePackage base Java package
     * @return new document
     */
    public static ConfigDocument create(String appName, String basePackage) {
        ConfigDocument document = new ConfigDocument(loadTemplate());
        String snake = TextCase.snake(appName);
        document.set("app.name", appName);
        document.set("app.package", basePackage);
        document.set("database.connections.default.database", snake);
        document.set("session.cookie_name", snake + "_session");
        return document;
    }

    private static ObjectNode loadTemplate() {
        try (InputStream in = ConfigDefaults.class.getResourceAsStream(RESOURCE)) {
            if (in == null) {
                throw new RivetException("Missing bundled resource " + RESOURCE);
            }
            JsonNode tree = ConfigStore.YAML_MAPPER.readTree(in);
            return (ObjectNode) tree;
        } catch (IOException e) {
            throw new RivetException("Failed to read bundled resource " + RESOURCE, e);
        }
    }
}
