package com.rivet.core.layout;

import java.util.Arrays;
import java.util.Locale;
import java.util.Optional;

/**
 * The closed set of components Rivet can generate, each with the sub-package it lives in.
 */
public enum ComponentKind {
    CONTROLLER("controller", "http.controllers"),
    MODEL("model", "models"),
    MIDDLEWARE("middleware", "http.middleware"),
    REQUEST("request", "http.requests"),
    RESOURCE("resource", "http.resources"),
    SEEDER("seeder", "database.seeders"),
    FACTORY("factory", "database.factories"),
    JOB("job", "jobs"),
    EVENT("event", "events"),
    LISTENER("listener", "listeners"),
    MIGRATION("migration", null),
    COMMAND("command", "console.commands"),
    POLICY("policy", "policies"),
    TEST("test", null);

    private final String id;
    private final String subPackage;

    ComponentKind(String id, String subPackage) {
        this.id = id;
        this.subPackage = subPackage;
    }

    /**
     * Returns the noun used on the command line ({@code make:<id>}).
     *
     * @return kind identifier
     */
    public String id() {
        return id;
    }

    /**
     * Returns the package below the base package, or null for kinds that are not
     * placed by package (migrations, tests).
     *
     * @return relative package name
     */
    public String subPackage() {
        return subPackage;
    }

    public static Optional<ComponentKind> fromId(String id) {
        if (id == null) {
            return Optional.empty();
        }
        String normalized = id.toLowerCase(Locale.ROOT);
        return Arrays.stream(values()).filter(kind -> kind.id.equals(normalized)).findFirst();
    }
}
