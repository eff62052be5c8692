package com.rivet.core.command;

import java.util.Objects;

/**
 * Declared positional parameter of a command.
 *
 * @param name parameter name shown in usage (e.g. "name", "key")
 * @param required whether the parameter must be supplied
 * @param variadic whether the parameter absorbs every remaining positional argument
 * @param description help text
 */
public record ParameterDefinition(
    String name,
    boolean required,
    boolean variadic,
    String description
) {
    /**
     * Compact constructor with validation.
     */
    public ParameterDefinition {
        Objects.requireNonNull(name, "name must not be null");
        if (description == null) {
            description = "";
        }
    }

    public static ParameterDefinition required(String name, String description) {
        return new ParameterDefinition(name, true, false, description);
    }

    public static ParameterDefinition optional(String name, String description) {
        return new ParameterDefinition(name, false, false, description);
    }

    public static ParameterDefinition variadic(String name, String description) {
        return new ParameterDefinition(name, false, true, description);
    }
}
