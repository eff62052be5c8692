package com.rivet.core.command;

import java.util.Objects;

/**
 * Declared shape of a named flag such as {@code --resource} or {@code --steps 3}.
 *
 * @param name long name without leading dashes (e.g. "max-jobs")
 * @param shortName optional single-letter alias without the dash, or null
 * @param type value type
 * @param defaultValue value used when the flag is absent; booleans default to false
 * @param description help text
 */
public record FlagDefinition(
    String name,
    String shortName,
    FlagType type,
    Object defaultValue,
    String description
) {
    /**
     * Compact constructor with validation.
     */
    public FlagDefinition {
        Objects.requireNonNull(name, "name must not be null");
        Objects.requireNonNull(type, "type must not be null");
        if (name.isBlank() || name.startsWith("-")) {
            throw new IllegalArgumentException("Flag name must be non-blank and given without dashes: " + name);
        }
        if (type == FlagType.BOOLEAN && defaultValue == null) {
            defaultValue = Boolean.FALSE;
        }
        if (description == null) {
            description = "";
        }
    }

    public static FlagDefinition bool(String name, String description) {
        return new FlagDefinition(name, null, FlagType.BOOLEAN, Boolean.FALSE, description);
    }

    public static FlagDefinition string(String name, String description) {
        return new FlagDefinition(name, null, FlagType.STRING, null, description);
    }

    public static FlagDefinition integer(String name, String description) {
        return new FlagDefinition(name, null, FlagType.INTEGER, null, description);
    }

    /**
     * Returns a copy of this flag with a single-letter alias.
     *
     * @param alias alias without the dash
     * @return flag definition with the alias
     */
    public FlagDefinition withShortName(String alias) {
        return new FlagDefinition(name, alias, type, defaultValue, description);
    }

    /**
     * Returns a copy of this flag with a default value.
     *
     * @param value default value, matching {@link #type()}
     * @return flag definition with the default
     */
    public FlagDefinition withDefault(Object value) {
        return new FlagDefinition(name, shortName, type, value, description);
    }
}
