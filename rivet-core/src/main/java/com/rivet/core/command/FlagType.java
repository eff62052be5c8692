package com.rivet.core.command;

/**
 * Value types a command flag can carry.
 */
public enum FlagType {
    /** Switch; present means true, an explicit {@code true}/{@code false} may follow */
    BOOLEAN,

    /** Free-form text value */
    STRING,

    /** Whole number value */
    INTEGER
}
