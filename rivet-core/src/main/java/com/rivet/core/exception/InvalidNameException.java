package com.rivet.core.exception;

/**
 * Thrown when a component or project name is not acceptable.
 */
public class InvalidNameException extends RivetException {

    public InvalidNameException(String name) {
        this(name, "names must start with a letter or underscore and contain only letters, digits and underscores");
    }

    public InvalidNameException(String name, String rule) {
        super("Invalid name '" + name + "': " + rule);
    }
}
