package com.rivet.core.exception;

import java.util.List;

/**
 * Thrown by {@code config:validate} when the configuration has errors.
 */
public class ConfigValidationException extends RivetException {

    private final List<String> errors;

    public ConfigValidationException(List<String> errors) {
        super("Configuration validation failed with " + errors.size() + " error(s)");
        this.errors = List.copyOf(errors);
    }

    public List<String> errors() {
        return errors;
    }
}
