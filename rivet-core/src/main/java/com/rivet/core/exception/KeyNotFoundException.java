package com.rivet.core.exception;

/**
 * Thrown when a dotted configuration key does not resolve to a value.
 */
public class KeyNotFoundException extends RivetException {

    private final String key;

    public KeyNotFoundException(String key) {
        super("Configuration key '" + key + "' not found");
        this.key = key;
    }

    public String key() {
        return key;
    }
}
