package com.rivet.core.exception;

/**
 * Thrown when a dotted key walks through a value that is not a mapping.
 */
public class TypeConflictException extends RivetException {

    public TypeConflictException(String key, String segmentPath) {
        super("Cannot set '" + key + "': '" + segmentPath + "' is a value, not a section");
    }
}
