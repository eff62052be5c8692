package com.rivet.core.exception;

import java.nio.file.Path;

/**
 * Thrown when a generated file would replace an existing one and no overwrite was requested.
 */
public class TargetExistsException extends RivetException {

    private final Path target;

    public TargetExistsException(Path target) {
        super("File '" + target + "' already exists. Use --force to overwrite.");
        this.target = target;
    }

    public Path target() {
        return target;
    }
}
