package com.rivet.core.exception;

import java.nio.file.Path;

/**
 * Thrown when a project would be scaffolded into a directory that already has content.
 */
public class DestinationNotEmptyException extends RivetException {

    public DestinationNotEmptyException(Path destination) {
        super("Directory '" + destination + "' already exists and is not empty");
    }
}
