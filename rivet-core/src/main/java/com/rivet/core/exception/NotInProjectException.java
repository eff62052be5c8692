package com.rivet.core.exception;

import java.nio.file.Path;

/**
 * Thrown when a project command runs outside a Rivet project directory.
 */
public class NotInProjectException extends RivetException {

    public NotInProjectException(Path directory) {
        super("This command must be run from within a Rivet project directory (no pom.xml and rivet.yaml in "
            + directory + ")");
    }
}
