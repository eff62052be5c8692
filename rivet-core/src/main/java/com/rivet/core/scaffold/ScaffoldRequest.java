package com.rivet.core.scaffold;

import java.nio.file.Path;
import java.util.Objects;

/**
 * Parameters for creating a new project.
 *
 * @param name project name, also the directory name
 * @param template built-in template name or path to a local template directory, null for default
 * @param parentDirectory directory the project directory is created in
 * @param basePackage base Java package, null to derive {@code com.example.<name>}
 * @param git whether to initialise a git repository
 */
public record ScaffoldRequest(
    String name,
    String template,
    Path parentDirectory,
    String basePackage,
    boolean git
) {
    /**
     * Compact constructor with validation.
     */
    public ScaffoldRequest {
        Objects.requireNonNull(name, "name must not be null");
        Objects.requireNonNull(parentDirectory, "parentDirectory must not be null");
    }

    public Path targetDirectory() {
        return parentDirectory.resolve(name);
    }
}
