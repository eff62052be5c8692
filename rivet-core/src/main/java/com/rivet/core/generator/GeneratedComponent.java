package com.rivet.core.generator;

import com.rivet.core.layout.ComponentKind;

import java.nio.file.Path;
import java.util.Objects;

/**
 * A file written by the generator.
 *
 * @param kind component kind
 * @param name component name (class name, or snake name for migrations)
 * @param path absolute path of the written file
 * @param overwritten whether an existing file was replaced
 */
public record GeneratedComponent(
    ComponentKind kind,
    String name,
    Path path,
    boolean overwritten
) {
    /**
     * Compact constructor with validation.
     */
    public GeneratedComponent {
        Objects.requireNonNull(kind, "kind must not be null");
        Objects.requireNonNull(name, "name must not be null");
        Objects.requireNonNull(path, "path must not be null");
    }
}
