package com.rivet.core.scaffold;

import java.nio.file.Path;
import java.util.List;

/**
 * What a scaffold run produced.
 *
 * @param root project directory
 * @param template template used
 * @param basePackage base Java package of the project
 * @param files files written, relative to the root
 * @param gitInitialized whether a git repository was created
 */
public record ScaffoldResult(
    Path root,
    String template,
    String basePackage,
    List<Path> files,
    boolean gitInitialized
) {
    /**
     * Compact constructor with validation.
     */
    public ScaffoldResult {
        files = files == null ? List.of() : List.copyOf(files);
    }
}
