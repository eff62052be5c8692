package com.rivet.core.generator;

import java.util.Objects;

/**
 * A named, versioned component template on the classpath.
 *
 * @param name template name, e.g. {@code controller_api}
 * @param version template revision, bumped when generated output changes shape
 */
public record ComponentTemplate(String name, int version) {

    public static final int CURRENT_VERSION = 1;

    /**
     * Compact constructor with validation.
     */
    public ComponentTemplate {
        Objects.requireNonNull(name, "name must not be null");
        if (version < 1) {
            throw new IllegalArgumentException("version must be positive");
        }
    }

    public static ComponentTemplate named(String name) {
        return new ComponentTemplate(name, CURRENT_VERSION);
    }

    /**
     * Returns the template path relative to the template root.
     *
     * @return e.g. {@code components/controller_api.ftl}
     */
    public String path() {
        return "components/" + name + ".ftl";
    }
}
