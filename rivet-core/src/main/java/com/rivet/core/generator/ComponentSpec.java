package com.rivet.core.generator;

import com.rivet.core.layout.ComponentKind;

import java.util.EnumSet;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Request to generate one component.
 *
 * @param kind component kind
 * @param name target name as given by the user
 * @param modifiers enabled modifiers
 * @param options string options ({@link #MODEL}, {@link #EVENT}, {@link #CREATE}, {@link #TABLE})
 * @param overwrite whether existing files may be replaced
 */
public record ComponentSpec(
    ComponentKind kind,
    String name,
    Set<Modifier> modifiers,
    Map<String, String> options,
    boolean overwrite
) {
    public static final String MODEL = "model";
    public static final String EVENT = "event";
    public static final String CREATE = "create";
    public static final String TABLE = "table";

    /**
     * Compact constructor with validation.
     */
    public ComponentSpec {
        Objects.requireNonNull(kind, "kind must not be null");
        Objects.requireNonNull(name, "name must not be null");
        modifiers = modifiers == null || modifiers.isEmpty()
            ? Set.of()
            : Set.copyOf(EnumSet.copyOf(modifiers));
        options = options == null ? Map.of() : Map.copyOf(options);
    }

    /**
     * Creates a spec with no modifiers or options.
     *
     * @param kind component kind
     * @param name target name
     * @return new spec
     */
    public static ComponentSpec of(ComponentKind kind, String name) {
        return new ComponentSpec(kind, name, Set.of(), Map.of(), false);
    }

    public boolean has(Modifier modifier) {
        return modifiers.contains(modifier);
    }

    public Optional<String> option(String key) {
        String value = options.get(key);
        return value == null || value.isBlank() ? Optional.empty() : Optional.of(value);
    }
}
