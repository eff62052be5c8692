package com.rivet.core.command;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Parsed form of one command-line invocation.
 *
 * <p>Flags hold typed values ({@link Boolean}, {@link String} or {@link Integer}). Every
 * boolean flag of the matching definition is present, defaulting to false; value flags
 * are present only when given or defaulted.
 *
 * @param verb command verb
 * @param noun optional noun, or null
 * @param arguments positional arguments in order
 * @param flags flag name to typed value
 * @param helpRequested whether {@code --help} was given after the command
 */
public record CommandDescriptor(
    String verb,
    String noun,
    List<String> arguments,
    Map<String, Object> flags,
    boolean helpRequested
) {
    /**
     * Compact constructor with validation.
     */
    public CommandDescriptor {
        Objects.requireNonNull(verb, "verb must not be null");
        arguments = arguments == null ? List.of() : List.copyOf(arguments);
        flags = flags == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(flags));
    }

    /**
     * Returns the name as typed on the command line.
     *
     * @return {@code verb} or {@code verb:noun}
     */
    public String name() {
        return noun == null ? verb : verb + ":" + noun;
    }

    public Optional<String> argument(int index) {
        return index < arguments.size() ? Optional.of(arguments.get(index)) : Optional.empty();
    }

    /**
     * Returns a positional argument the parser has already guaranteed to be present.
     *
     * @param index argument position
     * @return argument value
     * @throws IllegalStateException if the argument is absent
     */
    public String requiredArgument(int index) {
        return argument(index)
            .orElseThrow(() -> new IllegalStateException("Argument " + index + " missing for " + name()));
    }

    public boolean booleanFlag(String name) {
        return Boolean.TRUE.equals(flags.get(name));
    }

    public Optional<String> stringFlag(String name) {
        Object value = flags.get(name);
        return value == null ? Optional.empty() : Optional.of(value.toString());
    }

    public Optional<Integer> intFlag(String name) {
        Object value = flags.get(name);
        return value instanceof Integer number ? Optional.of(number) : Optional.empty();
    }
}
