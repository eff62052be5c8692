package com.rivet.core.command;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Table from {@code verb[:noun]} to the command's definition and handler.
 *
 * <p>Registration order is kept for listings.
 */
public class CommandRegistry {

    private final Map<String, Entry> entries = new LinkedHashMap<>();

    /**
     * A registered command.
     *
     * @param definition declared shape
     * @param handler handler invoked on dispatch
     */
    public record Entry(CommandDefinition definition, CommandHandler handler) {
        public Entry {
            Objects.requireNonNull(definition, "definition must not be null");
            Objects.requireNonNull(handler, "handler must not be null");
        }
    }

    /**
     * Registers a command.
     *
     * @param definition declared shape
     * @param handler handler to invoke
     * @return this registry
     * @throws IllegalArgumentException if the name is already registered
     */
    public CommandRegistry register(CommandDefinition definition, CommandHandler handler) {
        Entry entry = new Entry(definition, handler);
        if (entries.putIfAbsent(definition.name(), entry) != null) {
            throw new IllegalArgumentException("Command already registered: " + definition.name());
        }
        return this;
    }

    public Optional<Entry> lookup(String verb, String noun) {
        return Optional.ofNullable(entries.get(noun == null ? verb : verb + ":" + noun));
    }

    public Collection<Entry> entries() {
        return Collections.unmodifiableCollection(entries.values());
    }
}
