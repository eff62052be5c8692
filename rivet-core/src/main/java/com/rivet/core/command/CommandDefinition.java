package com.rivet.core.command;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Declared shape of one {@code verb[:noun]} command: its positional parameters and flags.
 *
 * <p>Definitions drive both parsing and usage output. They are built once when the
 * command table is assembled:
 * <pre>{@code
 * CommandDefinition definition = CommandDefinition.builder("make", "model")
 *     .description("Create a new model class")
 *     .parameter(ParameterDefinition.required("name", "Model name"))
 *     .flag(FlagDefinition.bool("migration", "Also create a migration").withShortName("m"))
 *     .build();
 * }</pre>
 *
 * @param verb command verb (e.g. "make", "migrate")
 * @param noun optional noun after the colon (e.g. "controller"), or null
 * @param description one-line help text
 * @param parameters positional parameters in order
 * @param flags accepted flags
 */
public record CommandDefinition(
    String verb,
    String noun,
    String description,
    List<ParameterDefinition> parameters,
    List<FlagDefinition> flags
) {
    /**
     * Compact constructor with validation.
     */
    public CommandDefinition {
        Objects.requireNonNull(verb, "verb must not be null");
        parameters = parameters == null ? List.of() : List.copyOf(parameters);
        flags = flags == null ? List.of() : List.copyOf(flags);
        if (description == null) {
            description = "";
        }
        boolean optionalSeen = false;
        for (int i = 0; i < parameters.size(); i++) {
            ParameterDefinition parameter = parameters.get(i);
            if (parameter.variadic() && i != parameters.size() - 1) {
                throw new IllegalArgumentException("Only the last parameter may be variadic: " + parameter.name());
            }
            if (parameter.required() && optionalSeen) {
                throw new IllegalArgumentException("Required parameter follows an optional one: " + parameter.name());
            }
            optionalSeen |= !parameter.required();
        }
    }

    /**
     * Returns the name as typed on the command line ({@code verb} or {@code verb:noun}).
     *
     * @return command name
     */
    public String name() {
        return noun == null ? verb : verb + ":" + noun;
    }

    public Optional<FlagDefinition> flag(String longName) {
        return flags.stream().filter(flag -> flag.name().equals(longName)).findFirst();
    }

    public Optional<FlagDefinition> flagByShortName(String shortName) {
        return flags.stream().filter(flag -> shortName.equals(flag.shortName())).findFirst();
    }

    public static Builder builder(String verb) {
        return new Builder(verb, null);
    }

    public static Builder builder(String verb, String noun) {
        return new Builder(verb, noun);
    }

    /**
     * Fluent builder for {@link CommandDefinition}.
     */
    public static final class Builder {
        private final String verb;
        private final String noun;
        private String description = "";
        private final List<ParameterDefinition> parameters = new ArrayList<>();
        private final List<FlagDefinition> flags = new ArrayList<>();

        private Builder(String verb, String noun) {
            this.verb = verb;
            this.noun = noun;
        }

        public Builder description(String description) {
            this.description = description;
            return this;
        }

        public Builder parameter(ParameterDefinition parameter) {
            parameters.add(parameter);
            return this;
        }

        public Builder flag(FlagDefinition flag) {
            flags.add(flag);
            return this;
        }

        public CommandDefinition build() {
            return new CommandDefinition(verb, noun, description, parameters, flags);
        }
    }
}
