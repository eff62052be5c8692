package com.rivet.core.command;

import com.rivet.core.exception.ParseException;
import com.rivet.core.exception.UnknownCommandException;
import picocli.CommandLine;
import picocli.CommandLine.Help;
import picocli.CommandLine.Model.ArgSpec;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Model.OptionSpec;
import picocli.CommandLine.Model.PositionalParamSpec;
import picocli.CommandLine.ParameterException;
import picocli.CommandLine.ParseResult;
import picocli.CommandLine.UnmatchedArgumentException;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Turns raw command-line tokens into a {@link CommandDescriptor}.
 *
 * <p>Every registered {@link CommandDefinition} becomes a picocli subcommand built with the
 * programmatic model ({@link CommandSpec}, {@link OptionSpec}, {@link PositionalParamSpec}),
 * named as typed ({@code migrate} or {@code make:model}). picocli does the parsing and
 * renders usage help; this class maps its {@link ParseResult} back to a descriptor and its
 * {@link ParameterException}s to Rivet's exceptions.
 *
 * <p><b>Accepted flag forms:</b>
 * <ul>
 *   <li>{@code --resource}, {@code -r} - boolean switch</li>
 *   <li>{@code --git=false}, {@code --git false} - boolean with explicit value</li>
 *   <li>{@code --steps 3}, {@code --steps=3}, {@code -s 3} - valued flag</li>
 *   <li>{@code --} - everything after is positional</li>
 *   <li>{@code --help}, {@code -h} - request command usage</li>
 * </ul>
 */
public class CommandParser {

    private final CommandRegistry registry;
    private final String programName;

    public CommandParser(CommandRegistry registry, String programName) {
        this.registry = Objects.requireNonNull(registry, "registry must not be null");
        this.programName = Objects.requireNonNull(programName, "programName must not be null");
    }

    /**
     * Parses one invocation.
     *
     * @param tokens command-line tokens after the program name
     * @return parsed descriptor
     * @throws ParseException if the tokens do not fit the command's definition
     * @throws UnknownCommandException if no command is registered under the name
     */
    public CommandDescriptor parse(List<String> tokens) {
        if (tokens == null || tokens.isEmpty()) {
            throw new ParseException("No command given");
        }
        String name = tokens.get(0);
        if (name.startsWith("-")) {
            throw new ParseException("Expected a command but found option '" + name + "'");
        }
        if (name.startsWith(":") || name.endsWith(":")) {
            throw new ParseException("Malformed command name '" + name + "'");
        }

        CommandLine root = commandLine();
        ParseResult result;
        try {
            result = root.parseArgs(tokens.toArray(new String[0]));
        } catch (UnmatchedArgumentException e) {
            if (e.getCommandLine() == root) {
                throw new UnknownCommandException(name);
            }
            throw new ParseException(e.getMessage() + " (command '" + name + "')");
        } catch (ParameterException e) {
            throw new ParseException(e.getMessage() + " (command '" + name + "')");
        }

        ParseResult command = result.subcommand();
        if (command == null) {
            throw new UnknownCommandException(name);
        }
        CommandDefinition definition = definitionNamed(command.commandSpec().name());
        return toDescriptor(definition, command);
    }

    /**
     * Renders the list of all commands.
     *
     * @return multi-line listing
     */
    public String commandList() {
        return commandLine().getUsageMessage(Help.Ansi.OFF);
    }

    /**
     * Renders usage for one command.
     *
     * @param definition command definition
     * @return multi-line usage text
     */
    public String commandUsage(CommandDefinition definition) {
        return commandLine().getSubcommands().get(definition.name()).getUsageMessage(Help.Ansi.OFF);
    }

    /**
     * Builds a fresh picocli command tree: the program as root, one subcommand per definition.
     */
    private CommandLine commandLine() {
        CommandSpec root = CommandSpec.create().name(programName);
        root.usageMessage()
            .customSynopsis(programName + " <command> [arguments] [options]")
            .commandListHeading("%nAvailable commands:%n")
            .footer("%nRun '" + programName + " <command> --help' for command options.");
        CommandLine commandLine = new CommandLine(root).setExpandAtFiles(false);
        for (CommandRegistry.Entry entry : registry.entries()) {
            commandLine.addSubcommand(entry.definition().name(), toSpec(entry.definition()));
        }
        return commandLine;
    }

    private CommandDefinition definitionNamed(String name) {
        int colon = name.indexOf(':');
        String verb = colon < 0 ? name : name.substring(0, colon);
        String noun = colon < 0 ? null : name.substring(colon + 1);
        return registry.lookup(verb, noun)
            .map(CommandRegistry.Entry::definition)
            .orElseThrow(() -> new UnknownCommandException(name));
    }

    private static CommandSpec toSpec(CommandDefinition definition) {
        CommandSpec spec = CommandSpec.create().name(definition.name());
        spec.usageMessage().description(definition.description());

        int index = 0;
        for (ParameterDefinition parameter : definition.parameters()) {
            PositionalParamSpec.Builder builder = PositionalParamSpec.builder()
                .paramLabel("<" + parameter.name() + ">")
                .description(parameter.description());
            if (parameter.variadic()) {
                builder.index(index + "..*").arity("0..*").type(List.class).auxiliaryTypes(String.class);
            } else {
                builder.index(String.valueOf(index)).arity(parameter.required() ? "1" : "0..1").type(String.class);
            }
            spec.addPositional(builder.build());
            index++;
        }

        for (FlagDefinition flag : definition.flags()) {
            spec.addOption(toOption(flag));
        }
        spec.addOption(OptionSpec.builder("-h", "--help")
            .usageHelp(true)
            .description("Show this help message")
            .build());
        return spec;
    }

    private static OptionSpec toOption(FlagDefinition flag) {
        String[] names = flag.shortName() == null
            ? new String[] {"--" + flag.name()}
            : new String[] {"-" + flag.shortName(), "--" + flag.name()};
        String description = flag.description();
        if (flag.defaultValue() != null && !Boolean.FALSE.equals(flag.defaultValue())) {
            description += " (default: " + flag.defaultValue() + ")";
        }
        OptionSpec.Builder builder = OptionSpec.builder(names).description(description);
        switch (flag.type()) {
            case BOOLEAN -> builder.type(Boolean.class).arity("0..1");
            case STRING -> builder.type(String.class).arity("1").paramLabel("<" + flag.name() + ">");
            case INTEGER -> builder.type(Integer.class).arity("1").paramLabel("<n>");
        }
        if (flag.defaultValue() != null) {
            builder.defaultValue(String.valueOf(flag.defaultValue()));
        }
        return builder.build();
    }

    private static CommandDescriptor toDescriptor(CommandDefinition definition, ParseResult result) {
        CommandSpec spec = result.commandSpec();
        List<String> arguments = new ArrayList<>();
        for (PositionalParamSpec positional : spec.positionalParameters()) {
            Object value = positional.getValue();
            if (value instanceof Collection<?> values) {
                values.forEach(item -> arguments.add(String.valueOf(item)));
            } else if (value != null) {
                arguments.add(value.toString());
            }
        }

        Map<String, Object> flags = new LinkedHashMap<>();
        for (FlagDefinition flag : definition.flags()) {
            Object value = valueOf(spec.findOption("--" + flag.name()));
            if (value == null && flag.type() == FlagType.BOOLEAN) {
                value = Boolean.FALSE;
            }
            if (value != null) {
                flags.put(flag.name(), value);
            }
        }
        return new CommandDescriptor(definition.verb(), definition.noun(), arguments, flags,
            result.isUsageHelpRequested());
    }

    private static Object valueOf(ArgSpec arg) {
        return arg == null ? null : arg.getValue();
    }
}
