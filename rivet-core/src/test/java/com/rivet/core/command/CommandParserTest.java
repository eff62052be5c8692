package com.rivet.core.command;

import com.rivet.core.exception.ParseException;
import com.rivet.core.exception.RivetException;
import com.rivet.core.exception.UnknownCommandException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Tests for {@link CommandParser}.
 */
class CommandParserTest {

    private CommandParser parser;

    @BeforeEach
    void setUp() {
        CommandHandler noop = (command, context) -> { };
        CommandRegistry registry = new CommandRegistry()
            .register(CommandDefinition.builder("make", "model")
                .parameter(ParameterDefinition.required("name", "Model name"))
                .flag(FlagDefinition.bool("migration", "").withShortName("m"))
                .flag(FlagDefinition.bool("factory", ""))
                .build(), noop)
            .register(CommandDefinition.builder("migrate")
                .parameter(ParameterDefinition.optional("direction", ""))
                .flag(FlagDefinition.integer("steps", "").withShortName("s"))
                .build(), noop)
            .register(CommandDefinition.builder("new")
                .parameter(ParameterDefinition.required("name", ""))
                .flag(FlagDefinition.string("template", "").withDefault("default"))
                .flag(FlagDefinition.bool("git", "").withDefault(Boolean.TRUE))
                .build(), noop)
            .register(CommandDefinition.builder("run")
                .parameter(ParameterDefinition.variadic("args", ""))
                .build(), noop)
            .register(CommandDefinition.builder("serve")
                .flag(FlagDefinition.string("host", "").withDefault("127.0.0.1"))
                .flag(FlagDefinition.integer("port", "").withShortName("p").withDefault(8000))
                .build(), noop)
            .register(CommandDefinition.builder("config", "set")
                .parameter(ParameterDefinition.required("key", ""))
                .parameter(ParameterDefinition.required("value", ""))
                .build(), noop);
        parser = new CommandParser(registry, "rivet");
    }

    @Test
    void parse_verbAndNoun_splitsOnColon() {
        CommandDescriptor command = parser.parse(List.of("make:model", "User", "--migration"));

        assertThat(command.verb()).isEqualTo("make");
        assertThat(command.noun()).isEqualTo("model");
        assertThat(command.arguments()).containsExactly("User");
        assertThat(command.booleanFlag("migration")).isTrue();
        assertThat(command.booleanFlag("factory")).isFalse();
    }

    @Test
    void parse_shortFlagBeforeArgument_isAccepted() {
        CommandDescriptor command = parser.parse(List.of("make:model", "-m", "Post"));

        assertThat(command.booleanFlag("migration")).isTrue();
        assertThat(command.arguments()).containsExactly("Post");
    }

    @Test
    void parse_integerFlagForms_allParse() {
        assertThat(parser.parse(List.of("migrate", "down", "--steps", "3")).intFlag("steps")).contains(3);
        assertThat(parser.parse(List.of("migrate", "down", "--steps=2")).intFlag("steps")).contains(2);
        assertThat(parser.parse(List.of("migrate", "down", "-s", "4")).intFlag("steps")).contains(4);
    }

    @Test
    void parse_nonNumericInteger_throwsParseException() {
        assertThatThrownBy(() -> parser.parse(List.of("migrate", "--steps", "many")))
            .isInstanceOf(ParseException.class)
            .hasMessageContaining("--steps")
            .hasMessageContaining("many");
    }

    @Test
    void parse_missingValue_throwsParseException() {
        assertThatThrownBy(() -> parser.parse(List.of("migrate", "--steps")))
            .isInstanceOf(ParseException.class)
            .hasMessageContaining("--steps");
    }

    @Test
    void parse_optionNameAsValue_throwsParseException() {
        assertThatThrownBy(() -> parser.parse(List.of("serve", "--host", "-p", "8000")))
            .isInstanceOf(ParseException.class)
            .hasMessageContaining("--host");
    }

    @Test
    void parse_hostAndPort_bothBind() {
        CommandDescriptor command = parser.parse(List.of("serve", "--host", "0.0.0.0", "-p", "9000"));

        assertThat(command.stringFlag("host")).contains("0.0.0.0");
        assertThat(command.intFlag("port")).contains(9000);
    }

    @Test
    void parse_atSignValue_isKeptLiterally() {
        CommandDescriptor command = parser.parse(List.of("config:set", "mail.from", "@ops"));

        assertThat(command.arguments()).containsExactly("mail.from", "@ops");
    }

    @Test
    void parse_sameParserTwice_doesNotCarryValuesOver() {
        parser.parse(List.of("migrate", "down", "--steps", "3"));

        CommandDescriptor second = parser.parse(List.of("migrate"));

        assertThat(second.arguments()).isEmpty();
        assertThat(second.intFlag("steps")).isEmpty();
    }

    @Test
    void commandUsage_rendersArgumentsAndFlags() {
        CommandDefinition definition = CommandDefinition.builder("make", "model")
            .description("Create a model")
            .parameter(ParameterDefinition.required("name", "Model name"))
            .flag(FlagDefinition.bool("migration", "Also create a migration").withShortName("m"))
            .build();
        CommandParser single = new CommandParser(new CommandRegistry().register(definition, (c, ctx) -> { }), "rivet");

        assertThat(single.commandUsage(definition))
            .contains("Usage: rivet make:model", "<name>", "-m, --migration", "Also create a migration", "-h, --help");
    }

    @Test
    void parse_explicitBooleanValue_overridesDefault() {
        assertThat(parser.parse(List.of("new", "shop", "--git=false")).booleanFlag("git")).isFalse();
        assertThat(parser.parse(List.of("new", "shop", "--git", "false")).booleanFlag("git")).isFalse();
        assertThat(parser.parse(List.of("new", "shop")).booleanFlag("git")).isTrue();
    }

    @Test
    void parse_absentValuedFlag_takesDefault() {
        CommandDescriptor command = parser.parse(List.of("new", "shop"));

        assertThat(command.stringFlag("template")).contains("default");
    }

    @Test
    void parse_unknownCommand_throwsUnknownCommandWithUsageExitCode() {
        assertThatThrownBy(() -> parser.parse(List.of("make:widget", "Foo")))
            .isInstanceOf(UnknownCommandException.class)
            .hasMessageContaining("make:widget")
            .extracting(e -> ((RivetException) e).exitCode())
            .isEqualTo(RivetException.EXIT_USAGE);
    }

    @Test
    void parse_unknownFlag_throwsParseException() {
        assertThatThrownBy(() -> parser.parse(List.of("make:model", "User", "--bogus")))
            .isInstanceOf(ParseException.class)
            .hasMessageContaining("--bogus");
    }

    @Test
    void parse_missingRequiredArgument_throwsParseException() {
        assertThatThrownBy(() -> parser.parse(List.of("make:model")))
            .isInstanceOf(ParseException.class)
            .hasMessageContaining("<name>");
    }

    @Test
    void parse_extraArgument_throwsParseException() {
        assertThatThrownBy(() -> parser.parse(List.of("make:model", "User", "Post")))
            .isInstanceOf(ParseException.class)
            .hasMessageContaining("Post");
    }

    @Test
    void parse_helpWithoutRequiredArgument_isAccepted() {
        CommandDescriptor command = parser.parse(List.of("make:model", "--help"));

        assertThat(command.helpRequested()).isTrue();
    }

    @Test
    void parse_doubleDash_treatsRestAsPositional() {
        CommandDescriptor command = parser.parse(List.of("run", "--", "--not-a-flag", "x"));

        assertThat(command.arguments()).containsExactly("--not-a-flag", "x");
    }

    @Test
    void parse_malformedName_throwsParseException() {
        assertThatThrownBy(() -> parser.parse(List.of("make:")))
            .isInstanceOf(ParseException.class);
        assertThatThrownBy(() -> parser.parse(List.of("--verbose")))
            .isInstanceOf(ParseException.class);
    }
}
