package com.rivet;

import ch.qos.logback.classic.Level;
import com.rivet.cli.RivetCommands;
import com.rivet.core.command.CommandContext;
import com.rivet.core.command.CommandDispatcher;
import com.rivet.core.exception.RivetException;
import com.rivet.core.process.SystemProcessRunner;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

import java.nio.file.Path;
import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.Callable;

/**
 * Main CLI entry point for Rivet.
 *
 * <p>Rivet scaffolds Java web applications, generates their components and drives the
 * external tools (Maven, database clients, docker, kubectl, ssh) that build, run and
 * deploy them.
 *
 * <p>The root command owns the global options. Parsing stops at the first positional
 * token; that token and everything after it go to the {@link CommandDispatcher}, whose
 * parser maps each registered {@code verb:noun} command onto a picocli subcommand.
 *
 * <p><b>Global Options:</b>
 * <ul>
 *   <li>{@code -v, --verbose} - Enable verbose output</li>
 *   <li>{@code -q, --quiet} - Suppress log output except errors</li>
 *   <li>{@code --help} - Show help information</li>
 *   <li>{@code --version} - Show version information</li>
 * </ul>
 *
 * <p><b>Example Usage:</b>
 * <pre>{@code
 * # Create a project
 * rivet new shop --template api
 *
 * # Generate a model with migration, factory and seeder
 * rivet make:model Product -m --factory --seeder
 *
 * # List every command
 * rivet list
 * }</pre>
 */
@Command(
    name = RivetCommands.PROGRAM_NAME,
    mixinStandardHelpOptions = true,
    version = "Rivet " + RivetCommands.VERSION,
    description = "Command-line tool for building Rivet web applications"
)
public class RivetCLI implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(RivetCLI.class);

    @Option(names = {"-v", "--verbose"}, description = "Enable verbose output (DEBUG level)")
    private boolean verbose;

    @Option(names = {"-q", "--quiet"}, description = "Suppress log output except errors")
    private boolean quiet;

    @Parameters(arity = "0..*", paramLabel = "COMMAND", description = "Command and its arguments, e.g. make:model User -m")
    private List<String> tokens = new ArrayList<>();

    private final CommandDispatcher dispatcher;
    private final CommandContext context;

    public RivetCLI() {
        this(RivetCommands.dispatcher(), new CommandContext(
            Path.of("").toAbsolutePath(),
            System.out,
            System.err,
            System.in,
            new SystemProcessRunner(),
            System.getenv(),
            Clock.systemDefaultZone()));
    }

    /**
     * Creates a CLI over an explicit dispatcher and context.
     *
     * @param dispatcher command dispatcher
     * @param context execution context
     */
    public RivetCLI(CommandDispatcher dispatcher, CommandContext context) {
        this.dispatcher = Objects.requireNonNull(dispatcher, "dispatcher must not be null");
        this.context = Objects.requireNonNull(context, "context must not be null");
    }

    @Override
    public Integer call() {
        configureLogging();
        try {
            dispatcher.execute(tokens, context);
            return 0;
        } catch (RivetException e) {
            log.debug("Command failed", e);
            context.error(e.getMessage());
            return e.exitCode();
        } catch (RuntimeException e) {
            log.error("Unexpected failure", e);
            context.error(e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName());
            return RivetException.EXIT_FAILURE;
        }
    }

    /**
     * Configures logging level based on global options.
     */
    private void configureLogging() {
        ch.qos.logback.classic.Logger root =
            (ch.qos.logback.classic.Logger) LoggerFactory.getLogger(Logger.ROOT_LOGGER_NAME);

        if (quiet) {
            root.setLevel(Level.ERROR);
        } else if (verbose) {
            root.setLevel(Level.DEBUG);
        } else {
            root.setLevel(Level.WARN);
        }
    }

    /**
     * Creates the picocli command line for the global options.
     *
     * @param cli root command
     * @return configured command line
     */
    public static CommandLine commandLine(RivetCLI cli) {
        return new CommandLine(cli)
            .setStopAtPositional(true)
            .setExpandAtFiles(false);
    }

    /**
     * Main entry point.
     *
     * @param args command-line arguments
     */
    public static void main(String[] args) {
        int exitCode = commandLine(new RivetCLI()).execute(args);
        System.exit(exitCode);
    }
}
