package com.rivet.cli;

import com.rivet.RivetCLI;
import com.rivet.core.command.CommandContext;
import com.rivet.core.config.ConfigDefaults;
import com.rivet.core.config.ConfigStore;
import com.rivet.core.deploy.HealthCheck;
import com.rivet.core.process.ProcessInvocation;
import com.rivet.core.process.ProcessResult;
import com.rivet.core.process.ProcessRunner;
import com.rivet.core.process.RunningProcess;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.Function;

/**
 * Runs the {@code rivet} command line in-process against a temporary directory.
 */
public class CliHarness {

    static final Clock CLOCK = Clock.fixed(Instant.parse("2024-03-01T09:00:00Z"), ZoneOffset.UTC);

    private final Path workingDirectory;
    private final Map<String, String> environment = new HashMap<>();
    private final Recorder runner = new Recorder();
    private final List<String> healthChecks = new ArrayList<>();
    private String stdin = "";
    private String out = "";
    private String err = "";

    public CliHarness(Path workingDirectory) {
        this.workingDirectory = workingDirectory;
    }

    /**
     * Makes the working directory a minimal Rivet project.
     */
    public CliHarness withProject() throws IOException {
        Files.writeString(workingDirectory.resolve("pom.xml"), "<project/>");
        Files.createDirectories(workingDirectory.resolve("src/main/java"));
        new ConfigStore(workingDirectory.resolve("rivet.yaml")).save(ConfigDefaults.create("shop", "com.acme.shop"));
        return this;
    }

    public CliHarness withEnv(String name, String value) {
        environment.put(name, value);
        return this;
    }

    public CliHarness withStdin(String input) {
        this.stdin = input;
        return this;
    }

    public CliHarness withUnavailable(String program) {
        runner.unavailable.add(program);
        return this;
    }

    public CliHarness respondWith(Function<ProcessInvocation, ProcessResult> responder) {
        runner.responder = responder;
        return this;
    }

    public int run(String... args) {
        ByteArrayOutputStream outBytes = new ByteArrayOutputStream();
        ByteArrayOutputStream errBytes = new ByteArrayOutputStream();
        CommandContext context = context(outBytes, errBytes);
        HealthCheck healthCheck = uri -> {
            healthChecks.add(uri.toString());
            return 200;
        };
        int exitCode = RivetCLI.commandLine(new RivetCLI(RivetCommands.dispatcher(healthCheck), context)).execute(args);
        out = outBytes.toString(StandardCharsets.UTF_8);
        err = errBytes.toString(StandardCharsets.UTF_8);
        return exitCode;
    }

    /**
     * Builds a context over this harness's stdin, environment and recorder.
     */
    CommandContext context(ByteArrayOutputStream outBytes, ByteArrayOutputStream errBytes) {
        return new CommandContext(
            workingDirectory,
            new PrintStream(outBytes, true, StandardCharsets.UTF_8),
            new PrintStream(errBytes, true, StandardCharsets.UTF_8),
            new ByteArrayInputStream(stdin.getBytes(StandardCharsets.UTF_8)),
            runner,
            environment,
            CLOCK);
    }

    public String out() {
        return out;
    }

    public String err() {
        return err;
    }

    public List<ProcessInvocation> invocations() {
        return runner.invocations;
    }

    public List<String> commandLines() {
        return runner.invocations.stream().map(ProcessInvocation::commandLine).toList();
    }

    public List<String> healthChecks() {
        return healthChecks;
    }

    public Path path(String relative) {
        return workingDirectory.resolve(relative);
    }

    private static final class Recorder implements ProcessRunner {

        private final List<ProcessInvocation> invocations = new ArrayList<>();
        private final Set<String> unavailable = new HashSet<>();
        private Function<ProcessInvocation, ProcessResult> responder = invocation -> ProcessResult.success();

        @Override
        public ProcessResult run(ProcessInvocation invocation) {
            invocations.add(invocation);
            return responder.apply(invocation);
        }

        @Override
        public RunningProcess start(ProcessInvocation invocation) {
            ProcessResult result = run(invocation);
            return new RunningProcess() {
                @Override
                public int waitFor() {
                    return result.exitCode();
                }

                @Override
                public boolean isAlive() {
                    return false;
                }

                @Override
                public void stop() {
                    // already finished
                }
            };
        }

        @Override
        public boolean isAvailable(String program) {
            return !unavailable.contains(program);
        }
    }
}
