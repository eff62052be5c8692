package com.rivet.core.process;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Builds Maven invocations for a Rivet project.
 *
 * <p>Prefers the project's Maven wrapper when one is checked in. Application tasks
 * (migrations, seeders, queue workers, cache keys) run through the project's console
 * kernel, the framework-side entry point generated by {@code rivet new}:
 * <pre>{@code
 * mvn -q compile exec:java -Dexec.mainClass=com.example.blog.console.Kernel -Dexec.args="migrate:down --steps 2"
 * }</pre>
 */
public class MavenInvoker {

    private final Path projectRoot;
    private final String basePackage;
    private final boolean windows;

    public MavenInvoker(Path projectRoot, String basePackage) {
        this(projectRoot, basePackage, System.getProperty("os.name", "").toLowerCase().contains("win"));
    }

    MavenInvoker(Path projectRoot, String basePackage, boolean windows) {
        this.projectRoot = Objects.requireNonNull(projectRoot, "projectRoot must not be null");
        this.basePackage = Objects.requireNonNull(basePackage, "basePackage must not be null");
        this.windows = windows;
    }

    /**
     * Returns the Maven executable for this project.
     *
     * @return wrapper script path when present, otherwise {@code mvn}
     */
    public String executable() {
        if (windows) {
            return Files.isRegularFile(projectRoot.resolve("mvnw.cmd")) ? "mvnw.cmd" : "mvn.cmd";
        }
        return Files.isRegularFile(projectRoot.resolve("mvnw")) ? "./mvnw" : "mvn";
    }

    /**
     * Builds an invocation running the given goals and arguments.
     *
     * @param arguments goals, phases and -D properties
     * @return invocation in the project root
     */
    public ProcessInvocation goals(List<String> arguments) {
        List<String> command = new ArrayList<>();
        command.add(executable());
        command.add("-B");
        command.addAll(arguments);
        return ProcessInvocation.of(projectRoot, command);
    }

    /**
     * Builds an invocation that runs a task through the project's console kernel.
     *
     * @param task task name (e.g. "migrate:status")
     * @param arguments task arguments
     * @return invocation in the project root
     */
    public ProcessInvocation task(String task, List<String> arguments) {
        List<String> taskLine = new ArrayList<>();
        taskLine.add(task);
        taskLine.addAll(arguments);
        return goals(List.of(
            "-q",
            "compile",
            "exec:java",
            "-Dexec.mainClass=" + basePackage + ".console.Kernel",
            "-Dexec.args=" + joinArguments(taskLine)
        ));
    }

    /**
     * Builds an invocation that runs the application's main class.
     *
     * @return invocation in the project root
     */
    public ProcessInvocation application() {
        return goals(List.of("-q", "compile", "exec:java", "-Dexec.mainClass=" + basePackage + ".Application"));
    }

    static String joinArguments(List<String> arguments) {
        List<String> quoted = new ArrayList<>(arguments.size());
        for (String argument : arguments) {
            if (argument.isEmpty() || argument.chars().anyMatch(Character::isWhitespace)) {
                quoted.add('"' + argument.replace("\"", "\\\"") + '"');
            } else {
                quoted.add(argument);
            }
        }
        return String.join(" ", quoted);
    }
}
