package com.rivet.core.process;

import com.rivet.core.exception.DelegatedFailureException;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Tests for {@link MavenInvoker}, {@link ProcessRunner#runOrFail} and {@link DryRunProcessRunner}.
 */
class MavenInvokerTest {

    @TempDir
    Path tempDir;

    @Test
    void executable_prefersWrapperWhenPresent() throws IOException {
        MavenInvoker maven = new MavenInvoker(tempDir, "app", false);
        assertThat(maven.executable()).isEqualTo("mvn");

        Files.writeString(tempDir.resolve("mvnw"), "#!/bin/sh");

        assertThat(maven.executable()).isEqualTo("./mvnw");
    }

    @Test
    void executable_onWindows_usesCmdScripts() {
        assertThat(new MavenInvoker(tempDir, "app", true).executable()).isEqualTo("mvn.cmd");
    }

    @Test
    void task_runsConsoleKernelWithQuotedArguments() {
        ProcessInvocation invocation = new MavenInvoker(tempDir, "com.acme.shop", false)
            .task("seed", List.of("--class", "User Seeder"));

        assertThat(invocation.command()).containsExactly(
            "mvn", "-B", "-q", "compile", "exec:java",
            "-Dexec.mainClass=com.acme.shop.console.Kernel",
            "-Dexec.args=seed --class \"User Seeder\"");
        assertThat(invocation.workingDirectory()).isEqualTo(tempDir);
    }

    @Test
    void application_runsApplicationMainClass() {
        assertThat(new MavenInvoker(tempDir, "app", false).application().command())
            .contains("-Dexec.mainClass=app.Application");
    }

    @Test
    void runOrFail_nonZeroExit_carriesStderr() {
        RecordingProcessRunner runner = new RecordingProcessRunner()
            .respondWith(invocation -> new ProcessResult(3, "", "database locked"));

        assertThatThrownBy(() -> runner.runOrFail(ProcessInvocation.of(tempDir, "sqlite3", "app.db")))
            .isInstanceOf(DelegatedFailureException.class)
            .hasMessageContaining("sqlite3 app.db")
            .hasMessageContaining("database locked")
            .satisfies(e -> assertThat(((DelegatedFailureException) e).toolExitCode()).isEqualTo(3));
    }

    @Test
    void dryRun_printsInsteadOfRunning() {
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        DryRunProcessRunner runner = new DryRunProcessRunner(new PrintStream(out, true, StandardCharsets.UTF_8));

        ProcessResult result = runner.runOrFail(ProcessInvocation.of(tempDir, "kubectl", "apply", "-f", "k8s/"));

        assertThat(result.succeeded()).isTrue();
        assertThat(out.toString(StandardCharsets.UTF_8)).contains("[dry-run] kubectl apply -f k8s/");
    }
}
