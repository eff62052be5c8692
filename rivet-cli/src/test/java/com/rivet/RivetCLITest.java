package com.rivet;

import com.rivet.cli.CliHarness;
import com.rivet.core.process.ProcessResult;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Tests for {@link RivetCLI} exit codes and top-level output.
 */
class RivetCLITest {

    @TempDir
    Path tempDir;

    @Test
    void noArguments_printsCommandListAndSucceeds() {
        CliHarness cli = new CliHarness(tempDir);

        assertThat(cli.run()).isZero();
        assertThat(cli.out()).contains("Available commands:", "make:model", "migrate:status", "deploy:init");
    }

    @Test
    void list_printsEveryFamily() {
        CliHarness cli = new CliHarness(tempDir);

        assertThat(cli.run("list")).isZero();
        assertThat(cli.out()).contains("new", "serve", "db:create", "seed", "cache:clear", "queue:work",
            "config:validate", "test", "build", "deploy", "info");
    }

    @Test
    void unknownCommand_exitsWithUsageCode() {
        CliHarness cli = new CliHarness(tempDir);

        assertThat(cli.run("make:widget", "Foo")).isEqualTo(2);
        assertThat(cli.err()).startsWith("✗ ").contains("make:widget");
    }

    @Test
    void badFlag_exitsWithUsageCode() {
        CliHarness cli = new CliHarness(tempDir);

        assertThat(cli.run("make:model", "User", "--bogus")).isEqualTo(2);
        assertThat(cli.err()).contains("--bogus");
    }

    @Test
    void projectCommandOutsideProject_exitsWithFailureCode() {
        CliHarness cli = new CliHarness(tempDir);

        assertThat(cli.run("migrate")).isEqualTo(1);
        assertThat(cli.err()).contains("Rivet project");
    }

    @Test
    void commandHelp_printsUsage() {
        CliHarness cli = new CliHarness(tempDir);

        assertThat(cli.run("make:controller", "--help")).isZero();
        assertThat(cli.out()).contains("Usage: rivet make:controller", "<name>", "--resource", "--api", "--force");
    }

    @Test
    void globalVerboseFlag_isAcceptedBeforeCommand() throws IOException {
        CliHarness cli = new CliHarness(tempDir).withProject();

        assertThat(cli.run("-v", "cache:clear")).isZero();
        assertThat(cli.out()).contains("✓ Application cache cleared");
    }

    @Test
    void delegatedFailure_exitsWithFailureCodeAndToolOutput() throws IOException {
        CliHarness cli = new CliHarness(tempDir).withProject()
            .respondWith(invocation -> new ProcessResult(1, "", "BUILD FAILURE"));

        assertThat(cli.run("migrate")).isEqualTo(1);
        assertThat(cli.err()).contains("BUILD FAILURE");
    }

    @Test
    void version_printsRivetVersion() {
        CliHarness cli = new CliHarness(tempDir);

        assertThat(cli.run("--version")).isZero();
    }

    @Test
    void info_printsApplicationAndToolDetails() throws IOException {
        CliHarness cli = new CliHarness(tempDir).withProject().withUnavailable("git")
            .respondWith(invocation -> new ProcessResult(0, "Apache Maven 3.9.6\nMaven home: /opt/maven", ""));

        assertThat(cli.run("info", "--detailed")).isZero();
        assertThat(cli.out())
            .contains("Name:        shop")
            .contains("Package:     com.acme.shop")
            .contains("Environment: development")
            .contains("Maven:       Apache Maven 3.9.6")
            .contains("Git:         not found")
            .contains("app.key = ");
    }
}
