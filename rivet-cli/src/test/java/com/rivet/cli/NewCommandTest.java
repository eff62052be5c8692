package com.rivet.cli;

import com.rivet.core.config.ConfigStore;
import org.eclipse.jgit.api.Git;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;

class NewCommandTest {

    @TempDir
    Path tempDir;

    @Test
    void new_withoutGit_scaffoldsProject() {
        CliHarness cli = new CliHarness(tempDir);

        assertThat(cli.run("new", "shop", "--git=false")).isZero();

        Path root = tempDir.resolve("shop");
        assertThat(root.resolve("pom.xml")).exists();
        assertThat(root.resolve("src/main/java/com/example/shop/Application.java")).exists();
        assertThat(new ConfigStore(root.resolve("rivet.yaml")).load().getString("app.package"))
            .contains("com.example.shop");
        assertThat(cli.invocations()).isEmpty();
        assertThat(root.resolve(".git")).doesNotExist();
        assertThat(cli.out()).contains("Next steps:", "  cd shop");
    }

    @Test
    void new_withGit_initializesRepositoryWithoutGitBinary() throws IOException {
        CliHarness cli = new CliHarness(tempDir).withUnavailable("git");

        assertThat(cli.run("new", "shop", "--package", "com.acme.shop")).isZero();

        Path root = tempDir.resolve("shop");
        assertThat(root.resolve(".git")).isDirectory();
        try (Git git = Git.open(root.toFile())) {
            assertThat(git.getRepository().resolve("HEAD")).isNotNull();
        }
        assertThat(cli.invocations()).isEmpty();
        assertThat(cli.out()).contains("✓ Initialized git repository", "package com.acme.shop");
    }

    @Test
    void new_intoNonEmptyDirectory_fails() throws IOException {
        Files.createDirectories(tempDir.resolve("shop"));
        Files.writeString(tempDir.resolve("shop/notes.txt"), "keep me");
        CliHarness cli = new CliHarness(tempDir);

        assertThat(cli.run("new", "shop", "--git=false")).isEqualTo(1);
        assertThat(tempDir.resolve("shop/notes.txt")).hasContent("keep me");
        assertThat(tempDir.resolve("shop/pom.xml")).doesNotExist();
    }

    @Test
    void new_unknownTemplate_isUsageError() {
        CliHarness cli = new CliHarness(tempDir);

        assertThat(cli.run("new", "shop", "-t", "nope", "--git=false")).isEqualTo(2);
        assertThat(cli.err()).contains("Unknown template");
        assertThat(tempDir.resolve("shop")).doesNotExist();
    }
}
