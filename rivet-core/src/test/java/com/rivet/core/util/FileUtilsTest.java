package com.rivet.core.util;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.assertj.core.api.Assertions.*;

/**
 * Tests for {@link FileUtils}.
 */
class FileUtilsTest {

    @TempDir
    Path tempDir;

    @Test
    void findFiles_withWildcardPattern_returnsTopLevelMatchesOnly() throws IOException {
        Path jar = tempDir.resolve("app.jar");
        Files.writeString(jar, "jar");
        Files.createDirectories(tempDir.resolve("lib"));
        Files.writeString(tempDir.resolve("lib/dep.jar"), "jar");
        Files.writeString(tempDir.resolve("readme.txt"), "text");

        List<Path> files = FileUtils.findFiles(tempDir, "*.jar");

        assertThat(files).containsExactly(jar);
    }

    @Test
    void findFiles_withMissingRoot_returnsEmptyList() throws IOException {
        assertThat(FileUtils.findFiles(tempDir.resolve("missing"), "**")).isEmpty();
    }

    @Test
    void isMissingOrEmptyDirectory_distinguishesContent() throws IOException {
        assertThat(FileUtils.isMissingOrEmptyDirectory(tempDir.resolve("nope"))).isTrue();
        assertThat(FileUtils.isMissingOrEmptyDirectory(tempDir)).isTrue();

        Files.writeString(tempDir.resolve("file"), "x");

        assertThat(FileUtils.isMissingOrEmptyDirectory(tempDir)).isFalse();
    }

    @Test
    void writeAtomically_createsParentsAndReplacesContent() throws IOException {
        Path target = tempDir.resolve("a/b/config.json");

        FileUtils.writeAtomically(target, "first");
        FileUtils.writeAtomically(target, "second");

        assertThat(target).hasContent("second");
        try (var entries = Files.list(target.getParent())) {
            assertThat(entries).containsExactly(target);
        }
    }

    @Test
    void deleteContents_keepsDirectory() throws IOException {
        Path cache = Files.createDirectories(tempDir.resolve("cache/nested"));
        Files.writeString(cache.resolve("entry"), "x");
        Files.writeString(tempDir.resolve("cache/top"), "x");

        FileUtils.deleteContents(tempDir.resolve("cache"));

        assertThat(tempDir.resolve("cache")).isEmptyDirectory();
    }

    @Test
    void deleteRecursively_removesTree() throws IOException {
        Path tree = Files.createDirectories(tempDir.resolve("tree/leaf"));
        Files.writeString(tree.resolve("file"), "x");

        FileUtils.deleteRecursively(tempDir.resolve("tree"));

        assertThat(tempDir.resolve("tree")).doesNotExist();
    }
}
