package com.rivet.core.layout;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Tests for {@link ProjectLayout}.
 */
class ProjectLayoutTest {

    @TempDir
    Path tempDir;

    @Test
    void pathFor_controller_usesHttpControllersPackage() {
        ProjectLayout layout = new ProjectLayout(tempDir, "com.acme.shop");

        assertThat(layout.pathFor(ComponentKind.CONTROLLER, "UserController"))
            .isEqualTo(tempDir.resolve("src/main/java/com/acme/shop/http/controllers/UserController.java"));
        assertThat(layout.packageFor(ComponentKind.CONTROLLER)).isEqualTo("com.acme.shop.http.controllers");
    }

    @Test
    void pathFor_test_separatesUnitAndIntegration() {
        ProjectLayout layout = new ProjectLayout(tempDir, "app");

        assertThat(layout.pathFor(ComponentKind.TEST, "CartTest", false))
            .isEqualTo(tempDir.resolve("src/test/java/app/unit/CartTest.java"));
        assertThat(layout.pathFor(ComponentKind.TEST, "CartTest", true))
            .isEqualTo(tempDir.resolve("src/test/java/app/integration/CartTest.java"));
    }

    @Test
    void pathFor_migration_isRejected() {
        ProjectLayout layout = new ProjectLayout(tempDir, "app");

        assertThatThrownBy(() -> layout.pathFor(ComponentKind.MIGRATION, "x"))
            .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void constructor_blankPackage_fallsBackToDefault() {
        assertThat(new ProjectLayout(tempDir, " ").basePackage()).isEqualTo(ProjectLayout.DEFAULT_PACKAGE);
        assertThat(new ProjectLayout(tempDir, null).basePackage()).isEqualTo(ProjectLayout.DEFAULT_PACKAGE);
    }

    @Test
    void migrationPath_usesFlywayNaming() {
        ProjectLayout layout = new ProjectLayout(tempDir, "app");

        assertThat(layout.migrationPath("20240101120000", "CreateUsersTable"))
            .isEqualTo(tempDir.resolve("src/main/resources/db/migration/V20240101120000__create_users_table.sql"));
    }

    @Test
    void findMigration_matchesByNameWhateverTimestamp() throws IOException {
        ProjectLayout layout = new ProjectLayout(tempDir, "app");
        Path existing = layout.migrationsDirectory().resolve("V20230505101010__create_posts_table.sql");
        Files.createDirectories(existing.getParent());
        Files.writeString(existing, "--");

        assertThat(layout.findMigration("create_posts_table")).contains(existing);
        assertThat(layout.findMigration("create_users_table")).isEmpty();
    }

    @Test
    void canonicalDirectories_includeComponentsAndStorage() {
        ProjectLayout layout = new ProjectLayout(tempDir, "app");

        assertThat(layout.canonicalDirectories())
            .contains(
                tempDir.resolve("src/main/java/app/models"),
                tempDir.resolve("src/main/java/app/database/seeders"),
                tempDir.resolve(ProjectLayout.MIGRATIONS),
                tempDir.resolve(ProjectLayout.BOOTSTRAP_CACHE));
    }

    @Test
    void fromId_resolvesKnownKinds() {
        assertThat(ComponentKind.fromId("listener")).contains(ComponentKind.LISTENER);
        assertThat(ComponentKind.fromId("widget")).isEmpty();
    }
}
