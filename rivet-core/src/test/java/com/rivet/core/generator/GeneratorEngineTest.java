package com.rivet.core.generator;

import com.rivet.core.exception.InvalidNameException;
import com.rivet.core.exception.TargetExistsException;
import com.rivet.core.layout.ComponentKind;
import com.rivet.core.layout.ProjectLayout;
import com.rivet.core.template.TemplateRenderer;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Tests for {@link GeneratorEngine}.
 */
class GeneratorEngineTest {

    private static final Clock CLOCK = Clock.fixed(Instant.parse("2024-01-15T10:30:00Z"), ZoneOffset.UTC);

    @TempDir
    Path tempDir;

    private ProjectLayout layout;
    private GeneratorEngine engine;

    @BeforeEach
    void setUp() {
        layout = new ProjectLayout(tempDir, "com.acme.shop");
        engine = new GeneratorEngine(layout, new TemplateRenderer(), CLOCK);
    }

    private static ComponentSpec spec(ComponentKind kind, String name, Set<Modifier> modifiers, Map<String, String> options) {
        return new ComponentSpec(kind, name, modifiers, options, false);
    }

    @Nested
    @DisplayName("Controllers")
    class Controllers {

        @Test
        void plainController_isWrittenIntoControllerPackage() throws IOException {
            List<GeneratedComponent> generated = engine.generate(ComponentSpec.of(ComponentKind.CONTROLLER, "UserController"));

            Path file = layout.pathFor(ComponentKind.CONTROLLER, "UserController");
            assertThat(generated).singleElement().satisfies(component -> {
                assertThat(component.path()).isEqualTo(file);
                assertThat(component.overwritten()).isFalse();
            });
            assertThat(Files.readString(file))
                .contains("package com.acme.shop.http.controllers;")
                .contains("public class UserController");
        }

        @Test
        void apiController_importsModelAndHasNoCreateOrEdit() throws IOException {
            engine.generate(spec(ComponentKind.CONTROLLER, "PostController", Set.of(Modifier.API),
                Map.of(ComponentSpec.MODEL, "Post")));

            String source = Files.readString(layout.pathFor(ComponentKind.CONTROLLER, "PostController"));
            assertThat(source)
                .contains("import com.acme.shop.models.Post;")
                .contains("index()", "store(", "show(", "update(", "destroy(")
                .doesNotContain(" create(", " edit(");
        }

        @Test
        void resourceController_hasAllSevenActions() throws IOException {
            engine.generate(spec(ComponentKind.CONTROLLER, "PhotoController", Set.of(Modifier.RESOURCE), Map.of()));

            String source = Files.readString(layout.pathFor(ComponentKind.CONTROLLER, "PhotoController"));
            assertThat(source).contains("index(", "create(", "store(", "show(", "edit(", "update(", "destroy(");
        }
    }

    @Nested
    @DisplayName("Models")
    class Models {

        @Test
        void modelWithAllCompanions_writesModelMigrationFactorySeederInOrder() throws IOException {
            List<GeneratedComponent> generated = engine.generate(spec(ComponentKind.MODEL, "Category",
                Set.of(Modifier.MIGRATION, Modifier.FACTORY, Modifier.SEEDER), Map.of()));

            assertThat(generated).extracting(GeneratedComponent::kind)
                .containsExactly(ComponentKind.MODEL, ComponentKind.MIGRATION, ComponentKind.FACTORY, ComponentKind.SEEDER);

            Path migration = layout.migrationsDirectory().resolve("V20240115103000__create_categories_table.sql");
            assertThat(migration).exists();
            assertThat(Files.readString(migration)).contains("CREATE TABLE categories");
            assertThat(Files.readString(layout.pathFor(ComponentKind.MODEL, "Category")))
                .contains("TABLE = \"categories\"");
            assertThat(Files.readString(layout.pathFor(ComponentKind.FACTORY, "CategoryFactory")))
                .contains("import com.acme.shop.models.Category;");
            assertThat(layout.pathFor(ComponentKind.SEEDER, "CategorySeeder")).exists();
        }

        @Test
        void modelWithoutModifiers_writesOnlyModel() {
            List<GeneratedComponent> generated = engine.generate(ComponentSpec.of(ComponentKind.MODEL, "Tag"));

            assertThat(generated).hasSize(1);
            assertThat(layout.migrationsDirectory()).doesNotExist();
        }
    }

    @Nested
    @DisplayName("Migrations")
    class Migrations {

        @Test
        void createName_infersTableAndCreateTemplate() throws IOException {
            engine.generate(ComponentSpec.of(ComponentKind.MIGRATION, "create_orders_table"));

            Path file = layout.migrationsDirectory().resolve("V20240115103000__create_orders_table.sql");
            assertThat(Files.readString(file)).contains("CREATE TABLE orders");
        }

        @Test
        void alterName_infersTableAndAlterTemplate() throws IOException {
            engine.generate(ComponentSpec.of(ComponentKind.MIGRATION, "add_email_to_users_table"));

            Path file = layout.migrationsDirectory().resolve("V20240115103000__add_email_to_users_table.sql");
            assertThat(Files.readString(file)).contains("ALTER TABLE users");
        }

        @Test
        void existingMigration_isMatchedByNameAndRequiresForce() throws IOException {
            Path existing = layout.migrationsDirectory().resolve("V20200101000000__create_orders_table.sql");
            Files.createDirectories(existing.getParent());
            Files.writeString(existing, "-- old");

            assertThatThrownBy(() -> engine.generate(ComponentSpec.of(ComponentKind.MIGRATION, "create_orders_table")))
                .isInstanceOf(TargetExistsException.class);

            List<GeneratedComponent> generated = engine.generate(new ComponentSpec(ComponentKind.MIGRATION,
                "create_orders_table", Set.of(), Map.of(), true));

            assertThat(generated).singleElement().satisfies(component -> {
                assertThat(component.path()).isEqualTo(existing);
                assertThat(component.overwritten()).isTrue();
            });
            assertThat(Files.readString(existing)).contains("CREATE TABLE orders");
        }
    }

    @Test
    void conflictOnCompanion_writesNothing() throws IOException {
        Path factory = layout.pathFor(ComponentKind.FACTORY, "ProductFactory");
        Files.createDirectories(factory.getParent());
        Files.writeString(factory, "// mine");

        assertThatThrownBy(() -> engine.generate(spec(ComponentKind.MODEL, "Product",
            Set.of(Modifier.FACTORY), Map.of())))
            .isInstanceOf(TargetExistsException.class)
            .hasMessageContaining("--force");

        assertThat(layout.pathFor(ComponentKind.MODEL, "Product")).doesNotExist();
        assertThat(factory).hasContent("// mine");
    }

    @Test
    void invalidName_isRejectedBeforeWriting() {
        assertThatThrownBy(() -> engine.generate(ComponentSpec.of(ComponentKind.MODEL, "2Fast")))
            .isInstanceOf(InvalidNameException.class);
        assertThatThrownBy(() -> engine.generate(spec(ComponentKind.LISTENER, "SendMail", Set.of(),
            Map.of(ComponentSpec.EVENT, "order-placed"))))
            .isInstanceOf(InvalidNameException.class);

        assertThat(tempDir.resolve("src")).doesNotExist();
    }

    @Test
    void underscoreOnlyName_isRejectedBeforeWriting() {
        for (String name : List.of("_", "__", "_1")) {
            assertThatThrownBy(() -> engine.generate(ComponentSpec.of(ComponentKind.MODEL, name)))
                .isInstanceOf(InvalidNameException.class)
                .hasMessageContaining("'" + name + "'");
        }
        assertThatThrownBy(() -> engine.generate(spec(ComponentKind.LISTENER, "SendMail", Set.of(),
            Map.of(ComponentSpec.EVENT, "__"))))
            .isInstanceOf(InvalidNameException.class);

        assertThat(tempDir.resolve("src")).doesNotExist();
    }

    @Test
    void integrationTest_isPlacedAndTagged() throws IOException {
        engine.generate(spec(ComponentKind.TEST, "CheckoutTest", Set.of(Modifier.INTEGRATION), Map.of()));

        Path file = layout.pathFor(ComponentKind.TEST, "CheckoutTest", true);
        assertThat(Files.readString(file))
            .contains("package com.acme.shop.integration;")
            .contains("@Tag(\"integration\")");
    }

    @Test
    void listener_referencesEventClass() throws IOException {
        engine.generate(spec(ComponentKind.LISTENER, "SendReceipt", Set.of(), Map.of(ComponentSpec.EVENT, "OrderPlaced")));

        assertThat(Files.readString(layout.pathFor(ComponentKind.LISTENER, "SendReceipt")))
            .contains("import com.acme.shop.events.OrderPlaced;");
    }
}
