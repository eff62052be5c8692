package com.rivet.core.config;

import com.fasterxml.jackson.databind.JsonNode;
import com.rivet.core.exception.KeyNotFoundException;
import com.rivet.core.exception.ParseException;
import com.rivet.core.exception.RivetException;
import com.rivet.core.exception.TypeConflictException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Tests for {@link ConfigStore} and {@link ConfigDocument}.
 */
class ConfigStoreTest {

    @TempDir
    Path tempDir;

    private Path configFile;
    private ConfigStore store;

    @BeforeEach
    void setUp() throws IOException {
        configFile = tempDir.resolve("rivet.yaml");
        Files.writeString(configFile, """
            app:
              name: blog
              debug: true
            database:
              connections:
                default:
                  driver: mysql
                  port: 3306
            """);
        store = new ConfigStore(configFile);
    }

    @Test
    void get_nestedKey_returnsTypedNode() {
        JsonNode port = store.get("database.connections.default.port");

        assertThat(port.isIntegralNumber()).isTrue();
        assertThat(port.asInt()).isEqualTo(3306);
    }

    @Test
    void get_missingKey_throwsKeyNotFound() {
        assertThatThrownBy(() -> store.get("app.missing"))
            .isInstanceOf(KeyNotFoundException.class)
            .hasMessageContaining("app.missing");
    }

    @Test
    void set_coercesValueAndPersists() {
        Object stored = store.set("app.debug", "FALSE");

        assertThat(stored).isEqualTo(Boolean.FALSE);
        assertThat(store.get("app.debug").isBoolean()).isTrue();
        assertThat(store.get("app.debug").asBoolean()).isFalse();
    }

    @Test
    void set_numberLikeString_reloadsAsText() throws IOException {
        List<String> values = List.of("0x10", "1_000", "0o17", "0b101", "1:20", ".inf", "-.inf", ".NaN", "1.2.3");
        for (int i = 0; i < values.size(); i++) {
            store.set("app.values.v" + i, values.get(i));
        }

        ConfigDocument reloaded = new ConfigStore(configFile).load();
        for (int i = 0; i < values.size(); i++) {
            JsonNode node = reloaded.get("app.values.v" + i);
            assertThat(node.isTextual()).as("app.values.v%d", i).isTrue();
            assertThat(node.asText()).isEqualTo(values.get(i));
        }
        assertThat(Files.readString(configFile)).contains("v0: \"0x10\"", "name: blog");
    }

    @Test
    void set_newNestedKey_createsIntermediateSections() {
        store.set("mail.smtp.port", "587");

        ConfigDocument reloaded = store.load();
        assertThat(reloaded.get("mail.smtp.port").asLong()).isEqualTo(587L);
        assertThat(reloaded.getString("app.name")).contains("blog");
    }

    @Test
    void set_throughScalar_throwsTypeConflictAndLeavesFileUnchanged() throws IOException {
        String before = Files.readString(configFile);

        assertThatThrownBy(() -> store.set("app.name.first", "x"))
            .isInstanceOf(TypeConflictException.class)
            .hasMessageContaining("app.name");
        assertThat(Files.readString(configFile)).isEqualTo(before);
    }

    @Test
    void save_preservesKeyOrder() throws IOException {
        store.set("app.url", "http://localhost:8080");

        String yaml = Files.readString(configFile);
        assertThat(yaml.indexOf("app:")).isLessThan(yaml.indexOf("database:"));
        assertThat(yaml.indexOf("name:")).isLessThan(yaml.indexOf("url:"));
    }

    @Test
    void load_missingFile_throws() {
        assertThatThrownBy(() -> new ConfigStore(tempDir.resolve("absent.yaml")).load())
            .isInstanceOf(RivetException.class);
    }

    @Test
    void load_nonMappingDocument_throwsParseException() throws IOException {
        Files.writeString(configFile, "- just\n- a list\n");

        assertThatThrownBy(() -> store.load()).isInstanceOf(ParseException.class);
    }

    @Test
    void leaves_flattensToDottedKeys() {
        assertThat(store.load().leaves()).containsOnlyKeys(
            "app.name", "app.debug", "database.connections.default.driver", "database.connections.default.port");
    }

    @Test
    void invalidKey_throwsParseException() {
        assertThatThrownBy(() -> ConfigDocument.empty().set("app..name", "x")).isInstanceOf(ParseException.class);
    }
}
