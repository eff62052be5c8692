package com.rivet.cli;

import com.rivet.core.config.ConfigStore;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Tests for {@link ConfigCommand}.
 */
class ConfigCommandTest {

    @TempDir
    Path tempDir;

    private CliHarness cli;

    @BeforeEach
    void setUp() throws IOException {
        cli = new CliHarness(tempDir).withProject();
    }

    private ConfigStore store() {
        return new ConfigStore(cli.path("rivet.yaml"));
    }

    @Test
    void setThenGet_roundTripsTypedValue() {
        assertThat(cli.run("config:set", "server.port", "9090")).isZero();
        assertThat(cli.out()).contains("✓ Set server.port = 9090");
        assertThat(store().get("server.port").isIntegralNumber()).isTrue();

        assertThat(cli.run("config:get", "server.port")).isZero();
        assertThat(cli.out()).contains("server.port = 9090");
    }

    @Test
    void get_missingKey_fails() {
        assertThat(cli.run("config:get", "app.nope")).isEqualTo(1);
        assertThat(cli.err()).contains("Configuration key 'app.nope' not found");
    }

    @Test
    void set_throughScalar_fails() {
        assertThat(cli.run("config:set", "app.name.first", "x")).isEqualTo(1);
        assertThat(cli.err()).contains("is a value, not a section");
    }

    @Test
    void show_masksSecrets() {
        cli.run("config:set", "database.connections.default.password", "hunter2");

        assertThat(cli.run("config:show")).isZero();
        assertThat(cli.out())
            .contains("app.name = shop")
            .contains("database.connections.default.password = ********")
            .doesNotContain("hunter2");
    }

    @Test
    void generateKey_storesPrefixedKey() {
        assertThat(cli.run("config:generate-key")).isZero();

        assertThat(store().load().getString("app.key")).hasValueSatisfying(key -> assertThat(key).startsWith("base64:"));
    }

    @Test
    void validate_withoutKey_warnsButPasses() {
        assertThat(cli.run("config:validate")).isZero();
        assertThat(cli.out()).contains("⚠ 'app.key' is empty", "✓ Configuration is valid with 1 warning(s)");
    }

    @Test
    void validate_productionDebug_fails() {
        cli.run("config:set", "app.env", "production");

        assertThat(cli.run("config:validate")).isEqualTo(1);
        assertThat(cli.err()).contains("✗ app.debug should be false in production", "validation failed");
    }

    @Test
    void reset_requiresConfirmation() {
        cli.run("config:set", "app.debug", "false");

        assertThat(cli.withStdin("no\n").run("config:reset")).isZero();
        assertThat(cli.out()).contains("Operation cancelled");
        assertThat(store().get("app.debug").asBoolean()).isFalse();

        assertThat(cli.run("config:reset", "--force")).isZero();
        assertThat(store().get("app.debug").asBoolean()).isTrue();
        assertThat(store().load().getString("app.package")).contains("com.acme.shop");
    }
}
