package com.rivet.core.database;

import com.rivet.core.config.ConfigDefaults;
import com.rivet.core.config.ConfigDocument;
import com.rivet.core.exception.RivetException;
import com.rivet.core.process.ProcessInvocation;
import com.rivet.core.process.RecordingProcessRunner;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Tests for {@link DatabaseClient} and {@link DatabaseConnection}.
 */
class DatabaseClientTest {

    @TempDir
    Path tempDir;

    private final RecordingProcessRunner runner = new RecordingProcessRunner();

    private static DatabaseConnection connection(String driver, String password) {
        return new DatabaseConnection(driver, "db.local", "5432", "shop", "admin", password);
    }

    @Test
    void fromConfig_readsDefaultConnection() {
        ConfigDocument config = ConfigDefaults.create("shop", "app");
        config.set("database.connections.default.password", "s3cret");

        DatabaseConnection connection = DatabaseConnection.fromConfig(config);

        assertThat(connection.driver()).isEqualTo("mysql");
        assertThat(connection.port()).isEqualTo("3306");
        assertThat(connection.database()).isEqualTo("shop");
        assertThat(connection.password()).isEqualTo("s3cret");
    }

    @Test
    void create_postgres_usesPsqlWithPasswordInEnvironment() {
        new DatabaseClient(connection("postgres", "pw"), runner, tempDir).create();

        ProcessInvocation invocation = runner.invocations().get(0);
        assertThat(invocation.command()).containsExactly(
            "psql", "-h", "db.local", "-p", "5432", "-U", "admin", "-d", "postgres", "-c", "CREATE DATABASE \"shop\"");
        assertThat(invocation.environment()).containsEntry("PGPASSWORD", "pw");
        assertThat(invocation.command()).doesNotContain("pw");
    }

    @Test
    void drop_mysql_usesIfExists() {
        new DatabaseClient(connection("mysql", ""), runner, tempDir).drop();

        ProcessInvocation invocation = runner.invocations().get(0);
        assertThat(invocation.command()).startsWith("mysql").endsWith("DROP DATABASE IF EXISTS `shop`");
        assertThat(invocation.environment()).doesNotContainKey("MYSQL_PWD");
    }

    @Test
    void drop_sqlite_deletesDatabaseFile() throws IOException {
        Files.writeString(tempDir.resolve("shop"), "data");

        new DatabaseClient(connection("sqlite", ""), runner, tempDir).drop();

        assertThat(tempDir.resolve("shop")).doesNotExist();
        assertThat(runner.invocations()).isEmpty();
    }

    @Test
    void probe_mysql_selectsAgainstDatabase() {
        new DatabaseClient(connection("mysql", ""), runner, tempDir).probe();

        assertThat(runner.invocations().get(0).command()).contains("shop", "SELECT 1");
    }

    @Test
    void unsupportedDriver_throws() {
        assertThatThrownBy(() -> new DatabaseClient(connection("oracle", ""), runner, tempDir).create())
            .isInstanceOf(RivetException.class)
            .hasMessageContaining("oracle");
    }
}
