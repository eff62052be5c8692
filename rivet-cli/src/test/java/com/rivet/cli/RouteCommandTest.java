package com.rivet.cli;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;

class RouteCommandTest {

    @TempDir
    Path tempDir;

    private CliHarness cli;

    @BeforeEach
    void setUp() throws IOException {
        cli = new CliHarness(tempDir).withProject();
        Path routes = Files.createDirectories(tempDir.resolve("src/main/resources/routes"));
        Files.writeString(routes.resolve("web.routes"), "# METHOD PATH CONTENT-TYPE BODY\nGET / text/html <h1>Shop</h1>\n");
        Files.writeString(routes.resolve("api.routes"), "GET /api/health application/json {}\nPOST /api/orders\n");
    }

    @Test
    void routeList_printsEveryRoute() {
        assertThat(cli.run("route:list")).isZero();

        assertThat(cli.out()).contains("METHOD", "/api/health", "/api/orders", "text/html", "web.routes", "Showing 3 routes");
        assertThat(cli.invocations()).isEmpty();
    }

    @Test
    void routeList_filtersByMethodAndPath() {
        assertThat(cli.run("route:list", "--method", "post", "--path", "/api")).isZero();

        assertThat(cli.out()).contains("/api/orders", "Showing 1 route").doesNotContain("/api/health");
    }

    @Test
    void routeList_noMatch_saysSo() {
        assertThat(cli.run("route:list", "--method", "PATCH")).isZero();

        assertThat(cli.out()).contains("ℹ No routes found");
    }

    @Test
    void routeCache_thenClear_writesAndRemovesManifest() throws IOException {
        assertThat(cli.run("route:cache")).isZero();

        Path manifest = tempDir.resolve("bootstrap/cache/routes.json");
        assertThat(cli.out()).contains("✓ Routes cached (bootstrap/cache/routes.json, 3 routes)");
        assertThat(Files.readString(manifest)).contains("/api/health", "/api/orders");

        assertThat(cli.run("route:clear")).isZero();
        assertThat(cli.out()).contains("✓ Route cache cleared");
        assertThat(manifest).doesNotExist();
    }

    @Test
    void routeClear_withoutManifest_warns() {
        assertThat(cli.run("route:clear")).isZero();

        assertThat(cli.out()).contains("⚠ Route cache file not found");
    }

    @Test
    void routeList_malformedRouteFile_failsWithLocation() throws IOException {
        Files.writeString(tempDir.resolve("src/main/resources/routes/web.routes"), "GET about\n");

        assertThat(cli.run("route:list")).isEqualTo(2);
        assertThat(cli.err()).contains("web.routes:1");
    }

    @Test
    void routeList_outsideProject_fails() {
        CliHarness outside = new CliHarness(tempDir.resolve("elsewhere"));

        assertThat(outside.run("route:list")).isEqualTo(1);
    }
}
