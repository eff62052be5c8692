package com.rivet.core.layout;

import com.rivet.core.util.TextCase;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Canonical directory layout of a Rivet project.
 *
 * <p>Every generated file path is derived here from the component kind and the project's
 * base package; nothing else in Rivet builds project paths by hand.
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * ProjectLayout layout = new ProjectLayout(Path.of("."), "com.example.shop");
 * layout.pathFor(ComponentKind.CONTROLLER, "UserController");
 * // ./src/main/java/com/example/shop/http/controllers/UserController.java
 * }</pre>
 */
public final class ProjectLayout {

    public static final String BUILD_FILE = "pom.xml";
    public static final String CONFIG_FILE = "rivet.yaml";
    public static final String DEFAULT_PACKAGE = "app";

    public static final String MAIN_JAVA = "src/main/java";
    public static final String TEST_JAVA = "src/test/java";
    public static final String MIGRATIONS = "src/main/resources/db/migration";
    public static final String ROUTES = "src/main/resources/routes";
    public static final String VIEWS = "src/main/resources/views";
    public static final String DEPLOY = "deploy";
    public static final String BOOTSTRAP_CACHE = "bootstrap/cache";

    /** Directories emptied by {@code cache:clear}. */
    public static final List<String> CACHE_DIRECTORIES = List.of(
        BOOTSTRAP_CACHE,
        "storage/cache",
        "storage/framework/cache",
        "storage/framework/sessions",
        "storage/framework/views"
    );

    /** Runtime directories every project carries. */
    public static final List<String> STORAGE_DIRECTORIES = List.of(
        "storage/app",
        "storage/logs",
        "storage/cache",
        "storage/framework/cache",
        "storage/framework/sessions",
        "storage/framework/views",
        BOOTSTRAP_CACHE
    );

    private final Path root;
    private final String basePackage;

    /**
     * Creates a layout rooted at a project directory.
     *
     * @param root project root
     * @param basePackage base Java package, {@value #DEFAULT_PACKAGE} when null or blank
     */
    public ProjectLayout(Path root, String basePackage) {
        this.root = Objects.requireNonNull(root, "root must not be null");
        this.basePackage = basePackage == null || basePackage.isBlank() ? DEFAULT_PACKAGE : basePackage;
    }

    public Path root() {
        return root;
    }

    public String basePackage() {
        return basePackage;
    }

    /**
     * Returns the Java package a component kind is generated into.
     *
     * @param kind component kind with a sub-package
     * @return fully qualified package name
     */
    public String packageFor(ComponentKind kind) {
        if (kind.subPackage() == null) {
            throw new IllegalArgumentException("Component kind " + kind.id() + " is not placed by package");
        }
        return basePackage + "." + kind.subPackage();
    }

    /**
     * Returns the package for generated tests.
     *
     * @param integration true for integration tests
     * @return fully qualified package name
     */
    public String testPackage(boolean integration) {
        return basePackage + (integration ? ".integration" : ".unit");
    }

    /**
     * Returns the source file for a class of the given kind.
     *
     * @param kind component kind, not {@link ComponentKind#MIGRATION}
     * @param className simple class name
     * @return absolute path of the {@code .java} file
     */
    public Path pathFor(ComponentKind kind, String className) {
        return pathFor(kind, className, false);
    }

    /**
     * Returns the source file for a class of the given kind.
     *
     * @param kind component kind, not {@link ComponentKind#MIGRATION}
     * @param className simple class name
     * @param integration for {@link ComponentKind#TEST}, whether the test is an integration test
     * @return absolute path of the {@code .java} file
     */
    public Path pathFor(ComponentKind kind, String className, boolean integration) {
        if (kind == ComponentKind.MIGRATION) {
            throw new IllegalArgumentException("Migrations are placed with migrationPath");
        }
        if (kind == ComponentKind.TEST) {
            return packageDirectory(TEST_JAVA, testPackage(integration)).resolve(className + ".java");
        }
        return packageDirectory(MAIN_JAVA, packageFor(kind)).resolve(className + ".java");
    }

    /**
     * Returns the path of a versioned migration script.
     *
     * @param timestamp version timestamp ({@code yyyyMMddHHmmss})
     * @param name migration name in any casing
     * @return path {@code V<timestamp>__<snake_name>.sql} in the migrations directory
     */
    public Path migrationPath(String timestamp, String name) {
        return migrationsDirectory().resolve("V" + timestamp + "__" + TextCase.snake(name) + ".sql");
    }

    /**
     * Finds an existing migration by name, whatever its timestamp.
     *
     * @param name migration name in any casing
     * @return the first matching script, if any
     */
    public Optional<Path> findMigration(String name) {
        Path directory = migrationsDirectory();
        if (!Files.isDirectory(directory)) {
            return Optional.empty();
        }
        String suffix = "__" + TextCase.snake(name) + ".sql";
        try (DirectoryStream<Path> stream = Files.newDirectoryStream(directory, "V*" + suffix)) {
            for (Path candidate : stream) {
                return Optional.of(candidate);
            }
            return Optional.empty();
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to list migrations in " + directory, e);
        }
    }

    public Path migrationsDirectory() {
        return root.resolve(MIGRATIONS);
    }

    public Path configFile() {
        return root.resolve(CONFIG_FILE);
    }

    public Path buildFile() {
        return root.resolve(BUILD_FILE);
    }

    /**
     * Returns the source directories generated components live in, main and test.
     *
     * @return absolute directories, in component-kind order
     */
    public List<Path> componentDirectories() {
        List<Path> directories = new ArrayList<>();
        for (ComponentKind kind : ComponentKind.values()) {
            if (kind == ComponentKind.MIGRATION) {
                directories.add(migrationsDirectory());
            } else if (kind == ComponentKind.TEST) {
                directories.add(packageDirectory(TEST_JAVA, testPackage(false)));
                directories.add(packageDirectory(TEST_JAVA, testPackage(true)));
            } else {
                directories.add(packageDirectory(MAIN_JAVA, packageFor(kind)));
            }
        }
        return directories;
    }

    /**
     * Returns every directory a fresh project should contain.
     *
     * @return absolute directories
     */
    public List<Path> canonicalDirectories() {
        List<Path> directories = new ArrayList<>(componentDirectories());
        directories.add(root.resolve(ROUTES));
        directories.add(root.resolve(VIEWS));
        directories.add(root.resolve(DEPLOY));
        for (String storage : STORAGE_DIRECTORIES) {
            directories.add(root.resolve(storage));
        }
        return directories;
    }

    /**
     * Makes a path relative to the project root for display.
     *
     * @param path absolute or root-relative path
     * @return path relative to the root, with forward slashes
     */
    public String display(Path path) {
        Path relative = path.isAbsolute() ? root.toAbsolutePath().normalize().relativize(path.toAbsolutePath().normalize()) : path;
        return relative.toString().replace('\\', '/');
    }

    private Path packageDirectory(String sourceRoot, String packageName) {
        return root.resolve(sourceRoot).resolve(packageName.replace('.', '/'));
    }
}
