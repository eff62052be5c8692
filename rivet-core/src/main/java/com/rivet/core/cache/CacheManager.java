package com.rivet.core.cache;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.rivet.core.config.ConfigDocument;
import com.rivet.core.exception.RivetException;
import com.rivet.core.layout.ProjectLayout;
import com.rivet.core.route.Route;
import com.rivet.core.util.FileUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Objects;

/**
 * Manages the project's on-disk caches.
 *
 * <p>{@link #clear()} empties every cache directory; {@link #cacheConfig(ConfigDocument)}
 * snapshots {@code rivet.yaml} as {@code bootstrap/cache/config.json} so the application
 * can skip YAML parsing at startup. {@link #cacheRoutes(List)} does the same for the
 * route files.
 */
public class CacheManager {

    private static final Logger log = LoggerFactory.getLogger(CacheManager.class);
    private static final ObjectMapper JSON_MAPPER = new ObjectMapper().enable(SerializationFeature.INDENT_OUTPUT);

    public static final String CONFIG_CACHE = "config.json";
    public static final String ROUTES_CACHE = "routes.json";

    private final Path projectRoot;

    public CacheManager(Path projectRoot) {
        this.projectRoot = Objects.requireNonNull(projectRoot, "projectRoot must not be null");
    }

    /**
     * Empties every cache directory, keeping the directories and their {@code .gitkeep}.
     *
     * @return number of entries removed
     */
    public int clear() {
        int removed = 0;
        try {
            for (String directory : ProjectLayout.CACHE_DIRECTORIES) {
                Path path = projectRoot.resolve(directory);
                boolean hadKeep = Files.exists(path.resolve(".gitkeep"));
                removed += FileUtils.deleteContents(path);
                if (hadKeep) {
                    Files.writeString(path.resolve(".gitkeep"), "");
                    removed--;
                }
            }
        } catch (IOException e) {
            throw new RivetException("Failed to clear caches in " + projectRoot, e);
        }
        log.info("Removed {} cache entries", removed);
        return removed;
    }

    /**
     * Writes the configuration snapshot.
     *
     * @param config configuration to cache
     * @return path of the written file
     */
    public Path cacheConfig(ConfigDocument config) {
        Path target = projectRoot.resolve(ProjectLayout.BOOTSTRAP_CACHE).resolve(CONFIG_CACHE);
        try {
            FileUtils.writeAtomically(target, JSON_MAPPER.writeValueAsString(config.root()));
        } catch (IOException e) {
            throw new RivetException("Failed to write " + target, e);
        }
        log.info("Cached configuration at {}", target);
        return target;
    }

    /**
     * Writes the route manifest.
     *
     * @param routes routes to cache
     * @return path of the written file
     */
    public Path cacheRoutes(List<Route> routes) {
        Path target = routesCache();
        try {
            FileUtils.writeAtomically(target, JSON_MAPPER.writeValueAsString(routes));
        } catch (IOException e) {
            throw new RivetException("Failed to write " + target, e);
        }
        log.info("Cached {} routes at {}", routes.size(), target);
        return target;
    }

    /**
     * Deletes the route manifest.
     *
     * @return true if a manifest was deleted, false if there was none
     */
    public boolean clearRoutes() {
        Path target = routesCache();
        try {
            return Files.deleteIfExists(target);
        } catch (IOException e) {
            throw new RivetException("Failed to delete " + target, e);
        }
    }

    public Path routesCache() {
        return projectRoot.resolve(ProjectLayout.BOOTSTRAP_CACHE).resolve(ROUTES_CACHE);
    }
}
