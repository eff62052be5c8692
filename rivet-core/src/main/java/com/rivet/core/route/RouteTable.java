package com.rivet.core.route;

import com.rivet.core.exception.ParseException;
import com.rivet.core.exception.RivetException;
import com.rivet.core.util.FileUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Reads the routes an application declares in {@code src/main/resources/routes/*.routes}.
 *
 * <p>Each non-blank line that does not start with {@code #} is
 * {@code METHOD PATH [CONTENT-TYPE [BODY]]}, the same format the generated
 * {@code Application} serves. Files are read in name order, lines in file order.
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * List<Route> routes = RouteTable.discover(layout.root().resolve(ProjectLayout.ROUTES));
 * List<Route> gets = RouteTable.filter(routes, "get", "/api");
 * }</pre>
 */
public final class RouteTable {

    private static final Logger log = LoggerFactory.getLogger(RouteTable.class);

    public static final String FILE_GLOB = "*.routes";

    private static final Pattern METHOD = Pattern.compile("[A-Za-z]+");

    private RouteTable() {
        // Utility class
    }

    /**
     * Reads every route file in a directory.
     *
     * @param routesDirectory directory holding {@code *.routes} files
     * @return routes in file and line order, empty if the directory is missing
     * @throws ParseException if a line is not a valid route
     * @throws RivetException if a file cannot be read
     */
    public static List<Route> discover(Path routesDirectory) {
        List<Route> routes = new ArrayList<>();
        try {
            for (Path file : FileUtils.findFiles(routesDirectory, FILE_GLOB)) {
                routes.addAll(parse(file.getFileName().toString(), Files.readAllLines(file)));
            }
        } catch (IOException e) {
            throw new RivetException("Failed to read route files in " + routesDirectory, e);
        }
        log.debug("Discovered {} routes in {}", routes.size(), routesDirectory);
        return routes;
    }

    /**
     * Parses the lines of one route file.
     *
     * @param source file name, used in errors and on each route
     * @param lines file content
     * @return parsed routes
     * @throws ParseException if a line is not a valid route
     */
    public static List<Route> parse(String source, List<String> lines) {
        List<Route> routes = new ArrayList<>();
        for (int i = 0; i < lines.size(); i++) {
            String line = lines.get(i).trim();
            if (line.isEmpty() || line.startsWith("#")) {
                continue;
            }
            String[] parts = line.split("\\s+", 4);
            if (parts.length < 2 || !METHOD.matcher(parts[0]).matches() || !parts[1].startsWith("/")) {
                throw new ParseException(source + ":" + (i + 1) + ": expected 'METHOD /path [content-type [body]]' but found '"
                    + line + "'");
            }
            routes.add(new Route(
                parts[0].toUpperCase(Locale.ROOT),
                parts[1],
                parts.length > 2 ? parts[2] : null,
                parts.length > 3 ? parts[3] : null,
                source));
        }
        return routes;
    }

    /**
     * Narrows a route list.
     *
     * @param routes routes to filter
     * @param method method to keep, case-insensitive; null keeps all
     * @param pathFragment text the path must contain; null keeps all
     * @return matching routes in their original order
     */
    public static List<Route> filter(List<Route> routes, String method, String pathFragment) {
        return routes.stream()
            .filter(route -> method == null || route.method().equalsIgnoreCase(method))
            .filter(route -> pathFragment == null || route.path().contains(pathFragment))
            .toList();
    }
}
