package com.rivet.cli;

import com.rivet.core.cache.CacheManager;
import com.rivet.core.command.CommandContext;
import com.rivet.core.command.CommandDefinition;
import com.rivet.core.command.CommandDescriptor;
import com.rivet.core.command.CommandRegistry;
import com.rivet.core.command.FlagDefinition;
import com.rivet.core.layout.ProjectLayout;
import com.rivet.core.route.Route;
import com.rivet.core.route.RouteTable;

import java.nio.file.Path;
import java.util.List;

/**
 * Route commands: {@code route:list}, {@code route:cache} and {@code route:clear}.
 *
 * <p>Routes are read from {@code src/main/resources/routes/*.routes}; the cache is
 * {@code bootstrap/cache/routes.json}.
 */
public class RouteCommand implements CommandFamily {

    private static final String ROW = "  %-7s %-30s %-20s %s%n";

    @Override
    public void register(CommandRegistry registry) {
        registry.register(CommandDefinition.builder("route", "list")
            .description("List all registered routes")
            .flag(FlagDefinition.string("method", "Only show routes for this HTTP method"))
            .flag(FlagDefinition.string("path", "Only show routes whose path contains this text"))
            .build(), this::list);
        registry.register(CommandDefinition.builder("route", "cache")
            .description("Create a route cache file for faster route registration")
            .build(), this::cache);
        registry.register(CommandDefinition.builder("route", "clear")
            .description("Remove the route cache file")
            .build(), this::clear);
    }

    private void list(CommandDescriptor command, CommandContext context) {
        List<Route> routes = RouteTable.filter(discover(context),
            command.stringFlag("method").orElse(null),
            command.stringFlag("path").orElse(null));
        if (routes.isEmpty()) {
            context.info("No routes found");
            return;
        }
        context.out().printf(ROW, "METHOD", "PATH", "CONTENT-TYPE", "FILE");
        for (Route route : routes) {
            context.out().printf(ROW, route.method(), route.path(), route.contentType(), route.source());
        }
        context.out().println();
        context.out().println("Showing " + routes.size() + " route" + (routes.size() == 1 ? "" : "s"));
    }

    private void cache(CommandDescriptor command, CommandContext context) {
        List<Route> routes = discover(context);
        Path root = context.requireProject();
        Path written = new CacheManager(root).cacheRoutes(routes);
        context.success("Routes cached (" + new ProjectLayout(root, ProjectLayout.DEFAULT_PACKAGE).display(written)
            + ", " + routes.size() + " routes)");
    }

    private void clear(CommandDescriptor command, CommandContext context) {
        if (new CacheManager(context.requireProject()).clearRoutes()) {
            context.success("Route cache cleared");
        } else {
            context.warning("Route cache file not found");
        }
    }

    private static List<Route> discover(CommandContext context) {
        return RouteTable.discover(context.requireProject().resolve(ProjectLayout.ROUTES));
    }
}
