package com.rivet.core.generator;

import com.rivet.core.generator.ComponentRecipe.SideEffect;
import com.rivet.core.layout.ComponentKind;

import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Lookup table from component kind to its recipe.
 */
public final class ComponentCatalog {

    private static final Pattern CREATE_TABLE = Pattern.compile("^create_(\\w+?)_table$");
    private static final Pattern ALTER_TABLE = Pattern.compile("^\\w+?_(?:to|from|in|on)_(\\w+?)_table$");

    private static final Map<ComponentKind, ComponentRecipe> RECIPES = buildRecipes();

    private ComponentCatalog() {
        // Utility class
    }

    /**
     * Returns the recipe for a kind.
     *
     * @param kind component kind
     * @return recipe, never null
     */
    public static ComponentRecipe recipeFor(ComponentKind kind) {
        ComponentRecipe recipe = RECIPES.get(kind);
        if (recipe == null) {
            throw new IllegalStateException("No recipe registered for " + kind);
        }
        return recipe;
    }

    public static Map<ComponentKind, ComponentRecipe> recipes() {
        return Collections.unmodifiableMap(RECIPES);
    }

    /**
     * Resolves how a migration is shaped from its options and name.
     *
     * <p>{@code --create} wins over {@code --table}; without either, names like
     * {@code create_users_table} and {@code add_email_to_users_table} are recognised.
     *
     * @param spec migration request
     * @return the migration shape
     */
    public static MigrationShape migrationShape(ComponentSpec spec) {
        if (spec.option(ComponentSpec.CREATE).isPresent()) {
            return new MigrationShape("migration_create", spec.option(ComponentSpec.CREATE).get());
        }
        if (spec.option(ComponentSpec.TABLE).isPresent()) {
            return new MigrationShape("migration_alter", spec.option(ComponentSpec.TABLE).get());
        }
        String snake = NameVariants.of(spec.name()).snake();
        Matcher create = CREATE_TABLE.matcher(snake);
        if (create.matches()) {
            return new MigrationShape("migration_create", create.group(1));
        }
        Matcher alter = ALTER_TABLE.matcher(snake);
        if (alter.matches()) {
            return new MigrationShape("migration_alter", alter.group(1));
        }
        return new MigrationShape("migration_blank", null);
    }

    /**
     * Template and table resolved for a migration.
     *
     * @param template template name
     * @param table table the migration touches, null for blank migrations
     */
    public record MigrationShape(String template, String table) {
    }

    private static Map<ComponentKind, ComponentRecipe> buildRecipes() {
        Map<ComponentKind, ComponentRecipe> recipes = new EnumMap<>(ComponentKind.class);

        recipes.put(ComponentKind.CONTROLLER, new ComponentRecipe(ComponentKind.CONTROLLER, spec -> {
            if (spec.has(Modifier.API)) {
                return ComponentTemplate.named("controller_api");
            }
            if (spec.has(Modifier.RESOURCE)) {
                return ComponentTemplate.named("controller_resource");
            }
            return ComponentTemplate.named("controller");
        }, List.of()));

        recipes.put(ComponentKind.MODEL, new ComponentRecipe(ComponentKind.MODEL,
            spec -> ComponentTemplate.named("model"),
            List.of(
                new SideEffect(Modifier.MIGRATION, ComponentCatalog::migrationFor),
                new SideEffect(Modifier.FACTORY, model -> companion(ComponentKind.FACTORY, model, "Factory")),
                new SideEffect(Modifier.SEEDER, model -> companion(ComponentKind.SEEDER, model, "Seeder"))
            )));

        recipes.put(ComponentKind.RESOURCE, new ComponentRecipe(ComponentKind.RESOURCE,
            spec -> ComponentTemplate.named(spec.has(Modifier.COLLECTION) ? "resource_collection" : "resource"),
            List.of()));

        recipes.put(ComponentKind.JOB, new ComponentRecipe(ComponentKind.JOB,
            spec -> ComponentTemplate.named(spec.has(Modifier.SYNC) ? "job_sync" : "job_queued"),
            List.of()));

        recipes.put(ComponentKind.TEST, new ComponentRecipe(ComponentKind.TEST,
            spec -> ComponentTemplate.named(spec.has(Modifier.INTEGRATION) ? "test_integration" : "test_unit"),
            List.of()));

        recipes.put(ComponentKind.MIGRATION, new ComponentRecipe(ComponentKind.MIGRATION,
            spec -> ComponentTemplate.named(migrationShape(spec).template()),
            List.of()));

        for (ComponentKind kind : List.of(ComponentKind.MIDDLEWARE, ComponentKind.REQUEST, ComponentKind.SEEDER,
            ComponentKind.FACTORY, ComponentKind.EVENT, ComponentKind.LISTENER, ComponentKind.COMMAND,
            ComponentKind.POLICY)) {
            String template = kind.id();
            recipes.put(kind, new ComponentRecipe(kind, spec -> ComponentTemplate.named(template), List.of()));
        }
        return recipes;
    }

    private static ComponentSpec migrationFor(ComponentSpec model) {
        String table = NameVariants.of(model.name()).pluralSnake();
        return new ComponentSpec(ComponentKind.MIGRATION, "create_" + table + "_table", Set.of(),
            Map.of(ComponentSpec.CREATE, table), model.overwrite());
    }

    private static ComponentSpec companion(ComponentKind kind, ComponentSpec model, String suffix) {
        String className = NameVariants.of(model.name()).pascal();
        return new ComponentSpec(kind, className + suffix, Set.of(),
            Map.of(ComponentSpec.MODEL, className), model.overwrite());
    }
}
