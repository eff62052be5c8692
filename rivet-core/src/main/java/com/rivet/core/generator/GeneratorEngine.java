package com.rivet.core.generator;

import com.rivet.core.exception.InvalidNameException;
import com.rivet.core.exception.RivetException;
import com.rivet.core.exception.TargetExistsException;
import com.rivet.core.generator.ComponentCatalog.MigrationShape;
import com.rivet.core.generator.ComponentRecipe.SideEffect;
import com.rivet.core.layout.ComponentKind;
import com.rivet.core.layout.ProjectLayout;
import com.rivet.core.template.TemplateRenderer;
import com.rivet.core.util.TextCase;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Generates application components from templates into the project layout.
 *
 * <p>A request is first expanded into a plan: the primary component followed by its
 * companions in recipe order (for a model: migration, factory, seeder). Every planned
 * target is checked before anything is written, so a conflict leaves the project as it
 * was. With {@code overwrite} set, existing files are replaced; an existing migration is
 * matched by name whatever its timestamp and rewritten in place.
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * GeneratorEngine engine = new GeneratorEngine(layout, new TemplateRenderer(), Clock.systemUTC());
 * ComponentSpec spec = new ComponentSpec(ComponentKind.MODEL, "User",
 *     Set.of(Modifier.MIGRATION), Map.of(), false);
 * List<GeneratedComponent> files = engine.generate(spec);
 * // models/User.java, db/migration/V20240101120000__create_users_table.sql
 * }</pre>
 */
public class GeneratorEngine {

    private static final Logger log = LoggerFactory.getLogger(GeneratorEngine.class);

    static final DateTimeFormatter MIGRATION_TIMESTAMP = DateTimeFormatter.ofPattern("yyyyMMddHHmmss");

    private final ProjectLayout layout;
    private final TemplateRenderer renderer;
    private final Clock clock;

    public GeneratorEngine(ProjectLayout layout, TemplateRenderer renderer, Clock clock) {
        this.layout = Objects.requireNonNull(layout, "layout must not be null");
        this.renderer = Objects.requireNonNull(renderer, "renderer must not be null");
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
    }

    /**
     * Generates a component and its companions.
     *
     * @param spec generation request
     * @return written files, primary component first
     * @throws InvalidNameException if a name is not a valid identifier
     * @throws TargetExistsException if a target exists and overwrite is off
     */
    public List<GeneratedComponent> generate(ComponentSpec spec) {
        Objects.requireNonNull(spec, "spec must not be null");
        List<PlannedFile> plan = new ArrayList<>();
        plan(spec, plan);

        for (PlannedFile planned : plan) {
            if (planned.exists() && !planned.spec().overwrite()) {
                throw new TargetExistsException(planned.target());
            }
        }

        List<GeneratedComponent> generated = new ArrayList<>();
        for (PlannedFile planned : plan) {
            generated.add(write(planned));
        }
        log.info("Generated {} file(s) for {} {}", generated.size(), spec.kind().id(), spec.name());
        return generated;
    }

    private void plan(ComponentSpec spec, List<PlannedFile> plan) {
        validateName(spec.name());
        spec.option(ComponentSpec.MODEL).ifPresent(this::validateName);
        spec.option(ComponentSpec.EVENT).ifPresent(this::validateName);

        ComponentRecipe recipe = ComponentCatalog.recipeFor(spec.kind());
        ComponentTemplate template = recipe.templateFor(spec);
        plan.add(spec.kind() == ComponentKind.MIGRATION
            ? planMigration(spec, template)
            : planClass(spec, template));

        for (SideEffect sideEffect : recipe.sideEffects()) {
            if (spec.has(sideEffect.trigger())) {
                plan(sideEffect.derive().apply(spec), plan);
            }
        }
    }

    private PlannedFile planClass(ComponentSpec spec, ComponentTemplate template) {
        NameVariants names = NameVariants.of(spec.name());
        boolean integration = spec.has(Modifier.INTEGRATION);
        Path target = layout.pathFor(spec.kind(), names.pascal(), integration);

        Map<String, Object> model = baseModel(spec, names, template);
        model.put("package", spec.kind() == ComponentKind.TEST
            ? layout.testPackage(integration)
            : layout.packageFor(spec.kind()));
        return new PlannedFile(spec, names.pascal(), template, target, Files.exists(target), model);
    }

    private PlannedFile planMigration(ComponentSpec spec, ComponentTemplate template) {
        NameVariants names = NameVariants.of(spec.name());
        MigrationShape shape = ComponentCatalog.migrationShape(spec);
        if (shape.table() != null) {
            validateName(shape.table());
        }

        Optional<Path> existing = layout.findMigration(spec.name());
        Path target = existing.orElseGet(() ->
            layout.migrationPath(LocalDateTime.now(clock).format(MIGRATION_TIMESTAMP), spec.name()));

        Map<String, Object> model = baseModel(spec, names, template);
        if (shape.table() != null) {
            model.put("table", TextCase.snake(shape.table()));
        }
        return new PlannedFile(spec, names.snake(), template, target, existing.isPresent(), model);
    }

    private Map<String, Object> baseModel(ComponentSpec spec, NameVariants names, ComponentTemplate template) {
        Map<String, Object> model = names.toModel();
        model.put("basePackage", layout.basePackage());
        model.put("templateVersion", template.version());
        for (Modifier modifier : Modifier.values()) {
            model.put(modifier.flag(), spec.has(modifier));
        }
        spec.option(ComponentSpec.MODEL).ifPresent(name -> {
            model.put("model", NameVariants.of(name).toModel());
            model.put("modelPackage", layout.packageFor(ComponentKind.MODEL));
        });
        spec.option(ComponentSpec.EVENT).ifPresent(name -> {
            model.put("event", NameVariants.of(name).toModel());
            model.put("eventPackage", layout.packageFor(ComponentKind.EVENT));
        });
        return model;
    }

    private GeneratedComponent write(PlannedFile planned) {
        String content = renderer.render(planned.template().path(), planned.model());
        Path target = planned.target();
        try {
            Path parent = target.getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            Files.writeString(target, content);
        } catch (IOException e) {
            throw new RivetException("Failed to write " + layout.display(target), e);
        }
        log.debug("Wrote {} using template {} v{}", target, planned.template().name(), planned.template().version());
        return new GeneratedComponent(planned.spec().kind(), planned.name(), target, planned.exists());
    }

    private void validateName(String name) {
        if (!TextCase.isValidIdentifier(name)) {
            throw new InvalidNameException(name);
        }
        String pascal = NameVariants.of(name).pascal();
        if (pascal.isEmpty() || !Character.isLetter(pascal.charAt(0))) {
            throw new InvalidNameException(name, "names must contain a letter before any digit, ignoring underscores");
        }
    }

    private record PlannedFile(
        ComponentSpec spec,
        String name,
        ComponentTemplate template,
        Path target,
        boolean exists,
        Map<String, Object> model
    ) {
    }
}
