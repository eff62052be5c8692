package com.rivet.core.scaffold;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import com.rivet.core.config.ConfigDefaults;
import com.rivet.core.config.ConfigStore;
import com.rivet.core.exception.DestinationNotEmptyException;
import com.rivet.core.exception.InvalidNameException;
import com.rivet.core.exception.ParseException;
import com.rivet.core.exception.RivetException;
import com.rivet.core.layout.ProjectLayout;
import com.rivet.core.template.TemplateRenderer;
import com.rivet.core.util.FileUtils;
import com.rivet.core.util.TextCase;
import org.eclipse.jgit.api.Git;
import org.eclipse.jgit.api.errors.GitAPIException;
import org.eclipse.jgit.lib.PersonIdent;
import org.eclipse.jgit.lib.UserConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.regex.Pattern;
import java.util.stream.Stream;

/**
 * Creates a new Rivet project from a built-in or local template.
 *
 * <p>All checks (project name, package, template, destination) run before the first
 * write. Once writing starts there is no rollback: a failure leaves whatever was
 * written in place.
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * ProjectScaffolder scaffolder = new ProjectScaffolder(new TemplateRenderer());
 * ScaffoldResult result = scaffolder.scaffold(
 *     new ScaffoldRequest("shop", "api", Path.of("."), null, true));
 * // ./shop/pom.xml, ./shop/rivet.yaml, ... and a git repository with one commit
 * }</pre>
 */
public class ProjectScaffolder {

    private static final Logger log = LoggerFactory.getLogger(ProjectScaffolder.class);
    private static final ObjectMapper YAML_MAPPER = new ObjectMapper(new YAMLFactory());

    private static final Pattern PROJECT_NAME = Pattern.compile("[A-Za-z][A-Za-z0-9._-]*");
    private static final String TEMPLATE_ROOT = "project/";
    private static final String TEMPLATE_SUFFIX = ".ftl";
    private static final String KEEP_FILE = ".gitkeep";
    private static final String INITIAL_BRANCH = "main";
    private static final String INITIAL_COMMIT = "Initial commit";
    private static final String FALLBACK_NAME = "Rivet";
    private static final String FALLBACK_EMAIL = "rivet@localhost";

    private final TemplateRenderer renderer;

    public ProjectScaffolder(TemplateRenderer renderer) {
        this.renderer = Objects.requireNonNull(renderer, "renderer must not be null");
    }

    /**
     * Scaffolds a project.
     *
     * @param request scaffold parameters
     * @return what was written
     * @throws InvalidNameException if the project name or package is invalid
     * @throws ParseException if the template is unknown
     * @throws DestinationNotEmptyException if the target directory has content
     */
    public ScaffoldResult scaffold(ScaffoldRequest request) {
        if (!PROJECT_NAME.matcher(request.name()).matches()) {
            throw new InvalidNameException(request.name(),
                "project names must start with a letter and contain only letters, digits, '.', '-' and '_'");
        }
        String basePackage = request.basePackage() == null || request.basePackage().isBlank()
            ? defaultPackage(request.name())
            : request.basePackage();
        validatePackage(basePackage);

        String templateName = request.template() == null || request.template().isBlank()
            ? ProjectTemplate.DEFAULT
            : request.template();
        TemplateSource source = resolveTemplate(templateName);

        Path root = request.targetDirectory();
        try {
            if (!FileUtils.isMissingOrEmptyDirectory(root)) {
                throw new DestinationNotEmptyException(root);
            }
        } catch (IOException e) {
            throw new RivetException("Failed to inspect " + root, e);
        }

        log.info("Scaffolding project {} from template {} into {}", request.name(), templateName, root);
        Map<String, Object> model = dataModel(request.name(), basePackage, templateName);
        List<Path> written = new ArrayList<>();
        try {
            Files.createDirectories(root);
            if (source.manifest() != null) {
                writeBuiltIn(root, source.manifest(), model, written);
            } else {
                writeLocal(root, source.localDirectory(), model, written);
            }
            writeConfig(root, request.name(), basePackage, written);
            createDirectories(new ProjectLayout(root, basePackage), written);
        } catch (IOException e) {
            throw new RivetException("Failed to write project files in " + root, e);
        }

        boolean git = false;
        if (request.git()) {
            initializeGit(root);
            git = true;
        }
        return new ScaffoldResult(root, templateName, basePackage, written, git);
    }

    /**
     * Derives {@code com.example.<name>} from a project name.
     *
     * @param projectName project name
     * @return a valid Java package
     */
    public static String defaultPackage(String projectName) {
        String segment = projectName.toLowerCase(Locale.ROOT).replaceAll("[^a-z0-9]", "");
        if (segment.isEmpty() || !Character.isLetter(segment.charAt(0))) {
            segment = "app" + segment;
        }
        return "com.example." + segment;
    }

    private void validatePackage(String basePackage) {
        for (String segment : basePackage.split("\\.", -1)) {
            if (!TextCase.isValidIdentifier(segment)) {
                throw new InvalidNameException(basePackage,
                    "packages must be dot-separated identifiers, e.g. com.example.shop");
            }
        }
    }

    private TemplateSource resolveTemplate(String templateName) {
        if (ProjectTemplate.BUILT_IN.contains(templateName)) {
            return new TemplateSource(loadManifest(templateName), null);
        }
        Path local = Path.of(templateName);
        if (Files.isDirectory(local)) {
            return new TemplateSource(null, local);
        }
        throw new ParseException("Unknown template '" + templateName + "'. Available templates: "
            + String.join(", ", ProjectTemplate.BUILT_IN) + ", or a path to a template directory");
    }

    private ProjectTemplate loadManifest(String templateName) {
        String resource = "/templates/" + TEMPLATE_ROOT + templateName + "/manifest.yaml";
        try (InputStream in = getClass().getResourceAsStream(resource)) {
            if (in == null) {
                throw new RivetException("Missing bundled template manifest " + resource);
            }
            return YAML_MAPPER.readValue(in, ProjectTemplate.class);
        } catch (IOException e) {
            throw new RivetException("Failed to read template manifest " + resource, e);
        }
    }

    private Map<String, Object> dataModel(String name, String basePackage, String templateName) {
        Map<String, Object> model = new LinkedHashMap<>();
        model.put("name", name);
        model.put("title", TextCase.title(name));
        model.put("artifactId", TextCase.kebab(name).toLowerCase(Locale.ROOT));
        model.put("snake", TextCase.snake(name));
        model.put("basePackage", basePackage);
        model.put("packagePath", basePackage.replace('.', '/'));
        model.put("template", templateName);
        return model;
    }

    private void writeBuiltIn(Path root, ProjectTemplate manifest, Map<String, Object> model, List<Path> written)
        throws IOException {
        for (String directory : manifest.directories()) {
            Files.createDirectories(root.resolve(renderPath(directory, model)));
        }
        for (ProjectTemplate.TemplateFile file : manifest.files()) {
            String content = renderer.render(TEMPLATE_ROOT + file.source(), model);
            write(root, renderPath(file.target(), model), content, written);
        }
    }

    private void writeLocal(Path root, Path templateDirectory, Map<String, Object> model, List<Path> written)
        throws IOException {
        List<Path> files;
        try (Stream<Path> paths = Files.walk(templateDirectory)) {
            files = paths.filter(Files::isRegularFile).sorted().toList();
        }
        for (Path file : files) {
            String relative = renderPath(templateDirectory.relativize(file).toString().replace('\\', '/'), model);
            if (relative.endsWith(TEMPLATE_SUFFIX)) {
                String content = renderer.renderString(relative, Files.readString(file), model);
                write(root, relative.substring(0, relative.length() - TEMPLATE_SUFFIX.length()), content, written);
            } else {
                Path target = root.resolve(relative);
                Files.createDirectories(target.getParent());
                Files.copy(file, target);
                written.add(root.relativize(target));
            }
        }
    }

    private void writeConfig(Path root, String name, String basePackage, List<Path> written) {
        Path config = root.resolve(ProjectLayout.CONFIG_FILE);
        if (Files.exists(config)) {
            return;
        }
        new ConfigStore(config).save(ConfigDefaults.create(name, basePackage));
        written.add(root.relativize(config));
    }

    private void createDirectories(ProjectLayout layout, List<Path> written) throws IOException {
        for (Path directory : layout.canonicalDirectories()) {
            Files.createDirectories(directory);
            if (FileUtils.isMissingOrEmptyDirectory(directory)) {
                Path keep = directory.resolve(KEEP_FILE);
                Files.writeString(keep, "");
                written.add(layout.root().relativize(keep));
            }
        }
    }

    private void write(Path root, String relative, String content, List<Path> written) throws IOException {
        Path target = root.resolve(relative);
        Path parent = target.getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        Files.writeString(target, content);
        written.add(root.relativize(target));
        log.debug("Wrote {}", target);
    }

    private String renderPath(String path, Map<String, Object> model) {
        return path.contains("${") ? renderer.renderString("path", path, model) : path;
    }

    /**
     * Creates a repository in the project root and commits every written file.
     *
     * <p>The author comes from the user's git configuration; without one the commit is
     * attributed to Rivet.
     */
    private void initializeGit(Path root) {
        log.info("Initializing git repository in {}", root);
        try (Git git = Git.init().setDirectory(root.toFile()).setInitialBranch(INITIAL_BRANCH).call()) {
            git.add().addFilepattern(".").call();
            PersonIdent author = author(git);
            git.commit()
                .setMessage(INITIAL_COMMIT)
                .setAuthor(author)
                .setCommitter(author)
                .setSign(false)
                .call();
        } catch (GitAPIException e) {
            throw new RivetException("Failed to initialize git repository in " + root + ": " + e.getMessage(), e);
        }
    }

    private static PersonIdent author(Git git) {
        UserConfig user = git.getRepository().getConfig().get(UserConfig.KEY);
        if (user.isAuthorNameImplicit() || user.isAuthorEmailImplicit()) {
            return new PersonIdent(FALLBACK_NAME, FALLBACK_EMAIL);
        }
        return new PersonIdent(user.getAuthorName(), user.getAuthorEmail());
    }

    private record TemplateSource(ProjectTemplate manifest, Path localDirectory) {
    }
}
