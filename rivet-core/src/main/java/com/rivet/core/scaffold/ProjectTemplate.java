package com.rivet.core.scaffold;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;
import java.util.Objects;

/**
 * A built-in project template, read from {@code /templates/project/<name>/manifest.yaml}.
 *
 * <p><b>Example manifest:</b>
 * <pre>{@code
 * name: api
 * description: JSON API with versioned routes
 * directories:
 *   - src/main/resources/routes
 * files:
 *   - source: common/pom.xml.ftl
 *     target: pom.xml
 *   - source: api/HealthController.java.ftl
 *     target: src/main/java/${packagePath}/http/controllers/HealthController.java
 * }</pre>
 *
 * @param name template identifier
 * @param description one-line description
 * @param directories extra directories to create
 * @param files files to render, sources relative to {@code /templates/project}
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record ProjectTemplate(
    @JsonProperty("name") String name,
    @JsonProperty("description") String description,
    @JsonProperty("directories") List<String> directories,
    @JsonProperty("files") List<TemplateFile> files
) {
    /** Built-in template identifiers. */
    public static final List<String> BUILT_IN = List.of("default", "api", "web", "minimal");

    public static final String DEFAULT = "default";

    /**
     * Compact constructor with validation.
     */
    public ProjectTemplate {
        Objects.requireNonNull(name, "name must not be null");
        directories = directories == null ? List.of() : List.copyOf(directories);
        files = files == null ? List.of() : List.copyOf(files);
    }

    /**
     * One file of a template.
     *
     * @param source template path relative to {@code /templates/project}
     * @param target destination relative to the project root, may use template variables
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record TemplateFile(
        @JsonProperty("source") String source,
        @JsonProperty("target") String target
    ) {
        /**
         * Compact constructor with validation.
         */
        public TemplateFile {
            Objects.requireNonNull(source, "source must not be null");
            Objects.requireNonNull(target, "target must not be null");
        }
    }
}
