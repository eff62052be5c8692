package com.rivet.core.generator;

import com.rivet.core.util.Inflector;
import com.rivet.core.util.TextCase;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * A component name in every casing templates may need.
 *
 * @param original name as given
 * @param pascal PascalCase, used as the class name
 * @param camel camelCase
 * @param snake snake_case
 * @param kebab kebab-case
 * @param title Title Case
 * @param plural plural of the PascalCase form
 * @param singular singular of the PascalCase form
 * @param pluralSnake plural in snake_case, used for table names
 */
public record NameVariants(
    String original,
    String pascal,
    String camel,
    String snake,
    String kebab,
    String title,
    String plural,
    String singular,
    String pluralSnake
) {
    public static NameVariants of(String name) {
        String pascal = TextCase.pascal(name);
        String plural = Inflector.pluralize(pascal);
        return new NameVariants(
            name,
            pascal,
            TextCase.camel(name),
            TextCase.snake(name),
            TextCase.kebab(name),
            TextCase.title(name),
            plural,
            Inflector.singularize(pascal),
            TextCase.snake(plural)
        );
    }

    /**
     * Exposes the variants as a template data model.
     *
     * @return map from variant name to value
     */
    public Map<String, Object> toModel() {
        Map<String, Object> model = new LinkedHashMap<>();
        model.put("name", original);
        model.put("className", pascal);
        model.put("pascal", pascal);
        model.put("camel", camel);
        model.put("snake", snake);
        model.put("kebab", kebab);
        model.put("title", title);
        model.put("plural", plural);
        model.put("singular", singular);
        model.put("pluralSnake", pluralSnake);
        return model;
    }
}
