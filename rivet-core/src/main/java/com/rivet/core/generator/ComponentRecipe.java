package com.rivet.core.generator;

import com.rivet.core.layout.ComponentKind;

import java.util.List;
import java.util.Objects;
import java.util.function.Function;

/**
 * How one component kind is generated: which template, and which companion components
 * follow it.
 *
 * @param kind component kind
 * @param templateSelector picks the template from the request's modifiers and options
 * @param sideEffects companions, in the order they are generated
 */
public record ComponentRecipe(
    ComponentKind kind,
    Function<ComponentSpec, ComponentTemplate> templateSelector,
    List<SideEffect> sideEffects
) {
    /**
     * Compact constructor with validation.
     */
    public ComponentRecipe {
        Objects.requireNonNull(kind, "kind must not be null");
        Objects.requireNonNull(templateSelector, "templateSelector must not be null");
        sideEffects = sideEffects == null ? List.of() : List.copyOf(sideEffects);
    }

    public ComponentTemplate templateFor(ComponentSpec spec) {
        return templateSelector.apply(spec);
    }

    /**
     * A companion component generated when a modifier is present.
     *
     * @param trigger modifier that enables it
     * @param derive builds the companion request from the primary one
     */
    public record SideEffect(Modifier trigger, Function<ComponentSpec, ComponentSpec> derive) {

        /**
         * Compact constructor with validation.
         */
        public SideEffect {
            Objects.requireNonNull(trigger, "trigger must not be null");
            Objects.requireNonNull(derive, "derive must not be null");
        }
    }
}
