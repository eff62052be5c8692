package com.rivet.core.config;

import java.util.List;

/**
 * Outcome of validating a configuration.
 *
 * @param errors problems that make the configuration unusable
 * @param warnings problems worth fixing
 */
public record ValidationReport(List<String> errors, List<String> warnings) {

    /**
     * Compact constructor with validation.
     */
    public ValidationReport {
        errors = errors == null ? List.of() : List.copyOf(errors);
        warnings = warnings == null ? List.of() : List.copyOf(warnings);
    }

    public boolean isValid() {
        return errors.isEmpty();
    }

    public boolean isClean() {
        return errors.isEmpty() && warnings.isEmpty();
    }
}
