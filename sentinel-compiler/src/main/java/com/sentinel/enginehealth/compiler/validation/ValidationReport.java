package com.sentinel.enginehealth.compiler.validation;

import java.util.List;

/**
 * Outcome of a validation pass. Errors make the subject unusable; warnings do not.
 */
public record ValidationReport(List<String> errors, List<String> warnings) {

    public ValidationReport {
        errors = List.copyOf(errors);
        warnings = List.copyOf(warnings);
    }

    public boolean isValid() {
        return errors.isEmpty();
    }
}
