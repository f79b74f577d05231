package io.flakeedit.core.validate;

import java.util.List;

/** Outcome of {@link Validator#validate(String)}. An empty error list means the text is safe to persist. */
public record ValidationResult(List<ValidationError> errors) {

    public ValidationResult {
        errors = List.copyOf(errors);
    }

    public boolean isOk() {
        return errors.isEmpty();
    }

    public boolean hasErrors() {
        return !errors.isEmpty();
    }
}
