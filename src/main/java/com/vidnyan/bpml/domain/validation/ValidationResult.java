package com.vidnyan.bpml.domain.validation;

import com.fasterxml.jackson.annotation.JsonIgnore;

import java.util.Optional;

/**
 * Outcome of validating a model: success, or the first semantic error.
 */
public record ValidationResult(
    ValidationStatus status,
    SemanticError error,
    int passesRun
) {

    public enum ValidationStatus {
        VALID,
        INVALID
    }

    public static ValidationResult valid(int passesRun) {
        return new ValidationResult(ValidationStatus.VALID, null, passesRun);
    }

    public static ValidationResult invalid(SemanticError error, int passesRun) {
        return new ValidationResult(ValidationStatus.INVALID, error, passesRun);
    }

    public boolean isValid() {
        return status == ValidationStatus.VALID;
    }

    @JsonIgnore
    public Optional<SemanticError> getError() {
        return Optional.ofNullable(error);
    }
}
