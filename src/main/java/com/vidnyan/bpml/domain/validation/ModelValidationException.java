package com.vidnyan.bpml.domain.validation;

/**
 * Thrown by a validation pass on the first violation. Carries the typed error.
 */
public class ModelValidationException extends RuntimeException {

    private final SemanticError error;

    public ModelValidationException(SemanticError error) {
        super(error.message());
        this.error = error;
    }

    public static ModelValidationException of(ErrorKind kind, String message, String process, String element) {
        return new ModelValidationException(SemanticError.of(kind, message, process, element));
    }

    public SemanticError getError() {
        return error;
    }

    public ErrorKind getKind() {
        return error.kind();
    }
}
