package com.vidnyan.bpml.domain.validation;

/**
 * One pass of the semantic validator.
 * Implementations throw {@link ModelValidationException} on the first violation
 * and must not modify the model.
 */
public interface ValidationPass {

    void validate(ValidationContext context);

    /**
     * Get the pass name for logging.
     */
    default String getName() {
        return getClass().getSimpleName();
    }
}
