package com.vidnyan.bpml.domain.model;

/**
 * Validation rule on a form field; type is checked against
 * {@link com.vidnyan.bpml.domain.vocabulary.ValidationType}.
 */
public record FieldValidation(
    String type,
    String value,
    String message
) {
}
