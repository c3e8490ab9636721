package com.vidnyan.bpml.domain.model;

import lombok.Builder;

import java.util.List;

@Builder
public record FormField(
    String name,
    String label,
    String fieldType,
    boolean required,
    List<FieldValidation> validations
) {

    public FormField {
        validations = validations == null ? List.of() : List.copyOf(validations);
    }
}
