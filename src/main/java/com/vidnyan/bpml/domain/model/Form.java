package com.vidnyan.bpml.domain.model;

import lombok.Builder;

import java.util.List;

@Builder
public record Form(
    String name,
    List<FormField> fields
) {

    public Form {
        fields = fields == null ? List.of() : List.copyOf(fields);
    }
}
