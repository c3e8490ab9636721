package com.vidnyan.bpml.domain.model;

import lombok.Builder;

@Builder
public record Attribute(
    String name,
    String type,
    boolean isOptional,
    boolean isList
) implements EntityProperty {
}
