package com.vidnyan.bpml.domain.model;

import lombok.Builder;

/**
 * Reference from one entity to another. cardinality holds the raw token, e.g. {@code @1..*}.
 */
@Builder
public record Relationship(
    String name,
    String target,
    String cardinality,
    boolean isOptional
) implements EntityProperty {
}
