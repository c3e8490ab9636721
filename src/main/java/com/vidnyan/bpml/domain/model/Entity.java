package com.vidnyan.bpml.domain.model;

import lombok.Builder;

import java.util.List;

@Builder
public record Entity(
    String name,
    List<EntityProperty> properties
) {

    public Entity {
        properties = properties == null ? List.of() : List.copyOf(properties);
    }

    public List<Attribute> attributes() {
        return properties.stream()
                .filter(Attribute.class::isInstance)
                .map(Attribute.class::cast)
                .toList();
    }

    public List<Relationship> relationships() {
        return properties.stream()
                .filter(Relationship.class::isInstance)
                .map(Relationship.class::cast)
                .toList();
    }
}
