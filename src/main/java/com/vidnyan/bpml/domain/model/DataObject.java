package com.vidnyan.bpml.domain.model;

import lombok.Builder;

/**
 * Data carried through a process. dataType is a built-in type or an entity name.
 */
@Builder
public record DataObject(
    String name,
    String description,
    String dataType,
    boolean isList
) implements ProcessElement {

    @Override
    public ElementKind kind() {
        return ElementKind.DATA_OBJECT;
    }
}
