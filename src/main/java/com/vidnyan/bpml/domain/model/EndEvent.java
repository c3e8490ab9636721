package com.vidnyan.bpml.domain.model;

import lombok.Builder;

@Builder
public record EndEvent(
    String name,
    String description
) implements ProcessElement {

    @Override
    public ElementKind kind() {
        return ElementKind.END_EVENT;
    }
}
