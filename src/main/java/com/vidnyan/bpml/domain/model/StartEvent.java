package com.vidnyan.bpml.domain.model;

import lombok.Builder;

@Builder
public record StartEvent(
    String name,
    String description
) implements ProcessElement {

    @Override
    public ElementKind kind() {
        return ElementKind.START_EVENT;
    }
}
