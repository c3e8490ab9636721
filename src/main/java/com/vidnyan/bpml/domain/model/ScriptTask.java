package com.vidnyan.bpml.domain.model;

import lombok.Builder;

@Builder
public record ScriptTask(
    String name,
    String description,
    String script,
    String language,
    Integer retryCount,
    Integer timeout
) implements ProcessElement {

    @Override
    public ElementKind kind() {
        return ElementKind.SCRIPT_TASK;
    }
}
