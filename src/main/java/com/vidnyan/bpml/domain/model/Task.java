package com.vidnyan.bpml.domain.model;

import lombok.Builder;

import java.util.List;

/**
 * Step of a state-based process. Exactly one of {@code auto} and {@code role} must be set.
 */
@Builder
public record Task(
    String name,
    String description,
    String state,
    boolean auto,
    String role,
    List<String> entities,
    List<String> dependencies,
    Form form,
    List<String> candidateGroups,
    String priority
) {

    public Task {
        entities = entities == null ? List.of() : List.copyOf(entities);
        dependencies = dependencies == null ? List.of() : List.copyOf(dependencies);
        candidateGroups = candidateGroups == null ? List.of() : List.copyOf(candidateGroups);
    }

    public boolean hasRole() {
        return role != null && !role.isBlank();
    }
}
