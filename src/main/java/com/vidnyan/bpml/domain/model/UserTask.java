package com.vidnyan.bpml.domain.model;

import lombok.Builder;

import java.util.List;

/**
 * Task performed by a person. Priority is kept as the raw token from the source
 * and checked against {@link com.vidnyan.bpml.domain.vocabulary.Priority} during validation.
 */
@Builder
public record UserTask(
    String name,
    String description,
    Assignee assignee,
    List<String> candidateGroups,
    Form form,
    String priority
) implements ProcessElement {

    public UserTask {
        candidateGroups = candidateGroups == null ? List.of() : List.copyOf(candidateGroups);
    }

    @Override
    public ElementKind kind() {
        return ElementKind.USER_TASK;
    }
}
