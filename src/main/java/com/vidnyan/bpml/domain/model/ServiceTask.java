package com.vidnyan.bpml.domain.model;

import lombok.Builder;

/**
 * Automated task delegating to a named implementation.
 * retryCount and timeout are optional; onFailure names the failure handler, if any.
 */
@Builder
public record ServiceTask(
    String name,
    String description,
    String implementation,
    Integer retryCount,
    Integer timeout,
    String onFailure
) implements ProcessElement {

    @Override
    public ElementKind kind() {
        return ElementKind.SERVICE_TASK;
    }

    public boolean hasErrorHandling() {
        return (onFailure != null && !onFailure.isBlank())
                || (retryCount != null && retryCount > 0);
    }
}
