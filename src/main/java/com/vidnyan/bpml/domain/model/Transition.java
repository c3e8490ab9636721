package com.vidnyan.bpml.domain.model;

import lombok.Builder;

/**
 * Move between two states, optionally guarded by a role and a condition.
 */
@Builder
public record Transition(
    String name,
    String fromState,
    String toState,
    String role,
    String condition
) {
}
