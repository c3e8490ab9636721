package com.vidnyan.bpml.domain.model;

import lombok.Builder;

/**
 * Directed edge between two elements of the same process, referenced by name.
 */
@Builder
public record SequenceFlow(
    String name,
    String source,
    String target,
    String condition
) {

    public static SequenceFlow of(String source, String target) {
        return new SequenceFlow(null, source, target, null);
    }
}
