package com.vidnyan.bpml.domain.analysis;

/**
 * Element whose flow connections break the topology rules. Reported, never thrown.
 */
public record OrphanedElement(
    String element,
    String type,
    String issue
) {
}
