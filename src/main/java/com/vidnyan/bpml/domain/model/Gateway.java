package com.vidnyan.bpml.domain.model;

import lombok.Builder;

import java.util.List;

/**
 * Branching or merging element. One record covers the exclusive, inclusive and
 * parallel variants; {@code kind} tells them apart.
 */
@Builder
public record Gateway(
    String name,
    String description,
    ElementKind kind,
    List<GatewayCondition> conditions,
    String joinType
) implements ProcessElement {

    public Gateway {
        if (kind == null || !kind.isGateway()) {
            throw new IllegalArgumentException("Gateway '" + name + "' needs a gateway kind, got " + kind);
        }
        conditions = conditions == null ? List.of() : List.copyOf(conditions);
    }

    public static Gateway exclusive(String name, List<GatewayCondition> conditions) {
        return new Gateway(name, null, ElementKind.EXCLUSIVE_GATEWAY, conditions, null);
    }

    public static Gateway inclusive(String name, List<GatewayCondition> conditions) {
        return new Gateway(name, null, ElementKind.INCLUSIVE_GATEWAY, conditions, null);
    }

    public static Gateway parallel(String name) {
        return new Gateway(name, null, ElementKind.PARALLEL_GATEWAY, List.of(), null);
    }
}
