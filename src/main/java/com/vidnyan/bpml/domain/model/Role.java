package com.vidnyan.bpml.domain.model;

import lombok.Builder;

import java.util.List;

/**
 * Role with an optional parent (inheritance) and supervised roles.
 * Both relations point from the role above to the role below and must stay acyclic.
 */
@Builder
public record Role(
    String name,
    String description,
    String parent,
    List<String> supervises,
    List<String> permissions
) {

    public Role {
        supervises = supervises == null ? List.of() : List.copyOf(supervises);
        permissions = permissions == null ? List.of() : List.copyOf(permissions);
    }

    public static Role named(String name) {
        return new Role(name, null, null, List.of(), List.of());
    }
}
