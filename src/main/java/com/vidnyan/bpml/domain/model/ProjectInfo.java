package com.vidnyan.bpml.domain.model;

public record ProjectInfo(
    String name,
    String version,
    String description
) {

    public static ProjectInfo named(String name) {
        return new ProjectInfo(name, null, null);
    }
}
