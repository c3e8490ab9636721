package com.vidnyan.bpml.domain.model;

public record State(
    String name,
    String description
) {

    public static State named(String name) {
        return new State(name, null);
    }
}
