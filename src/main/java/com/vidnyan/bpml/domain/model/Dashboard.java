package com.vidnyan.bpml.domain.model;

import lombok.Builder;

import java.util.List;

@Builder
public record Dashboard(
    String name,
    String title,
    List<Widget> widgets
) {

    public Dashboard {
        widgets = widgets == null ? List.of() : List.copyOf(widgets);
    }
}
