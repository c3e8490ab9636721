package com.vidnyan.bpml.domain.model;

import lombok.Builder;

import java.util.List;
import java.util.Optional;

/**
 * Root of a parsed BPML document. Immutable aggregate; built once by the parser front end.
 */
@Builder
public record Model(
    ProjectInfo projectInfo,
    List<ProcessDefinition> processes,
    List<Entity> entities,
    List<Role> roles,
    List<Dashboard> dashboards
) {

    public Model {
        processes = processes == null ? List.of() : List.copyOf(processes);
        entities = entities == null ? List.of() : List.copyOf(entities);
        roles = roles == null ? List.of() : List.copyOf(roles);
        dashboards = dashboards == null ? List.of() : List.copyOf(dashboards);
    }

    public Optional<ProcessDefinition> getProcess(String processName) {
        return processes.stream()
                .filter(p -> p.name().equals(processName))
                .findFirst();
    }
}
