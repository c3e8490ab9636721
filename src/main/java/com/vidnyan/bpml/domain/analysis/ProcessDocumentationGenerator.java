package com.vidnyan.bpml.domain.analysis;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.vidnyan.bpml.domain.model.*;
import com.vidnyan.bpml.domain.vocabulary.AttributeType;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Builds the documentation view of a process consumed by the doc templates.
 */
public final class ProcessDocumentationGenerator {

    private ProcessDocumentationGenerator() {
    }

    public static ProcessDocumentation document(ProcessDefinition process) {
        List<ElementDoc> elements = new ArrayList<>();
        Set<String> roles = new LinkedHashSet<>();
        Set<String> entities = new LinkedHashSet<>();

        for (ProcessElement element : process.elements()) {
            String assignee = null;
            List<String> groups = List.of();
            String implementation = null;

            switch (element.kind()) {
                case USER_TASK -> {
                    UserTask task = (UserTask) element;
                    if (task.assignee() != null && task.assignee().isRole()) {
                        roles.add(task.assignee().value());
                        assignee = "Role: " + task.assignee().value();
                    } else if (task.assignee() != null) {
                        assignee = task.assignee().type().name().toLowerCase() + ": " + task.assignee().value();
                    }
                    groups = task.candidateGroups();
                    roles.addAll(groups);
                }
                case SERVICE_TASK -> implementation = ((ServiceTask) element).implementation();
                case DATA_OBJECT -> {
                    String type = ((DataObject) element).dataType();
                    if (type != null && AttributeType.fromToken(type).isEmpty()) {
                        entities.add(type);
                    }
                }
                default -> {
                }
            }

            elements.add(new ElementDoc(element.name(), element.kind().displayName(),
                    element.description() != null ? element.description() : "",
                    assignee, groups, implementation));
        }

        for (Task task : process.tasks()) {
            if (task.hasRole()) {
                roles.add(task.role());
            }
            entities.addAll(task.entities());
        }

        List<FlowDoc> flows = process.flows().stream()
                .map(f -> new FlowDoc(f.source(), f.target(), f.condition()))
                .toList();

        return new ProcessDocumentation(
                process.name(),
                process.description() != null ? process.description() : "",
                process.version() != null ? process.version() : "1.0",
                elements,
                flows,
                List.copyOf(roles),
                List.copyOf(entities)
        );
    }

    public record ProcessDocumentation(
        String name,
        String description,
        String version,
        List<ElementDoc> elements,
        List<FlowDoc> flows,
        @JsonProperty("roles_involved") List<String> rolesInvolved,
        @JsonProperty("entities_used") List<String> entitiesUsed
    ) {}

    @JsonInclude(JsonInclude.Include.NON_NULL)
    public record ElementDoc(
        String name,
        String type,
        String description,
        String assignee,
        @JsonProperty("candidateGroups") List<String> candidateGroups,
        String implementation
    ) {}

    public record FlowDoc(String source, String target, String condition) {}
}
