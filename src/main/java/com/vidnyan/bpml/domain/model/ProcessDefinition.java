package com.vidnyan.bpml.domain.model;

import lombok.Builder;

import java.util.List;
import java.util.Optional;

/**
 * One business workflow. Carries both shapes the language allows: the flat
 * entities/roles/states/tasks/transitions form and the elements+flows form.
 * {@code sequence} is the implicit step ordering used when no explicit flows are given.
 */
@Builder
public record ProcessDefinition(
    String name,
    String description,
    String version,
    List<Entity> entities,
    List<Role> roles,
    List<State> states,
    List<Task> tasks,
    List<Transition> transitions,
    List<ProcessElement> elements,
    List<SequenceFlow> flows,
    List<String> sequence
) {

    public ProcessDefinition {
        entities = entities == null ? List.of() : List.copyOf(entities);
        roles = roles == null ? List.of() : List.copyOf(roles);
        states = states == null ? List.of() : List.copyOf(states);
        tasks = tasks == null ? List.of() : List.copyOf(tasks);
        transitions = transitions == null ? List.of() : List.copyOf(transitions);
        elements = elements == null ? List.of() : List.copyOf(elements);
        flows = flows == null ? List.of() : List.copyOf(flows);
        sequence = sequence == null ? List.of() : List.copyOf(sequence);
    }

    public Optional<ProcessElement> findElement(String elementName) {
        return elements.stream()
                .filter(e -> e.name().equals(elementName))
                .findFirst();
    }

    public List<ProcessElement> elementsOfKind(ElementKind kind) {
        return elements.stream()
                .filter(e -> e.kind() == kind)
                .toList();
    }
}
