package com.vidnyan.bpml.domain.registry;

import com.vidnyan.bpml.domain.model.Entity;
import com.vidnyan.bpml.domain.model.ProcessDefinition;
import com.vidnyan.bpml.domain.model.ProcessElement;
import com.vidnyan.bpml.domain.model.Role;
import com.vidnyan.bpml.domain.model.State;
import com.vidnyan.bpml.domain.model.Task;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.function.Function;

/**
 * Name lookup tables for one process, in declaration order.
 * Entity and role lookups fall back to the model-wide collections.
 * On duplicate names the first declaration wins; duplicates are reported by the structural pass.
 */
public final class ProcessRegistry {

    private final ProcessDefinition process;
    private final Map<String, Entity> entities;
    private final Map<String, Role> roles;
    private final Map<String, State> states;
    private final Map<String, Task> tasks;
    private final Map<String, ProcessElement> elements;
    private final Map<String, Entity> modelEntities;
    private final Map<String, Role> modelRoles;

    private ProcessRegistry(
            ProcessDefinition process,
            Map<String, Entity> modelEntities,
            Map<String, Role> modelRoles
    ) {
        this.process = process;
        this.entities = index(process.entities(), Entity::name);
        this.roles = index(process.roles(), Role::name);
        this.states = index(process.states(), State::name);
        this.tasks = index(process.tasks(), Task::name);
        this.elements = index(process.elements(), ProcessElement::name);
        this.modelEntities = modelEntities;
        this.modelRoles = modelRoles;
    }

    static ProcessRegistry build(
            ProcessDefinition process,
            Map<String, Entity> modelEntities,
            Map<String, Role> modelRoles
    ) {
        return new ProcessRegistry(process, modelEntities, modelRoles);
    }

    static <T> Map<String, T> index(Iterable<T> items, Function<T, String> nameOf) {
        Map<String, T> byName = new LinkedHashMap<>();
        for (T item : items) {
            byName.putIfAbsent(nameOf.apply(item), item);
        }
        return Collections.unmodifiableMap(byName);
    }

    public ProcessDefinition process() {
        return process;
    }

    public Optional<Entity> findEntity(String name) {
        Entity entity = entities.get(name);
        return Optional.ofNullable(entity != null ? entity : modelEntities.get(name));
    }

    public Optional<Role> findRole(String name) {
        Role role = roles.get(name);
        return Optional.ofNullable(role != null ? role : modelRoles.get(name));
    }

    public boolean hasEntity(String name) {
        return findEntity(name).isPresent();
    }

    public boolean hasRole(String name) {
        return findRole(name).isPresent();
    }

    public boolean hasState(String name) {
        return states.containsKey(name);
    }

    public boolean hasTask(String name) {
        return tasks.containsKey(name);
    }

    public boolean hasElement(String name) {
        return elements.containsKey(name);
    }

    public Optional<ProcessElement> findElement(String name) {
        return Optional.ofNullable(elements.get(name));
    }

    /**
     * Steps an implicit sequence may name: tasks, states and elements.
     */
    public boolean hasStep(String name) {
        return hasTask(name) || hasState(name) || hasElement(name);
    }
}
