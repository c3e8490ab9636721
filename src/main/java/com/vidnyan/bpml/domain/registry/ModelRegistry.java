package com.vidnyan.bpml.domain.registry;

import com.vidnyan.bpml.domain.model.Entity;
import com.vidnyan.bpml.domain.model.Model;
import com.vidnyan.bpml.domain.model.ProcessDefinition;
import com.vidnyan.bpml.domain.model.Role;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Name lookup tables for a whole model.
 * Derived cache keyed to one Model instance; rebuild it whenever the model changes.
 */
public final class ModelRegistry {

    private final Map<String, ProcessDefinition> processes;
    private final Map<String, Entity> entities;
    private final Map<String, Role> roles;
    private final Map<String, ProcessRegistry> processRegistries;

    private ModelRegistry(
            Map<String, ProcessDefinition> processes,
            Map<String, Entity> entities,
            Map<String, Role> roles,
            Map<String, ProcessRegistry> processRegistries
    ) {
        this.processes = processes;
        this.entities = entities;
        this.roles = roles;
        this.processRegistries = processRegistries;
    }

    /**
     * Build registries from a model.
     */
    public static ModelRegistry build(Model model) {
        Map<String, Entity> entities = ProcessRegistry.index(model.entities(), Entity::name);
        Map<String, Role> roles = ProcessRegistry.index(model.roles(), Role::name);

        Map<String, ProcessRegistry> registries = new LinkedHashMap<>();
        for (ProcessDefinition process : model.processes()) {
            registries.putIfAbsent(process.name(), ProcessRegistry.build(process, entities, roles));
        }

        return new ModelRegistry(
                ProcessRegistry.index(model.processes(), ProcessDefinition::name),
                entities,
                roles,
                Collections.unmodifiableMap(registries)
        );
    }

    public boolean hasProcess(String name) {
        return processes.containsKey(name);
    }

    public Optional<Entity> findEntity(String name) {
        return Optional.ofNullable(entities.get(name));
    }

    public Optional<Role> findRole(String name) {
        return Optional.ofNullable(roles.get(name));
    }

    public boolean hasRole(String name) {
        return roles.containsKey(name);
    }

    public boolean hasEntity(String name) {
        return entities.containsKey(name);
    }

    /**
     * Registry for the given process. A process that shares its name with an
     * earlier one gets its own, uncached registry.
     */
    public ProcessRegistry forProcess(ProcessDefinition process) {
        ProcessRegistry registry = processRegistries.get(process.name());
        if (registry == null || registry.process() != process) {
            return ProcessRegistry.build(process, entities, roles);
        }
        return registry;
    }
}
