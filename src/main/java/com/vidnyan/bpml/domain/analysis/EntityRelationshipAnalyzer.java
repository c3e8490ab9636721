package com.vidnyan.bpml.domain.analysis;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.vidnyan.bpml.domain.model.*;

import java.util.*;

/**
 * Entity relationships across a model: dependencies, usage in processes and
 * the data behind an entity-relationship diagram.
 */
public class EntityRelationshipAnalyzer {

    private final Model model;

    public EntityRelationshipAnalyzer(Model model) {
        this.model = model;
    }

    /**
     * Model-wide entities followed by process-local ones, first declaration winning.
     */
    public List<Entity> allEntities() {
        Map<String, Entity> entities = new LinkedHashMap<>();
        model.entities().forEach(e -> entities.putIfAbsent(e.name(), e));
        for (ProcessDefinition process : model.processes()) {
            process.entities().forEach(e -> entities.putIfAbsent(e.name(), e));
        }
        return List.copyOf(entities.values());
    }

    public Map<String, Set<String>> extractEntityDependencies() {
        Map<String, Set<String>> dependencies = new LinkedHashMap<>();
        for (Entity entity : allEntities()) {
            for (Relationship relationship : entity.relationships()) {
                dependencies.computeIfAbsent(entity.name(), k -> new LinkedHashSet<>())
                        .add(relationship.target());
            }
        }
        return dependencies;
    }

    /**
     * Where each entity is used: data objects typed by it and tasks that touch it.
     */
    public Map<String, List<EntityUsage>> findEntityUsageInProcesses() {
        Set<String> known = new HashSet<>();
        allEntities().forEach(e -> known.add(e.name()));

        Map<String, List<EntityUsage>> usage = new LinkedHashMap<>();
        for (ProcessDefinition process : model.processes()) {
            for (ProcessElement element : process.elementsOfKind(ElementKind.DATA_OBJECT)) {
                String type = ((DataObject) element).dataType();
                if (type != null && known.contains(type)) {
                    usage.computeIfAbsent(type, k -> new ArrayList<>())
                            .add(new EntityUsage(process.name(), element.name(), "data_object"));
                }
            }
            for (Task task : process.tasks()) {
                for (String entity : task.entities()) {
                    usage.computeIfAbsent(entity, k -> new ArrayList<>())
                            .add(new EntityUsage(process.name(), task.name(), "task"));
                }
            }
        }
        return usage;
    }

    public EntityDiagram generateEntityRelationshipDiagram() {
        List<EntityNode> nodes = new ArrayList<>();
        List<RelationshipEdge> edges = new ArrayList<>();

        for (Entity entity : allEntities()) {
            List<AttributeInfo> attributes = entity.attributes().stream()
                    .map(a -> new AttributeInfo(a.name(), a.type(), a.isList(), a.isOptional()))
                    .toList();
            nodes.add(new EntityNode(entity.name(), attributes));

            for (Relationship relationship : entity.relationships()) {
                edges.add(new RelationshipEdge(entity.name(), relationship.target(), relationship.name(),
                        relationship.cardinality(), relationship.isOptional()));
            }
        }

        return new EntityDiagram(nodes, edges);
    }

    public record EntityUsage(String process, String element, String type) {}

    public record AttributeInfo(
        String name,
        String type,
        @JsonProperty("isList") boolean list,
        @JsonProperty("isOptional") boolean optional
    ) {}

    public record EntityNode(String name, List<AttributeInfo> attributes) {}

    public record RelationshipEdge(
        String source,
        String target,
        String name,
        String cardinality,
        @JsonProperty("isOptional") boolean optional
    ) {}

    public record EntityDiagram(List<EntityNode> entities, List<RelationshipEdge> relationships) {}
}
