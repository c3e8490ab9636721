package com.vidnyan.bpml.domain.analysis;

import com.vidnyan.bpml.domain.analysis.EntityRelationshipAnalyzer.EntityDiagram;
import com.vidnyan.bpml.domain.analysis.EntityRelationshipAnalyzer.EntityUsage;
import com.vidnyan.bpml.domain.model.*;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class EntityRelationshipAnalyzerTest {

    private static Model shop() {
        Entity customer = new Entity("Customer", List.of(new Attribute("name", "string", false, false)));
        Entity order = new Entity("Order", List.of(
                new Attribute("total", "float", false, false),
                new Relationship("buyer", "Customer", "@1..1", false),
                new Relationship("lines", "Line", "@1..*", false)));
        Entity line = new Entity("Line", List.of(new Attribute("qty", "int", false, false)));

        ProcessDefinition checkout = ProcessDefinition.builder()
                .name("Checkout")
                .entities(List.of(line))
                .tasks(List.of(Task.builder().name("Pack").auto(true).entities(List.of("Order")).build()))
                .elements(List.of(
                        new StartEvent("Start", null),
                        new DataObject("Cart", null, "Order", false),
                        new DataObject("Note", null, "text", false),
                        new EndEvent("End", null)))
                .build();

        return Model.builder()
                .projectInfo(ProjectInfo.named("Shop"))
                .entities(List.of(customer, order))
                .processes(List.of(checkout))
                .build();
    }

    @Test
    void extractEntityDependencies_ShouldFollowRelationships() {
        Map<String, Set<String>> dependencies = new EntityRelationshipAnalyzer(shop()).extractEntityDependencies();

        assertEquals(Map.of("Order", Set.of("Customer", "Line")), dependencies);
    }

    @Test
    void findEntityUsageInProcesses_ShouldCoverDataObjectsAndTasks() {
        Map<String, List<EntityUsage>> usage = new EntityRelationshipAnalyzer(shop()).findEntityUsageInProcesses();

        assertEquals(List.of(
                new EntityUsage("Checkout", "Cart", "data_object"),
                new EntityUsage("Checkout", "Pack", "task")
        ), usage.get("Order"));
        assertFalse(usage.containsKey("text"));
    }

    @Test
    void generateEntityRelationshipDiagram_ShouldIncludeProcessEntities() {
        EntityDiagram diagram = new EntityRelationshipAnalyzer(shop()).generateEntityRelationshipDiagram();

        assertEquals(List.of("Customer", "Order", "Line"),
                diagram.entities().stream().map(EntityRelationshipAnalyzer.EntityNode::name).toList());
        assertEquals(2, diagram.relationships().size());
        assertEquals("@1..*", diagram.relationships().get(1).cardinality());
        assertEquals(1, diagram.entities().get(1).attributes().size());
    }
}
