package com.vidnyan.bpml.domain.analysis;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.vidnyan.bpml.domain.analysis.EntityRelationshipAnalyzer.EntityDiagram;
import com.vidnyan.bpml.domain.analysis.EntityRelationshipAnalyzer.EntityUsage;
import com.vidnyan.bpml.domain.analysis.RoleHierarchyAnalyzer.RoleConflict;
import com.vidnyan.bpml.domain.model.Model;
import com.vidnyan.bpml.domain.model.Role;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Model-wide analytics: role hierarchy over the model roles and entity relationships
 * across the model and its processes.
 */
public record ModelInsights(
    @JsonProperty("effective_permissions") Map<String, List<String>> effectivePermissions,
    @JsonProperty("role_conflicts") List<RoleConflict> roleConflicts,
    @JsonProperty("entity_dependencies") Map<String, Set<String>> entityDependencies,
    @JsonProperty("entity_usage") Map<String, List<EntityUsage>> entityUsage,
    @JsonProperty("entity_diagram") EntityDiagram entityDiagram
) {

    public static ModelInsights of(Model model) {
        RoleHierarchyAnalyzer roles = new RoleHierarchyAnalyzer(model.roles());
        Map<String, List<String>> permissions = new LinkedHashMap<>();
        for (Role role : model.roles()) {
            permissions.putIfAbsent(role.name(), roles.getEffectivePermissions(role.name()));
        }

        EntityRelationshipAnalyzer entities = new EntityRelationshipAnalyzer(model);
        return new ModelInsights(
                permissions,
                roles.findRoleConflicts(),
                entities.extractEntityDependencies(),
                entities.findEntityUsageInProcesses(),
                entities.generateEntityRelationshipDiagram()
        );
    }

    /**
     * Placeholder for models rejected by validation.
     */
    public static ModelInsights empty() {
        return new ModelInsights(Map.of(), List.of(), Map.of(), Map.of(),
                new EntityDiagram(List.of(), List.of()));
    }
}
