package com.vidnyan.bpml.domain.analysis;

import com.vidnyan.bpml.domain.analysis.RoleHierarchyAnalyzer.RoleConflict;
import com.vidnyan.bpml.domain.analysis.RoleHierarchyAnalyzer.RoleConflict.ConflictType;
import com.vidnyan.bpml.domain.model.Role;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class RoleHierarchyAnalyzerTest {

    private static Role role(String name, String parent, String... permissions) {
        return new Role(name, null, parent, List.of(), List.of(permissions));
    }

    @Test
    void getEffectivePermissions_ShouldIncludeInheritedOnes() {
        RoleHierarchyAnalyzer analyzer = new RoleHierarchyAnalyzer(List.of(
                role("Employee", null, "view"),
                role("Manager", "Employee", "approve"),
                role("Director", "Manager", "budget", "view")));

        assertEquals(List.of("budget", "view", "approve"), analyzer.getEffectivePermissions("Director"));
        assertEquals(List.of("view"), analyzer.getEffectivePermissions("Employee"));
        assertTrue(analyzer.getEffectivePermissions("Nobody").isEmpty());
        assertEquals(List.of("Manager"), analyzer.getChildren("Employee"));
    }

    @Test
    void findRoleConflicts_ShouldReportDuplicatedPermissions() {
        RoleHierarchyAnalyzer analyzer = new RoleHierarchyAnalyzer(List.of(
                role("Employee", null, "view", "comment"),
                role("Manager", "Employee", "view", "approve")));

        List<RoleConflict> conflicts = analyzer.findRoleConflicts();

        assertEquals(List.of(new RoleConflict(ConflictType.DUPLICATE_PERMISSIONS, "Manager", List.of("view"),
                "Role Manager has permissions already inherited from parent")), conflicts);
    }

    @Test
    void findRoleConflicts_CircularInheritance_ShouldNotLoopForever() {
        RoleHierarchyAnalyzer analyzer = new RoleHierarchyAnalyzer(List.of(
                role("A", "B", "x"),
                role("B", "A", "y")));

        List<RoleConflict> conflicts = analyzer.findRoleConflicts();

        assertEquals(2, conflicts.stream().filter(c -> c.type() == ConflictType.CIRCULAR_INHERITANCE).count());
        assertEquals(List.of("x", "y"), analyzer.getEffectivePermissions("A"));
    }
}
