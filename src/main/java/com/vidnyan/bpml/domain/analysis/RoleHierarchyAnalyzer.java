package com.vidnyan.bpml.domain.analysis;

import com.vidnyan.bpml.domain.model.Role;

import java.util.*;

/**
 * Inheritance view over a set of roles: effective permissions and conflicts.
 * Tolerates broken hierarchies (unknown parents, cycles) since it only reports.
 */
public class RoleHierarchyAnalyzer {

    private final Map<String, Role> roles = new LinkedHashMap<>();
    private final Map<String, List<String>> children = new LinkedHashMap<>();

    public RoleHierarchyAnalyzer(List<Role> roles) {
        for (Role role : roles) {
            this.roles.putIfAbsent(role.name(), role);
            children.putIfAbsent(role.name(), new ArrayList<>());
        }
        for (Role role : this.roles.values()) {
            if (role.parent() != null && children.containsKey(role.parent())) {
                children.get(role.parent()).add(role.name());
            }
        }
    }

    public List<String> getChildren(String roleName) {
        return List.copyOf(children.getOrDefault(roleName, List.of()));
    }

    /**
     * Own permissions followed by those inherited up the parent chain.
     */
    public List<String> getEffectivePermissions(String roleName) {
        Set<String> permissions = new LinkedHashSet<>();
        Set<String> seen = new HashSet<>();
        Role current = roles.get(roleName);
        while (current != null && seen.add(current.name())) {
            permissions.addAll(current.permissions());
            current = current.parent() != null ? roles.get(current.parent()) : null;
        }
        return List.copyOf(permissions);
    }

    public List<RoleConflict> findRoleConflicts() {
        List<RoleConflict> conflicts = new ArrayList<>();

        for (String roleName : roles.keySet()) {
            if (hasCircularInheritance(roleName)) {
                conflicts.add(new RoleConflict(RoleConflict.ConflictType.CIRCULAR_INHERITANCE, roleName,
                        List.of(), "Role " + roleName + " has circular inheritance"));
            }
        }

        for (Role role : roles.values()) {
            Role parent = role.parent() != null ? roles.get(role.parent()) : null;
            if (parent == null) {
                continue;
            }
            List<String> duplicated = role.permissions().stream()
                    .filter(parent.permissions()::contains)
                    .distinct()
                    .toList();
            if (!duplicated.isEmpty()) {
                conflicts.add(new RoleConflict(RoleConflict.ConflictType.DUPLICATE_PERMISSIONS, role.name(),
                        duplicated, "Role " + role.name() + " has permissions already inherited from parent"));
            }
        }

        return conflicts;
    }

    private boolean hasCircularInheritance(String roleName) {
        Set<String> visited = new HashSet<>();
        String current = roleName;
        while (current != null) {
            if (!visited.add(current)) {
                return true;
            }
            Role role = roles.get(current);
            current = role != null ? role.parent() : null;
        }
        return false;
    }

    public record RoleConflict(
        ConflictType type,
        String role,
        List<String> permissions,
        String description
    ) {
        public enum ConflictType {
            CIRCULAR_INHERITANCE,
            DUPLICATE_PERMISSIONS
        }
    }
}
