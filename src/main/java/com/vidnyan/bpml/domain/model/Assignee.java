package com.vidnyan.bpml.domain.model;

/**
 * Who a user task is assigned to: a role, a single named user, or an expression
 * evaluated at runtime.
 */
public record Assignee(
    AssigneeType type,
    String value
) {

    public enum AssigneeType {
        ROLE,
        USER,
        EXPRESSION
    }

    public static Assignee role(String roleName) {
        return new Assignee(AssigneeType.ROLE, roleName);
    }

    public static Assignee user(String username) {
        return new Assignee(AssigneeType.USER, username);
    }

    public static Assignee expression(String expression) {
        return new Assignee(AssigneeType.EXPRESSION, expression);
    }

    public boolean isRole() {
        return type == AssigneeType.ROLE;
    }

    public boolean isUser() {
        return type == AssigneeType.USER;
    }
}
