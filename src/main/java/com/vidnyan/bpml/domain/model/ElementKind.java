package com.vidnyan.bpml.domain.model;

/**
 * Closed set of process element variants.
 * Validators and analyzers switch over this instead of inspecting class names.
 */
public enum ElementKind {
    START_EVENT("StartEvent"),
    END_EVENT("EndEvent"),
    USER_TASK("UserTask"),
    SERVICE_TASK("ServiceTask"),
    SCRIPT_TASK("ScriptTask"),
    EXCLUSIVE_GATEWAY("ExclusiveGateway"),
    INCLUSIVE_GATEWAY("InclusiveGateway"),
    PARALLEL_GATEWAY("ParallelGateway"),
    DATA_OBJECT("DataObject");

    private final String displayName;

    ElementKind(String displayName) {
        this.displayName = displayName;
    }

    public String displayName() {
        return displayName;
    }

    public boolean isGateway() {
        return this == EXCLUSIVE_GATEWAY || this == INCLUSIVE_GATEWAY || this == PARALLEL_GATEWAY;
    }

    /**
     * Gateways that pick outgoing branches by condition.
     */
    public boolean isDecision() {
        return this == EXCLUSIVE_GATEWAY || this == INCLUSIVE_GATEWAY;
    }

    @Override
    public String toString() {
        return displayName;
    }
}
