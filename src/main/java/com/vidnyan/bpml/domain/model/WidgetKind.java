package com.vidnyan.bpml.domain.model;

public enum WidgetKind {
    PROCESS_INSTANCE_LIST("ProcessInstanceList"),
    TASK_LIST("TaskList"),
    PROCESS_METRICS("ProcessMetrics"),
    CUSTOM_CHART("CustomChart");

    private final String displayName;

    WidgetKind(String displayName) {
        this.displayName = displayName;
    }

    public String displayName() {
        return displayName;
    }

    @Override
    public String toString() {
        return displayName;
    }
}
