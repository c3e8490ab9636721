package com.vidnyan.bpml.domain.model;

import lombok.Builder;

import java.util.List;

@Builder
public record TaskListWidget(
    String name,
    String process,
    List<String> columns,
    List<String> actions
) implements Widget {

    public TaskListWidget {
        columns = columns == null ? List.of() : List.copyOf(columns);
        actions = actions == null ? List.of() : List.copyOf(actions);
    }

    @Override
    public WidgetKind kind() {
        return WidgetKind.TASK_LIST;
    }
}
