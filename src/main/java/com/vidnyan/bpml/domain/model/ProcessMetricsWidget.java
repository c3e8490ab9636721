package com.vidnyan.bpml.domain.model;

import lombok.Builder;

import java.util.List;

/**
 * Metrics panel; each entry in charts is a chart type token.
 */
@Builder
public record ProcessMetricsWidget(
    String name,
    String process,
    List<String> charts
) implements Widget {

    public ProcessMetricsWidget {
        charts = charts == null ? List.of() : List.copyOf(charts);
    }

    @Override
    public WidgetKind kind() {
        return WidgetKind.PROCESS_METRICS;
    }
}
