package com.vidnyan.bpml.domain.model;

import lombok.Builder;

@Builder
public record CustomChartWidget(
    String name,
    String chartType,
    String dataSource
) implements Widget {

    @Override
    public WidgetKind kind() {
        return WidgetKind.CUSTOM_CHART;
    }

    @Override
    public String process() {
        return null;
    }
}
