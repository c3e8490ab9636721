package com.vidnyan.bpml.domain.analysis;

import com.vidnyan.bpml.domain.graph.ExecutionPaths;
import com.vidnyan.bpml.domain.model.ElementKind;

import java.util.EnumMap;
import java.util.Map;

/**
 * Tuning knobs for process analytics.
 *
 * @param maxPathDepth     depth beyond which path enumeration abandons a branch
 * @param fanInThreshold   incoming-flow count above which an element is flagged as a bottleneck
 * @param defaultEstimates minutes per element kind, used when no explicit estimate is given
 */
public record AnalysisSettings(
    int maxPathDepth,
    int fanInThreshold,
    Map<ElementKind, Double> defaultEstimates
) {

    public AnalysisSettings {
        Map<ElementKind, Double> estimates = new EnumMap<>(ElementKind.class);
        for (ElementKind kind : ElementKind.values()) {
            estimates.put(kind, 0.0);
        }
        if (defaultEstimates != null) {
            estimates.putAll(defaultEstimates);
        }
        defaultEstimates = Map.copyOf(estimates);
    }

    public static AnalysisSettings defaults() {
        return new AnalysisSettings(ExecutionPaths.DEFAULT_MAX_DEPTH, 2, Map.of(
                ElementKind.USER_TASK, 30.0,
                ElementKind.SERVICE_TASK, 2.0,
                ElementKind.SCRIPT_TASK, 1.0
        ));
    }

    public double defaultEstimate(ElementKind kind) {
        return defaultEstimates.getOrDefault(kind, 0.0);
    }
}
