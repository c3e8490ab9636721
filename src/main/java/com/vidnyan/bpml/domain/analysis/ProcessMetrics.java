package com.vidnyan.bpml.domain.analysis;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Map;

/**
 * Size and shape metrics of one process.
 * parallelPaths is the widest fan-out of any parallel gateway (at least 1);
 * cyclomaticComplexity is the number of exclusive and inclusive gateways plus one.
 */
public record ProcessMetrics(
    @JsonProperty("total_elements") int totalElements,
    @JsonProperty("start_events") int startEvents,
    @JsonProperty("end_events") int endEvents,
    @JsonProperty("user_tasks") int userTasks,
    @JsonProperty("service_tasks") int serviceTasks,
    @JsonProperty("script_tasks") int scriptTasks,
    @JsonProperty("gateways") int gateways,
    @JsonProperty("data_objects") int dataObjects,
    @JsonProperty("element_counts") Map<String, Integer> elementCounts,
    @JsonProperty("parallel_paths") int parallelPaths,
    @JsonProperty("max_path_length") int maxPathLength,
    @JsonProperty("avg_path_length") double avgPathLength,
    @JsonProperty("cyclomatic_complexity") int cyclomaticComplexity
) {
}
