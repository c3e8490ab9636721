package com.vidnyan.bpml.domain.analysis;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Execution time statistics in minutes over all enumerated paths.
 */
public record ExecutionTimeEstimate(
    @JsonProperty("min_time") double minTime,
    @JsonProperty("max_time") double maxTime,
    @JsonProperty("avg_time") double avgTime,
    @JsonProperty("path_count") int pathCount
) {

    /**
     * Result for a process without any start-to-end path.
     */
    public static ExecutionTimeEstimate none() {
        return new ExecutionTimeEstimate(0, 0, 0, 0);
    }
}
