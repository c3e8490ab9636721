package com.vidnyan.bpml.domain.analysis;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.vidnyan.bpml.domain.analysis.ProcessDocumentationGenerator.ProcessDocumentation;
import com.vidnyan.bpml.domain.model.ProcessDefinition;

import java.util.List;
import java.util.Map;

/**
 * Everything the analytics produce for one validated process.
 */
public record AnalysisReport(
    String process,
    ProcessMetrics metrics,
    @JsonProperty("execution_paths") List<List<String>> executionPaths,
    List<List<String>> cycles,
    @JsonProperty("orphaned_elements") List<OrphanedElement> orphanedElements,
    List<Bottleneck> bottlenecks,
    List<OptimizationSuggestion> suggestions,
    @JsonProperty("time_estimate") ExecutionTimeEstimate timeEstimate,
    @JsonProperty("completeness_issues") List<String> completenessIssues,
    ProcessDocumentation documentation
) {

    private static final TypeReference<Map<String, Object>> TEMPLATE_MODEL = new TypeReference<>() {
    };

    public AnalysisReport {
        executionPaths = executionPaths == null ? List.of() : List.copyOf(executionPaths);
        cycles = cycles == null ? List.of() : List.copyOf(cycles);
        orphanedElements = orphanedElements == null ? List.of() : List.copyOf(orphanedElements);
        bottlenecks = bottlenecks == null ? List.of() : List.copyOf(bottlenecks);
        suggestions = suggestions == null ? List.of() : List.copyOf(suggestions);
        completenessIssues = completenessIssues == null ? List.of() : List.copyOf(completenessIssues);
    }

    /**
     * Run every analysis over a process that has already passed validation.
     */
    public static AnalysisReport of(ProcessDefinition process, AnalysisSettings settings) {
        ProcessAnalyzer analyzer = new ProcessAnalyzer(process, settings);
        List<List<String>> paths = analyzer.findExecutionPaths();
        return new AnalysisReport(
                process.name(),
                analyzer.calculateProcessMetrics(paths),
                paths,
                analyzer.detectCycles(),
                analyzer.findOrphanedElements(),
                analyzer.findBottlenecks(),
                analyzer.suggestOptimizations(),
                analyzer.estimateProcessExecutionTime(Map.of(), paths),
                ProcessCompletenessChecker.check(process),
                ProcessDocumentationGenerator.document(process)
        );
    }

    /**
     * Plain nested maps and lists, keyed by the JSON names, for template interpolation.
     */
    public Map<String, Object> toTemplateModel(ObjectMapper objectMapper) {
        return objectMapper.convertValue(this, TEMPLATE_MODEL);
    }
}
