package com.vidnyan.bpml.domain.analysis;

import com.vidnyan.bpml.domain.analysis.OptimizationSuggestion.SuggestionType;
import com.vidnyan.bpml.domain.graph.ExecutionPaths;
import com.vidnyan.bpml.domain.graph.FlowGraph;
import com.vidnyan.bpml.domain.model.Assignee;
import com.vidnyan.bpml.domain.model.ElementKind;
import com.vidnyan.bpml.domain.model.ProcessDefinition;
import com.vidnyan.bpml.domain.model.ProcessElement;
import com.vidnyan.bpml.domain.model.ServiceTask;
import com.vidnyan.bpml.domain.model.UserTask;
import lombok.extern.slf4j.Slf4j;

import java.util.*;

/**
 * Read-only analytics over the flow graph of one validated process.
 * Never throws: incomplete processes yield empty lists and zero metrics.
 */
@Slf4j
public class ProcessAnalyzer {

    private final ProcessDefinition process;
    private final AnalysisSettings settings;
    private final FlowGraph graph;

    public ProcessAnalyzer(ProcessDefinition process) {
        this(process, AnalysisSettings.defaults());
    }

    public ProcessAnalyzer(ProcessDefinition process, AnalysisSettings settings) {
        this.process = process;
        this.settings = settings;
        this.graph = FlowGraph.build(process);
    }

    /**
     * Lazy, restartable enumeration of start-to-end paths.
     */
    public ExecutionPaths executionPaths() {
        return graph.executionPaths(settings.maxPathDepth());
    }

    public List<List<String>> findExecutionPaths() {
        return executionPaths().toList();
    }

    /**
     * Cycles in the element flow graph, for reporting. Rework loops are legal, so
     * nothing is rejected here.
     */
    public List<List<String>> detectCycles() {
        return graph.toDirectedGraph().findAllCycles();
    }

    public List<OrphanedElement> findOrphanedElements() {
        List<OrphanedElement> orphaned = new ArrayList<>();

        for (ProcessElement element : graph.getElements()) {
            String name = element.name();
            String type = element.kind().displayName();
            boolean hasIncoming = graph.fanIn(name) > 0;
            boolean hasOutgoing = graph.fanOut(name) > 0;

            switch (element.kind()) {
                case START_EVENT -> {
                    if (hasIncoming) {
                        orphaned.add(new OrphanedElement(name, type, "Start event has incoming connections"));
                    }
                }
                case END_EVENT -> {
                    if (hasOutgoing) {
                        orphaned.add(new OrphanedElement(name, type, "End event has outgoing connections"));
                    }
                }
                default -> {
                    if (!hasIncoming) {
                        orphaned.add(new OrphanedElement(name, type, "No incoming connections"));
                    }
                    if (!hasOutgoing) {
                        orphaned.add(new OrphanedElement(name, type, "No outgoing connections"));
                    }
                }
            }
        }

        return orphaned;
    }

    public ProcessMetrics calculateProcessMetrics() {
        return calculateProcessMetrics(executionPaths());
    }

    /**
     * Metrics over paths the caller has already enumerated.
     */
    public ProcessMetrics calculateProcessMetrics(Iterable<List<String>> paths) {
        Map<String, Integer> counts = new LinkedHashMap<>();
        for (ElementKind kind : ElementKind.values()) {
            counts.put(kind.displayName(), 0);
        }
        int gateways = 0;
        int decisionPoints = 0;
        int parallelPaths = 1;

        for (ProcessElement element : graph.getElements()) {
            ElementKind kind = element.kind();
            counts.merge(kind.displayName(), 1, Integer::sum);
            if (kind.isGateway()) {
                gateways++;
            }
            if (kind.isDecision()) {
                decisionPoints++;
            }
            if (kind == ElementKind.PARALLEL_GATEWAY) {
                parallelPaths = Math.max(parallelPaths, graph.fanOut(element.name()));
            }
        }

        int pathCount = 0;
        int maxLength = 0;
        long totalLength = 0;
        for (List<String> path : paths) {
            pathCount++;
            maxLength = Math.max(maxLength, path.size());
            totalLength += path.size();
        }

        return new ProcessMetrics(
                graph.getElements().size(),
                counts.get(ElementKind.START_EVENT.displayName()),
                counts.get(ElementKind.END_EVENT.displayName()),
                counts.get(ElementKind.USER_TASK.displayName()),
                counts.get(ElementKind.SERVICE_TASK.displayName()),
                counts.get(ElementKind.SCRIPT_TASK.displayName()),
                gateways,
                counts.get(ElementKind.DATA_OBJECT.displayName()),
                Collections.unmodifiableMap(counts),
                parallelPaths,
                maxLength,
                pathCount == 0 ? 0.0 : (double) totalLength / pathCount,
                decisionPoints + 1
        );
    }

    public List<Bottleneck> findBottlenecks() {
        List<Bottleneck> bottlenecks = new ArrayList<>();

        for (ProcessElement element : graph.getElements()) {
            String name = element.name();
            String type = element.kind().displayName();

            int fanIn = graph.fanIn(name);
            if (fanIn > settings.fanInThreshold()) {
                bottlenecks.add(new Bottleneck(name, type,
                        "High fan-in: " + fanIn + " incoming flows", Severity.MEDIUM));
            }

            if (element.kind() == ElementKind.USER_TASK) {
                UserTask task = (UserTask) element;
                Assignee assignee = task.assignee();
                if (task.candidateGroups().isEmpty() && assignee != null && assignee.isUser()) {
                    bottlenecks.add(new Bottleneck(name, type,
                            "Single user assignment without candidate groups", Severity.HIGH));
                }
            }
        }

        return bottlenecks;
    }

    public List<OptimizationSuggestion> suggestOptimizations() {
        List<OptimizationSuggestion> suggestions = new ArrayList<>();

        List<String> sequential = findSequentialUserTasks();
        if (sequential.size() > 1) {
            suggestions.add(new OptimizationSuggestion(SuggestionType.PARALLELIZATION,
                    "Consider parallelizing tasks: " + String.join(", ", sequential),
                    sequential, Severity.MEDIUM));
        }

        for (String gateway : findRedundantGateways()) {
            suggestions.add(new OptimizationSuggestion(SuggestionType.SIMPLIFICATION,
                    "Gateway \"" + gateway + "\" might be redundant",
                    List.of(gateway), Severity.LOW));
        }

        for (ProcessElement element : graph.getElements()) {
            if (element.kind() == ElementKind.SERVICE_TASK && !((ServiceTask) element).hasErrorHandling()) {
                suggestions.add(new OptimizationSuggestion(SuggestionType.ERROR_HANDLING,
                        "Add error handling to service task \"" + element.name() + "\"",
                        List.of(element.name()), Severity.HIGH));
            }
        }

        return suggestions;
    }

    /**
     * User tasks whose single outgoing flow leads straight into another user task.
     */
    private List<String> findSequentialUserTasks() {
        Set<String> sequential = new LinkedHashSet<>();
        for (String name : graph.elementsOfKind(ElementKind.USER_TASK)) {
            List<String> outgoing = graph.getOutgoing(name);
            if (outgoing.size() == 1
                    && graph.kindOf(outgoing.get(0)).orElse(null) == ElementKind.USER_TASK) {
                sequential.add(name);
                sequential.add(outgoing.get(0));
            }
        }
        return List.copyOf(sequential);
    }

    /**
     * Gateways that neither split nor merge.
     */
    private List<String> findRedundantGateways() {
        return graph.getElements().stream()
                .filter(e -> e.kind().isGateway())
                .map(ProcessElement::name)
                .filter(name -> graph.fanIn(name) == 1 && graph.fanOut(name) == 1)
                .toList();
    }

    /**
     * Estimate execution time per path. Explicit estimates win; other elements
     * fall back to the per-kind defaults.
     */
    public ExecutionTimeEstimate estimateProcessExecutionTime(Map<String, Double> estimates) {
        return estimateProcessExecutionTime(estimates, executionPaths());
    }

    public ExecutionTimeEstimate estimateProcessExecutionTime(Map<String, Double> estimates,
                                                              Iterable<List<String>> paths) {
        Map<String, Double> explicit = estimates != null ? estimates : Map.of();

        int pathCount = 0;
        double min = Double.MAX_VALUE;
        double max = 0;
        double total = 0;

        for (List<String> path : paths) {
            double pathTime = 0;
            for (String name : path) {
                Double estimate = explicit.get(name);
                if (estimate == null) {
                    estimate = graph.kindOf(name).map(settings::defaultEstimate).orElse(0.0);
                }
                pathTime += estimate;
            }
            pathCount++;
            min = Math.min(min, pathTime);
            max = Math.max(max, pathTime);
            total += pathTime;
        }

        if (pathCount == 0) {
            log.debug("No execution path in process {}, returning empty estimate", process.name());
            return ExecutionTimeEstimate.none();
        }
        return new ExecutionTimeEstimate(min, max, total / pathCount, pathCount);
    }
}
