package com.vidnyan.bpml.domain.graph;

import com.vidnyan.bpml.domain.model.ElementKind;
import com.vidnyan.bpml.domain.model.ProcessDefinition;
import com.vidnyan.bpml.domain.model.ProcessElement;
import com.vidnyan.bpml.domain.model.SequenceFlow;

import java.util.*;

/**
 * Precomputed sequence-flow graph of one process.
 * Bidirectional index: element -> targets, element -> sources, both in flow declaration order.
 * Immutable.
 */
public final class FlowGraph {

    private final Map<String, ProcessElement> elements;
    private final Map<String, List<String>> outgoing;
    private final Map<String, List<String>> incoming;
    private final int edgeCount;

    private FlowGraph(
            Map<String, ProcessElement> elements,
            Map<String, List<String>> outgoing,
            Map<String, List<String>> incoming,
            int edgeCount
    ) {
        this.elements = Collections.unmodifiableMap(elements);
        this.outgoing = Collections.unmodifiableMap(outgoing);
        this.incoming = Collections.unmodifiableMap(incoming);
        this.edgeCount = edgeCount;
    }

    /**
     * Build the flow graph of a process.
     */
    public static FlowGraph build(ProcessDefinition process) {
        Map<String, ProcessElement> elements = new LinkedHashMap<>();
        for (ProcessElement element : process.elements()) {
            elements.putIfAbsent(element.name(), element);
        }

        Map<String, List<String>> outgoing = new LinkedHashMap<>();
        Map<String, List<String>> incoming = new LinkedHashMap<>();
        for (SequenceFlow flow : process.flows()) {
            outgoing.computeIfAbsent(flow.source(), k -> new ArrayList<>()).add(flow.target());
            incoming.computeIfAbsent(flow.target(), k -> new ArrayList<>()).add(flow.source());
        }

        outgoing.replaceAll((k, v) -> List.copyOf(v));
        incoming.replaceAll((k, v) -> List.copyOf(v));
        return new FlowGraph(elements, outgoing, incoming, process.flows().size());
    }

    /**
     * Elements in declaration order.
     */
    public Collection<ProcessElement> getElements() {
        return elements.values();
    }

    public Optional<ProcessElement> getElement(String name) {
        return Optional.ofNullable(elements.get(name));
    }

    public Optional<ElementKind> kindOf(String name) {
        return getElement(name).map(ProcessElement::kind);
    }

    public List<String> getOutgoing(String name) {
        return outgoing.getOrDefault(name, List.of());
    }

    public List<String> getIncoming(String name) {
        return incoming.getOrDefault(name, List.of());
    }

    public int fanIn(String name) {
        return getIncoming(name).size();
    }

    public int fanOut(String name) {
        return getOutgoing(name).size();
    }

    public List<String> elementsOfKind(ElementKind kind) {
        return elements.values().stream()
                .filter(e -> e.kind() == kind)
                .map(ProcessElement::name)
                .toList();
    }

    /**
     * Element graph restricted to declared elements, for cycle search.
     */
    public DirectedGraph toDirectedGraph() {
        DirectedGraph.Builder builder = DirectedGraph.builder();
        for (String name : elements.keySet()) {
            builder.node(name);
            for (String target : getOutgoing(name)) {
                if (elements.containsKey(target)) {
                    builder.edge(name, target);
                }
            }
        }
        return builder.build();
    }

    /**
     * All simple paths from every start event to every end event, bounded by maxDepth.
     */
    public ExecutionPaths executionPaths(int maxDepth) {
        return new ExecutionPaths(this,
                elementsOfKind(ElementKind.START_EVENT),
                elementsOfKind(ElementKind.END_EVENT),
                maxDepth);
    }

    /**
     * Get statistics.
     */
    public Stats stats() {
        return new Stats(elements.size(), edgeCount);
    }

    public record Stats(int elementCount, int flowCount) {}
}
