package com.vidnyan.bpml.domain.graph;

import java.util.*;

/**
 * Name-keyed directed graph with ordered adjacency.
 * Used for role hierarchies, task dependencies and element flow cycle checks.
 * Iteration follows declaration order of nodes and edges, so the first cycle
 * reported is stable for a given model.
 */
public final class DirectedGraph {

    private final Map<String, List<String>> successors;

    private DirectedGraph(Map<String, List<String>> successors) {
        this.successors = successors;
    }

    /**
     * Build a graph from an adjacency map. Edge targets that are not keys become nodes
     * after all keyed nodes.
     */
    public static DirectedGraph of(Map<String, ? extends Collection<String>> edges) {
        Builder builder = builder();
        edges.forEach((node, targets) -> {
            builder.node(node);
            targets.forEach(target -> builder.edge(node, target));
        });
        return builder.build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private final Map<String, List<String>> successors = new LinkedHashMap<>();

        public Builder node(String name) {
            successors.computeIfAbsent(name, k -> new ArrayList<>());
            return this;
        }

        public Builder edge(String from, String to) {
            successors.computeIfAbsent(from, k -> new ArrayList<>()).add(to);
            return this;
        }

        public DirectedGraph build() {
            Map<String, List<String>> copy = new LinkedHashMap<>();
            successors.forEach((node, targets) -> copy.put(node, List.copyOf(targets)));
            // edge targets without outgoing edges are nodes too
            successors.values().forEach(targets ->
                    targets.forEach(target -> copy.putIfAbsent(target, List.of())));
            return new DirectedGraph(Collections.unmodifiableMap(copy));
        }
    }

    public Set<String> nodes() {
        return successors.keySet();
    }

    public List<String> getSuccessors(String node) {
        return successors.getOrDefault(node, List.of());
    }

    /**
     * Find the first cycle reachable in declaration order.
     * Returns the closed path, e.g. {@code [A, B, A]}; a self-loop yields {@code [A, A]}.
     */
    public Optional<List<String>> findFirstCycle() {
        List<List<String>> cycles = new ArrayList<>();
        search(cycles, true);
        return cycles.stream().findFirst();
    }

    /**
     * Find all cycles closed by a back edge during one depth-first sweep.
     * Best-effort: cycles that share a back edge with an earlier one are reported once.
     */
    public List<List<String>> findAllCycles() {
        List<List<String>> cycles = new ArrayList<>();
        search(cycles, false);
        return cycles;
    }

    public boolean hasCycle() {
        return findFirstCycle().isPresent();
    }

    /**
     * Depth-first search with an explicit stack and an on-stack set.
     * A successor that is still on the stack closes a cycle.
     */
    private void search(List<List<String>> cycles, boolean stopAtFirst) {
        Set<String> visited = new HashSet<>();

        for (String root : successors.keySet()) {
            if (visited.contains(root)) {
                continue;
            }

            Deque<Frame> stack = new ArrayDeque<>();
            List<String> path = new ArrayList<>();
            Set<String> onStack = new HashSet<>();

            visited.add(root);
            onStack.add(root);
            path.add(root);
            stack.push(new Frame(root, getSuccessors(root).iterator()));

            while (!stack.isEmpty()) {
                Frame frame = stack.peek();
                if (frame.successors().hasNext()) {
                    String next = frame.successors().next();
                    if (onStack.contains(next)) {
                        List<String> cycle = new ArrayList<>(path.subList(path.indexOf(next), path.size()));
                        cycle.add(next);
                        cycles.add(List.copyOf(cycle));
                        if (stopAtFirst) {
                            return;
                        }
                    } else if (!visited.contains(next)) {
                        visited.add(next);
                        onStack.add(next);
                        path.add(next);
                        stack.push(new Frame(next, getSuccessors(next).iterator()));
                    }
                } else {
                    stack.pop();
                    onStack.remove(frame.node());
                    path.remove(path.size() - 1);
                }
            }
        }
    }

    private record Frame(String node, Iterator<String> successors) {}

    /**
     * Get statistics.
     */
    public Stats stats() {
        return new Stats(
                successors.size(),
                successors.values().stream().mapToInt(List::size).sum()
        );
    }

    public record Stats(int nodeCount, int edgeCount) {}
}
