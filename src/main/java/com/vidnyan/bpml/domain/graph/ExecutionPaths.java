package com.vidnyan.bpml.domain.graph;

import java.util.*;

/**
 * Lazy enumeration of simple start-to-end paths through a {@link FlowGraph}.
 * Each call to {@link #iterator()} restarts the search. Pairs are visited start-major
 * in declaration order; within a pair, paths come out in depth-first order following
 * outgoing-flow declaration order. A branch is abandoned once its depth exceeds maxDepth.
 */
public final class ExecutionPaths implements Iterable<List<String>> {

    public static final int DEFAULT_MAX_DEPTH = 50;

    private final FlowGraph graph;
    private final List<String> starts;
    private final List<String> ends;
    private final int maxDepth;

    ExecutionPaths(FlowGraph graph, List<String> starts, List<String> ends, int maxDepth) {
        this.graph = graph;
        this.starts = List.copyOf(starts);
        this.ends = List.copyOf(ends);
        this.maxDepth = maxDepth;
    }

    @Override
    public Iterator<List<String>> iterator() {
        return new PathIterator();
    }

    public List<List<String>> toList() {
        List<List<String>> paths = new ArrayList<>();
        forEach(paths::add);
        return paths;
    }

    private final class PathIterator implements Iterator<List<String>> {
        private int pairIndex = 0;
        private PairSearch current;
        private List<String> pending;

        @Override
        public boolean hasNext() {
            if (pending == null) {
                pending = advance();
            }
            return pending != null;
        }

        @Override
        public List<String> next() {
            if (!hasNext()) {
                throw new NoSuchElementException();
            }
            List<String> path = pending;
            pending = null;
            return path;
        }

        private List<String> advance() {
            while (true) {
                if (current != null) {
                    List<String> path = current.next();
                    if (path != null) {
                        return path;
                    }
                    current = null;
                }
                if (pairIndex >= starts.size() * ends.size()) {
                    return null;
                }
                String start = starts.get(pairIndex / ends.size());
                String end = ends.get(pairIndex % ends.size());
                pairIndex++;
                current = new PairSearch(start, end);
            }
        }
    }

    /**
     * Depth-first search between one start and one end, suspended between results.
     */
    private final class PairSearch {
        private final String end;
        private final Deque<Frame> stack = new ArrayDeque<>();
        private final List<String> path = new ArrayList<>();
        private final Set<String> onPath = new HashSet<>();
        private List<String> found;

        PairSearch(String start, String end) {
            this.end = end;
            found = enter(start, 0);
        }

        List<String> next() {
            if (found != null) {
                List<String> result = found;
                found = null;
                return result;
            }
            while (!stack.isEmpty()) {
                Frame frame = stack.peek();
                if (frame.successors().hasNext()) {
                    List<String> result = enter(frame.successors().next(), frame.depth() + 1);
                    if (result != null) {
                        return result;
                    }
                } else {
                    stack.pop();
                    path.remove(path.size() - 1);
                    onPath.remove(frame.node());
                }
            }
            return null;
        }

        private List<String> enter(String node, int depth) {
            if (depth > maxDepth) {
                return null;
            }
            if (node.equals(end)) {
                List<String> result = new ArrayList<>(path);
                result.add(node);
                return List.copyOf(result);
            }
            if (onPath.contains(node)) {
                return null;
            }
            path.add(node);
            onPath.add(node);
            stack.push(new Frame(node, depth, graph.getOutgoing(node).iterator()));
            return null;
        }
    }

    private record Frame(String node, int depth, Iterator<String> successors) {}
}
