package domain.engine;

import domain.graph.StateGraph;
import domain.model.State;
import infrastructure.util.ValidationUtils;

import java.util.*;
import java.util.function.Predicate;

/**
 * Breadth-First Search engine: explores paths level by level (by edge count).
 *
 * <p>Uses a FIFO queue, so every path of length {@code d} is accepted before any path of
 * length {@code d + 1}. Paths are not required to be simple: a state may reappear at a
 * different depth, but each {@code (state, depth)} pair is expanded at most once.
 *
 * <p>A dequeued node satisfying the goal predicate is accepted as a complete path and is
 * not expanded further. The search stops as soon as {@code maxPaths} paths have been
 * accepted; nodes deeper than {@code maxDepth} are never accepted or expanded.
 *
 * <br><b>Memory:</b> O(frontier): can be large for dense graphs.
 */
public final class BreadthFirstSearchEngine implements PathSearchEngine {

    private final int maxDepth;
    private final int maxPaths;

    /**
     * Constructs a Breadth-First Search engine.
     *
     * @param maxDepth maximum number of edges in an accepted path
     * @param maxPaths maximum number of accepted paths per search (early termination)
     */
    public BreadthFirstSearchEngine(int maxDepth, int maxPaths) {
        ValidationUtils.validateNonNegative(maxDepth, "maxDepth");
        ValidationUtils.validatePositive(maxPaths, "maxPaths");
        this.maxDepth = maxDepth;
        this.maxPaths = maxPaths;
    }

    @Override
    public List<List<State>> findPaths(StateGraph graph, State start, Predicate<State> goal) {
        List<List<State>> paths = new ArrayList<>();
        Deque<SearchNode> queue = new ArrayDeque<>();
        Map<State, BitSet> expandedDepths = new HashMap<>();
        queue.offer(SearchNode.root(start, 0.0));

        while (!queue.isEmpty() && paths.size() < maxPaths) {
            SearchNode node = queue.poll();
            if (node.depth > maxDepth) continue;

            // (state, depth) already handled
            BitSet seen = expandedDepths.computeIfAbsent(node.state, s -> new BitSet());
            if (seen.get(node.depth)) continue;
            seen.set(node.depth);

            if (goal.test(node.state)) {
                paths.add(node.toPath());
                continue;
            }

            if (node.depth == maxDepth) continue;

            for (State neighbor : graph.getNeighbors(node.state)) {
                queue.offer(new SearchNode(neighbor, node, node.depth + 1, 0.0, 0L));
            }
        }
        return paths;
    }

    public int getMaxDepth() { return maxDepth; }
    public int getMaxPaths() { return maxPaths; }
}
