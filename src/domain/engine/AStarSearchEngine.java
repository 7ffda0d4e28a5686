package domain.engine;

import domain.graph.StateGraph;
import domain.model.State;
import infrastructure.util.ValidationUtils;

import java.util.*;
import java.util.function.Predicate;

/**
 * Heuristic best-first (A*) engine: expands the frontier node with the lowest
 * {@code g + weight·h} first and returns the first goal path popped.
 *
 * <p>{@code g} is the path length so far (unit edge cost), {@code h} comes from the
 * pluggable {@link Heuristic}. A weight above {@code 1.0} biases the search toward
 * greedier, heuristic-driven expansion.
 *
 * <h3>Ordering</h3>
 * <p>Priority ties are broken by insertion order (earlier pushes first), which makes the
 * result deterministic for a given graph and adjacency order.
 *
 * <h3>Closed set</h3>
 * <p>A state is finalized the first time it is popped; later pops of the same state
 * are ignored. Frontier entries are only pushed when they improve the best known
 * {@code g} for their state.
 *
 * <p><b>Result:</b> a single path, or {@link Optional#empty()} when the frontier empties
 * or every remaining candidate would exceed {@code maxDepth}.
 */
public final class AStarSearchEngine implements PathSearchEngine {

    private final Heuristic heuristic;
    private final int maxDepth;
    private final double weight;

    /**
     * Constructs an A* engine.
     *
     * @param heuristic remaining-distance estimate
     * @param maxDepth  maximum number of edges in the returned path
     * @param weight    heuristic weight ({@code 1.0} = standard A*)
     */
    public AStarSearchEngine(Heuristic heuristic, int maxDepth, double weight) {
        if (heuristic == null) throw new IllegalArgumentException("heuristic cannot be null");
        ValidationUtils.validateNonNegative(maxDepth, "maxDepth");
        ValidationUtils.validatePositive(weight, "weight");
        this.heuristic = heuristic;
        this.maxDepth = maxDepth;
        this.weight = weight;
    }

    /**
     * Finds the first goal path in {@code g + w·h} order.
     *
     * @param graph sealed state graph
     * @param start starting state
     * @param goal  goal predicate
     * @return the path, or empty if none exists within the depth bound
     */
    public Optional<List<State>> findPath(StateGraph graph, State start, Predicate<State> goal) {
        // Min-heap on g + w·h, insertion order on ties
        PriorityQueue<SearchNode> open = new PriorityQueue<>(
            Comparator.comparingDouble((SearchNode n) -> n.priority)
                .thenComparingLong(n -> n.sequence));
        Map<State, Integer> bestCost = new HashMap<>();
        Set<State> closed = new HashSet<>();
        long sequence = 0L;

        open.offer(SearchNode.root(start, weight * heuristic.estimate(start, graph)));
        bestCost.put(start, 0);

        while (!open.isEmpty()) {
            SearchNode node = open.poll();
            if (!closed.add(node.state)) continue;

            if (goal.test(node.state)) {
                return Optional.of(node.toPath());
            }
            if (node.depth >= maxDepth) continue;

            int tentative = node.depth + 1;
            for (State neighbor : graph.getNeighbors(node.state)) {
                if (closed.contains(neighbor)) continue;

                Integer known = bestCost.get(neighbor);
                if (known != null && tentative >= known) continue;
                bestCost.put(neighbor, tentative);

                double priority = tentative + weight * heuristic.estimate(neighbor, graph);
                open.offer(new SearchNode(neighbor, node, tentative, priority, ++sequence));
            }
        }
        return Optional.empty();
    }

    /**
     * Wraps {@link #findPath} as a zero- or one-element path list.
     */
    @Override
    public List<List<State>> findPaths(StateGraph graph, State start, Predicate<State> goal) {
        Optional<List<State>> path = findPath(graph, start, goal);
        return path.isPresent()
            ? Collections.singletonList(path.get())
            : Collections.emptyList();
    }

    public Heuristic getHeuristic() { return heuristic; }
    public double getWeight() { return weight; }
}
