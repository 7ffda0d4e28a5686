package domain.engine;

import domain.graph.StateGraph;
import domain.model.State;

import java.util.List;
import java.util.function.Predicate;

/**
 * Common interface for all traversal strategies over a {@link StateGraph}.
 *
 * <p>Each strategy starts from one state and enumerates paths that end in a state
 * satisfying the caller's goal predicate (in practice: "is a failure state"). They differ
 * in traversal order and therefore in which paths are found first under the same bounds:
 * <ul>
 *   <li>{@link BreadthFirstSearchEngine}: FIFO queue, shortest paths first</li>
 *   <li>{@link DepthFirstSearchEngine}: LIFO with backtracking, cycle-free paths</li>
 *   <li>{@link AStarSearchEngine}: priority queue on {@code g + w·h}, one best path</li>
 * </ul>
 *
 * <p><b>Bounds</b>: every path returned contains at most {@code maxDepth + 1} states.
 * Running out of frontier is not an error; the result is simply empty.
 *
 * <p><b>Thread safety</b>: implementations keep all traversal bookkeeping local to a
 * single {@link #findPaths} call, so one engine may serve concurrent searches over a
 * sealed graph.
 *
 * @see application.SearchEngineFactory
 */
public interface PathSearchEngine {

    /**
     * Enumerates goal-terminated paths reachable from {@code start}.
     *
     * @param graph sealed state graph
     * @param start starting state (included as the first element of every path)
     * @param goal  goal predicate; a goal state ends a path and is not expanded
     * @return accepted paths in discovery order; never {@code null}
     */
    List<List<State>> findPaths(StateGraph graph, State start, Predicate<State> goal);
}
