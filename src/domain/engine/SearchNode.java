package domain.engine;

import domain.model.State;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Represents a node in the search frontier for the queue-based traversal strategies.
 *
 * <p>Used by {@link BreadthFirstSearchEngine} and {@link AStarSearchEngine}. Each node
 * encapsulates:
 * <ul>
 *   <li><b>state</b>: the graph state reached</li>
 *   <li><b>parent</b>: the node it was reached from ({@code null} at the start)</li>
 *   <li><b>depth</b>: number of edges from the start state</li>
 *   <li><b>priority</b>: {@code g + w·h} for A*; unused by BFS</li>
 *   <li><b>sequence</b>: insertion counter, the A* tie-break</li>
 * </ul>
 *
 * <p>Paths are shared through parent links and materialized only when accepted.
 *
 * <p>This class is immutable and package-private: only used internally by search engines.
 */
final class SearchNode {
    final State state;
    final SearchNode parent;
    final int depth;
    final double priority;
    final long sequence;

    SearchNode(State state, SearchNode parent, int depth, double priority, long sequence) {
        this.state = state;
        this.parent = parent;
        this.depth = depth;
        this.priority = priority;
        this.sequence = sequence;
    }

    static SearchNode root(State start, double priority) {
        return new SearchNode(start, null, 0, priority, 0L);
    }

    /**
     * Rebuilds the path from the start state to this node.
     */
    List<State> toPath() {
        List<State> path = new ArrayList<>(depth + 1);
        for (SearchNode n = this; n != null; n = n.parent) {
            path.add(n.state);
        }
        Collections.reverse(path);
        return path;
    }
}
