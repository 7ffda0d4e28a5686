package domain.engine;

import domain.graph.StateGraph;
import domain.model.State;
import infrastructure.util.ValidationUtils;

import java.util.*;
import java.util.function.Predicate;

/**
 * Depth-first search engine with explicit backtracking (standard DFS).
 *
 * <p>Maintains the active path as a stack of frames, each holding an iterator over its
 * state's successors, together with an {@code onPath} set of the states currently on
 * that path. A successor already on the path is skipped, so no returned path repeats a
 * state. When a frame's successors are exhausted it is popped and its state leaves the
 * {@code onPath} set, so the state may be visited again through a different branch.
 *
 * <p>Every goal state reached is recorded as a path and not expanded. Frames at depth
 * {@code maxDepth} are not expanded. Successors are explored in adjacency order.
 *
 * <br><b>Memory:</b> O(depth): most economical of the engines.
 * <br><b>Traversal order:</b> lexicographic by adjacency order (no reordering).
 */
public final class DepthFirstSearchEngine implements PathSearchEngine {

    private final int maxDepth;
    private final int maxPaths;

    /**
     * Constructs an unbounded-path-count DFS engine.
     *
     * @param maxDepth maximum number of edges in an accepted path
     */
    public DepthFirstSearchEngine(int maxDepth) {
        this(maxDepth, Integer.MAX_VALUE);
    }

    /**
     * Constructs a DFS engine.
     *
     * @param maxDepth maximum number of edges in an accepted path
     * @param maxPaths stop once this many paths are accepted
     */
    public DepthFirstSearchEngine(int maxDepth, int maxPaths) {
        ValidationUtils.validateNonNegative(maxDepth, "maxDepth");
        ValidationUtils.validatePositive(maxPaths, "maxPaths");
        this.maxDepth = maxDepth;
        this.maxPaths = maxPaths;
    }

    @Override
    public List<List<State>> findPaths(StateGraph graph, State start, Predicate<State> goal) {
        List<List<State>> paths = new ArrayList<>();

        if (goal.test(start)) {
            paths.add(Collections.singletonList(start));
            return paths;
        }

        Deque<Frame> stack = new ArrayDeque<>();
        Set<State> onPath = new HashSet<>();
        stack.push(new Frame(start, graph.getNeighbors(start).iterator()));
        onPath.add(start);

        while (!stack.isEmpty() && paths.size() < maxPaths) {
            Frame top = stack.peek();
            int depth = stack.size() - 1;

            if (depth >= maxDepth || !top.successors.hasNext()) {
                // Backtrack
                stack.pop();
                onPath.remove(top.state);
                continue;
            }

            State next = top.successors.next();
            if (onPath.contains(next)) continue;

            if (goal.test(next)) {
                List<State> path = currentPath(stack);
                path.add(next);
                paths.add(path);
                continue;
            }

            stack.push(new Frame(next, graph.getNeighbors(next).iterator()));
            onPath.add(next);
        }
        return paths;
    }

    /** Active path from start to the top frame; the stack iterates top-first. */
    private static List<State> currentPath(Deque<Frame> stack) {
        List<State> path = new ArrayList<>(stack.size() + 1);
        Iterator<Frame> it = stack.descendingIterator();
        while (it.hasNext()) {
            path.add(it.next().state);
        }
        return path;
    }

    public int getMaxDepth() { return maxDepth; }

    private static final class Frame {
        final State state;
        final Iterator<State> successors;

        Frame(State state, Iterator<State> successors) {
            this.state = state;
            this.successors = successors;
        }
    }
}
