package infrastructure.parallel;

import domain.engine.PathSearchEngine;
import domain.graph.StateGraph;
import domain.model.State;

import java.util.*;
import java.util.concurrent.RecursiveTask;
import java.util.function.Predicate;

/**
 * {@link RecursiveTask} that runs start-state searches of the discovery phase on a
 * ForkJoin pool.
 *
 * <p>The start-state range {@code [0, n)} is bisected until a task holds at most
 * {@code leafSize} start states; a leaf runs its searches one after the other.
 *
 * <h3>Isolation</h3>
 * <p>The graph is sealed and only read. Each search keeps its own frontier and visited
 * bookkeeping inside the engine call, so the only shared mutable object is the
 * {@link PathBudget}.
 *
 * <h3>Merge order</h3>
 * <p>Results are concatenated left range before right range, i.e. in start-state order.
 * Which searches are admitted once the cap is hit depends on completion timing.
 */
public final class StartStateSearchTask extends RecursiveTask<List<List<State>>> {

    private final PathSearchEngine engine;
    private final StateGraph graph;
    private final Predicate<State> goal;
    private final List<State> startStates;
    private final PathBudget budget;
    /** Inclusive start of the start-state range this task is responsible for. */
    private final int rangeStart;
    /** Exclusive end of the start-state range this task is responsible for. */
    private final int rangeEnd;
    private final int leafSize;

    /**
     * Constructs a root or child task for the given start-state range.
     *
     * @param engine      search engine (stateless between calls)
     * @param graph       sealed state graph
     * @param goal        goal predicate
     * @param startStates all start states, in discovery order
     * @param budget      shared global path cap
     * @param rangeStart  inclusive start index into {@code startStates}
     * @param rangeEnd    exclusive end index
     * @param leafSize    range size at which splitting stops
     */
    public StartStateSearchTask(PathSearchEngine engine,
                                StateGraph graph,
                                Predicate<State> goal,
                                List<State> startStates,
                                PathBudget budget,
                                int rangeStart, int rangeEnd,
                                int leafSize) {
        this.engine = engine;
        this.graph = graph;
        this.goal = goal;
        this.startStates = startStates;
        this.budget = budget;
        this.rangeStart = rangeStart;
        this.rangeEnd = rangeEnd;
        this.leafSize = Math.max(1, leafSize);
    }

    @Override
    protected List<List<State>> compute() {
        int rangeSize = rangeEnd - rangeStart;

        if (rangeSize <= leafSize) {
            List<List<State>> found = new ArrayList<>();
            for (int i = rangeStart; i < rangeEnd; i++) {
                if (budget.isExhausted()) break;
                List<List<State>> paths = engine.findPaths(graph, startStates.get(i), goal);
                if (budget.admit(paths.size())) {
                    found.addAll(paths);
                }
            }
            return found;
        }

        int mid = rangeStart + rangeSize / 2;
        StartStateSearchTask left = createSubtask(rangeStart, mid);
        StartStateSearchTask right = createSubtask(mid, rangeEnd);
        right.fork();
        List<List<State>> merged = new ArrayList<>(left.compute());
        merged.addAll(right.join());
        return merged;
    }

    private StartStateSearchTask createSubtask(int start, int end) {
        return new StartStateSearchTask(engine, graph, goal, startStates, budget, start, end, leafSize);
    }
}
