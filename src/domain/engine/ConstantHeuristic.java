package domain.engine;

import domain.graph.StateGraph;
import domain.model.State;

/**
 * Time-to-failure heuristic: {@code 0} at a failure state, a fixed constant elsewhere.
 *
 * <p>With unit edge costs and the default constant {@code 1.0} this is admissible,
 * so A* returns a shortest path.
 */
public final class ConstantHeuristic implements Heuristic {

    public static final double DEFAULT_ESTIMATE = 1.0;

    private final double estimate;

    public ConstantHeuristic() {
        this(DEFAULT_ESTIMATE);
    }

    public ConstantHeuristic(double estimate) {
        if (!(estimate > 0.0)) {
            throw new IllegalArgumentException("estimate must be positive, got: " + estimate);
        }
        this.estimate = estimate;
    }

    @Override
    public double estimate(State state, StateGraph graph) {
        return graph.isFailureState(state) ? 0.0 : estimate;
    }
}
