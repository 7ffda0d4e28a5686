package domain.engine;

import domain.graph.StateGraph;
import domain.model.State;

/**
 * Sensor-space heuristic: minimum number of differing bin labels between a state and
 * any failure state of the same machine.
 *
 * <p>Returns {@link #NO_FAILURE_ESTIMATE} when the machine has no failure state (or the
 * graph has none at all), and {@code 0} at a failure state.
 */
public final class SensorDistanceHeuristic implements Heuristic {

    /** Estimate used when no same-machine failure state exists. */
    public static final double NO_FAILURE_ESTIMATE = 10.0;

    @Override
    public double estimate(State state, StateGraph graph) {
        if (graph.isFailureState(state)) return 0.0;

        int best = Integer.MAX_VALUE;
        for (State failure : graph.getFailureStates()) {
            if (!failure.getMachineId().equals(state.getMachineId())) continue;
            int distance = state.labelDistance(failure);
            if (distance >= 0 && distance < best) best = distance;
        }
        return best == Integer.MAX_VALUE ? NO_FAILURE_ESTIMATE : best;
    }
}
