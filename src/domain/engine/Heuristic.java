package domain.engine;

import domain.graph.StateGraph;
import domain.model.State;

/**
 * Estimate of the remaining distance from a state to the nearest failure state.
 *
 * <p>Used by {@link AStarSearchEngine}. Implementations must return {@code 0.0} for
 * failure states and a non-negative value otherwise. They are not required to be
 * admissible; a non-admissible estimate only makes A* greedier.
 */
public interface Heuristic {

    /**
     * @param state state being scored
     * @param graph graph the search runs over (source of failure states)
     * @return non-negative distance estimate
     */
    double estimate(State state, StateGraph graph);
}
