package application;

import domain.engine.*;

/**
 * Factory for creating {@link PathSearchEngine} and {@link Heuristic} instances from
 * {@link SearchParameters}.
 *
 * <p>Centralizes all engine creation logic so that {@link FailurePatternOrchestrator}
 * never depends on concrete engine classes.
 *
 * <h3>Supported strategies</h3>
 * <ul>
 *   <li><b>BREADTH_FIRST</b>: FIFO queue (default)</li>
 *   <li><b>DEPTH_FIRST</b>: backtracking DFS</li>
 *   <li><b>A_STAR</b>: weighted A* with the configured heuristic</li>
 * </ul>
 *
 * @see PathSearchEngine
 * @see SearchParameters.DiscoveryStrategy
 */
public final class SearchEngineFactory {

    /**
     * Creates the heuristic named by the configuration.
     *
     * @param type heuristic selector
     * @return heuristic implementation
     * @throws IllegalStateException if type is unknown
     */
    public static Heuristic createHeuristic(SearchParameters.HeuristicType type) {
        switch (type) {
            case TIME_TO_FAILURE:
                return new ConstantHeuristic();

            case SENSOR_DISTANCE:
                return new SensorDistanceHeuristic();

            default:
                throw new IllegalStateException(
                    "Unknown heuristic: " + type + ". " +
                    "This indicates a configuration validation bug.");
        }
    }

    /**
     * Creates an engine bounded by {@code params.getMaxDepth()} and the given path cap.
     *
     * @param params   search parameters with strategy, heuristic and weight
     * @param maxPaths per-search path cap (ignored by A*, which returns at most one)
     * @return the configured search engine
     */
    public static PathSearchEngine createSearchEngine(SearchParameters params, int maxPaths) {
        return createSearchEngine(params.getDiscoveryStrategy(), params, params.getMaxDepth(), maxPaths);
    }

    /**
     * Creates the engine used for each start state during discovery: depth capped at
     * {@code min(maxDepth, DISCOVERY_DEPTH_CAP)}, {@code MAX_PATHS_PER_START} paths.
     *
     * @param params search parameters
     * @return the discovery engine
     */
    public static PathSearchEngine createDiscoveryEngine(SearchParameters params) {
        int depth = Math.min(params.getMaxDepth(), OrchestratorConfiguration.DISCOVERY_DEPTH_CAP);
        return createSearchEngine(params.getDiscoveryStrategy(), params, depth,
            OrchestratorConfiguration.MAX_PATHS_PER_START);
    }

    private static PathSearchEngine createSearchEngine(SearchParameters.DiscoveryStrategy strategy,
                                                       SearchParameters params,
                                                       int maxDepth,
                                                       int maxPaths) {
        switch (strategy) {
            case BREADTH_FIRST:
                return new BreadthFirstSearchEngine(maxDepth, maxPaths);

            case DEPTH_FIRST:
                return new DepthFirstSearchEngine(maxDepth, maxPaths);

            case A_STAR:
                return new AStarSearchEngine(
                    createHeuristic(params.getHeuristic()), maxDepth, params.getAStarWeight());

            default:
                // All valid DiscoveryStrategy enum values are handled above
                throw new IllegalStateException(
                    "Unknown search strategy: " + strategy + ". " +
                    "This indicates a configuration validation bug.");
        }
    }

    /**
     * Private constructor to prevent instantiation.
     */
    private SearchEngineFactory() {
        throw new AssertionError("Factory class: do not instantiate");
    }
}
