package application;

import infrastructure.util.ValidationUtils;

import java.util.Locale;

/**
 * Immutable value object encapsulating all user-facing discovery parameters.
 *
 * <p>Constructed exclusively via the nested {@link Builder}, which validates each
 * parameter before allowing {@link Builder#build()} to succeed.
 *
 * <h3>Key parameters</h3>
 * <ul>
 *   <li><b>maxDepth</b>: maximum path length in edges (discovery further caps it at
 *       {@link OrchestratorConfiguration#DISCOVERY_DEPTH_CAP}).</li>
 *   <li><b>lookbackWindow</b>: accepted and carried, not enforced by any search.</li>
 *   <li><b>minPatternLength</b>: shortest path (in states) kept by pattern extraction.</li>
 *   <li><b>heuristic</b>, <b>aStarWeight</b>: A* estimate and its weight.</li>
 *   <li><b>discoveryStrategy</b>: traversal used per start state during discovery.</li>
 * </ul>
 *
 * <p>All fields are final; sharing a {@code SearchParameters} across threads is safe.
 */
public final class SearchParameters {

    /**
     * Traversal strategy used for each start state during discovery.
     * The default is {@link #BREADTH_FIRST}.
     */
    public enum DiscoveryStrategy {
        /** FIFO queue, shortest paths first, capped per start state (default). */
        BREADTH_FIRST,
        /** Backtracking DFS, cycle-free paths, capped per start state. */
        DEPTH_FIRST,
        /** Weighted A*, at most one path per start state. */
        A_STAR,
    }

    /**
     * Remaining-distance estimate for A*. Configuration files use the lower-case names.
     */
    public enum HeuristicType {
        /** Constant estimate: 0 at failure states, 1 elsewhere. */
        TIME_TO_FAILURE("time_to_failure"),
        /** Minimum label Hamming distance to a same-machine failure state. */
        SENSOR_DISTANCE("sensor_distance");

        private final String configName;

        HeuristicType(String configName) {
            this.configName = configName;
        }

        public String getConfigName() { return configName; }

        /**
         * Resolves a configuration name (case-insensitive) or enum constant name.
         *
         * @throws IllegalArgumentException for unknown names
         */
        public static HeuristicType fromName(String name) {
            if (name != null) {
                String normalized = name.trim().toLowerCase(Locale.ROOT);
                for (HeuristicType type : values()) {
                    if (type.configName.equals(normalized)) return type;
                }
            }
            throw new IllegalArgumentException(
                "Unknown heuristic: " + name + ". Valid heuristics: time_to_failure, sensor_distance");
        }
    }

    private final int maxDepth;
    private final int lookbackWindow;
    private final int minPatternLength;
    private final HeuristicType heuristic;
    private final double aStarWeight;
    private final DiscoveryStrategy discoveryStrategy;
    private final int maxRecords;
    private final boolean parallelDiscovery;
    private final boolean debugMode;

    private SearchParameters(Builder builder) {
        this.maxDepth = builder.maxDepth;
        this.lookbackWindow = builder.lookbackWindow;
        this.minPatternLength = builder.minPatternLength;
        this.heuristic = builder.heuristic;
        this.aStarWeight = builder.aStarWeight;
        this.discoveryStrategy = builder.discoveryStrategy;
        this.maxRecords = builder.maxRecords;
        this.parallelDiscovery = builder.parallelDiscovery;
        this.debugMode = builder.debugMode;
    }

    public int getMaxDepth() { return maxDepth; }
    public int getLookbackWindow() { return lookbackWindow; }
    public int getMinPatternLength() { return minPatternLength; }
    public HeuristicType getHeuristic() { return heuristic; }
    public double getAStarWeight() { return aStarWeight; }
    public DiscoveryStrategy getDiscoveryStrategy() { return discoveryStrategy; }
    public int getMaxRecords() { return maxRecords; }
    public boolean useParallelDiscovery() { return parallelDiscovery; }
    public boolean isDebugMode() { return debugMode; }

    /**
     * Returns a builder pre-filled with this instance's values.
     */
    public Builder toBuilder() {
        return new Builder()
            .setMaxDepth(maxDepth)
            .setLookbackWindow(lookbackWindow)
            .setMinPatternLength(minPatternLength)
            .setHeuristic(heuristic)
            .setAStarWeight(aStarWeight)
            .setDiscoveryStrategy(discoveryStrategy)
            .setMaxRecords(maxRecords)
            .setParallelDiscovery(parallelDiscovery)
            .setDebugMode(debugMode);
    }

    @Override
    public String toString() {
        return String.format(Locale.ROOT,
            "SearchParameters{maxDepth=%d, lookback=%d, minPatternLength=%d, heuristic=%s, weight=%.2f, strategy=%s}",
            maxDepth, lookbackWindow, minPatternLength, heuristic.getConfigName(), aStarWeight, discoveryStrategy);
    }

    /**
     * Fluent builder for {@link SearchParameters}.
     *
     * <p>Defaults:
     * <ul>
     *   <li>{@code maxDepth}: 50</li>
     *   <li>{@code lookbackWindow}: 50</li>
     *   <li>{@code minPatternLength}: 3</li>
     *   <li>{@code heuristic}: {@link HeuristicType#TIME_TO_FAILURE}</li>
     *   <li>{@code aStarWeight}: 1.0</li>
     *   <li>{@code discoveryStrategy}: {@link DiscoveryStrategy#BREADTH_FIRST}</li>
     *   <li>{@code maxRecords}: {@link OrchestratorConfiguration#DEFAULT_MAX_RECORDS}</li>
     *   <li>{@code parallelDiscovery}: {@code false}</li>
     * </ul>
     */
    public static class Builder {
        private int maxDepth = 50;
        private int lookbackWindow = 50;
        private int minPatternLength = 3;
        private HeuristicType heuristic = HeuristicType.TIME_TO_FAILURE;
        private double aStarWeight = 1.0;
        private DiscoveryStrategy discoveryStrategy = DiscoveryStrategy.BREADTH_FIRST;
        private int maxRecords = OrchestratorConfiguration.DEFAULT_MAX_RECORDS;
        private boolean parallelDiscovery = false;
        private boolean debugMode = false;

        public Builder setMaxDepth(int maxDepth) {
            ValidationUtils.validatePositive(maxDepth, "maxDepth");
            this.maxDepth = maxDepth;
            return this;
        }

        public Builder setLookbackWindow(int lookbackWindow) {
            ValidationUtils.validatePositive(lookbackWindow, "lookbackWindow");
            this.lookbackWindow = lookbackWindow;
            return this;
        }

        public Builder setMinPatternLength(int minPatternLength) {
            ValidationUtils.validatePositive(minPatternLength, "minPatternLength");
            this.minPatternLength = minPatternLength;
            return this;
        }

        public Builder setHeuristic(HeuristicType heuristic) {
            if (heuristic == null) throw new IllegalArgumentException("heuristic cannot be null");
            this.heuristic = heuristic;
            return this;
        }

        /**
         * Sets the A* heuristic weight.
         *
         * <p>{@code 1.0} is standard A*; values above {@code 1.0} favour the heuristic
         * and make the search greedier.
         *
         * @param weight positive finite weight
         * @return this builder
         */
        public Builder setAStarWeight(double weight) {
            ValidationUtils.validatePositive(weight, "aStarWeight");
            this.aStarWeight = weight;
            return this;
        }

        public Builder setDiscoveryStrategy(DiscoveryStrategy strategy) {
            if (strategy == null) throw new IllegalArgumentException("discoveryStrategy cannot be null");
            this.discoveryStrategy = strategy;
            return this;
        }

        /**
         * Sets the batch size above which records are sampled before graph construction.
         */
        public Builder setMaxRecords(int maxRecords) {
            ValidationUtils.validatePositive(maxRecords, "maxRecords");
            this.maxRecords = maxRecords;
            return this;
        }

        /**
         * Sets whether start-state searches run on a ForkJoin pool.
         *
         * <p><b>Default</b>: {@code false} (sequential, fully reproducible order)
         */
        public Builder setParallelDiscovery(boolean parallel) {
            this.parallelDiscovery = parallel;
            return this;
        }

        public Builder setDebugMode(boolean debug) {
            this.debugMode = debug;
            return this;
        }

        public SearchParameters build() {
            return new SearchParameters(this);
        }
    }
}
