package application;

/**
 * Configuration constants for the discovery orchestrator.
 *
 * <p>Centralizes the bounds that keep graph construction and discovery tractable on
 * large batches. Reaching any of them silently truncates results; the truncation is
 * reproducible for the same input order and the same caps.
 */
public final class OrchestratorConfiguration {

    // =========================================================================
    // Parallelism Configuration
    // =========================================================================

    /**
     * Default ForkJoin parallelism level for parallel discovery.
     */
    public static final int DEFAULT_PARALLELISM = Runtime.getRuntime().availableProcessors();

    /**
     * Start-state range size at which a discovery task stops splitting and runs its
     * searches directly.
     */
    public static final int DISCOVERY_LEAF_SIZE = 8;

    // =========================================================================
    // Graph Construction Bounds
    // =========================================================================

    /**
     * Maximum similarity-mode edges added per source state.
     *
     * <p>Which neighbors are accepted depends on node enumeration order, so the same
     * record order must be used across runs for identical edge sets.
     */
    public static final int DEFAULT_SIMILARITY_NEIGHBOR_CAP = 20;

    /**
     * Batch size above which records are sampled before graph construction.
     */
    public static final int DEFAULT_MAX_RECORDS = 1000;

    // =========================================================================
    // Discovery Bounds
    // =========================================================================

    /** Upper bound applied on top of the configured {@code maxDepth} during discovery. */
    public static final int DISCOVERY_DEPTH_CAP = 10;

    /** Maximum paths accepted from a single start state. */
    public static final int MAX_PATHS_PER_START = 5;

    /** No new start-state search is issued once this many paths were accepted. */
    public static final int MAX_TOTAL_PATHS = 100;

    /** Size of the random start-state sample used when no state leads into a failure. */
    public static final int FALLBACK_SAMPLE_SIZE = 100;

    // =========================================================================
    // Reporting
    // =========================================================================

    /**
     * Bytes per megabyte for memory reporting.
     */
    public static final double BYTES_PER_MB = 1024.0 * 1024.0;

    /**
     * Private constructor to prevent instantiation.
     */
    private OrchestratorConfiguration() {
        throw new AssertionError("Utility class: do not instantiate");
    }
}
