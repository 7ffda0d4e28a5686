package application;

import domain.engine.PathSearchEngine;
import domain.graph.StateGraph;
import domain.model.FailureSequence;
import domain.model.SensorRecord;
import domain.model.State;
import domain.model.WarningSign;
import domain.pattern.PatternExtractor;
import domain.pattern.WarningSignRanker;
import infrastructure.builder.StateGraphBuilder;
import infrastructure.parallel.PathBudget;
import infrastructure.parallel.StartStateSearchTask;

import java.util.*;
import java.util.concurrent.ForkJoinPool;
import java.util.function.Predicate;

import static application.OrchestratorConfiguration.*;

/**
 * Orchestrates the four-phase failure-pattern discovery workflow.
 *
 * <h3>Phase sequence</h3>
 * <ol>
 *   <li><b>PHASE 1: SAMPLING</b>: Cap oversized batches at {@code maxRecords}, keeping
 *       failure records over-represented.</li>
 *   <li><b>PHASE 2: GRAPH</b>: Discretize records and build the sealed state graph.</li>
 *   <li><b>PHASE 3: DISCOVERY</b>: Search from every start state toward failure states,
 *       sequentially or on a ForkJoin pool.</li>
 *   <li><b>PHASE 4: PATTERNS</b>: Group paths into failure sequences and rank them as
 *       warning signs.</li>
 * </ol>
 *
 * <p>All randomness (record sampling, fallback start states) comes from the injected
 * {@link Random}; a seeded instance makes sequential runs fully reproducible.
 *
 * @see GraphConfiguration
 * @see SearchParameters
 * @see SearchEngineFactory
 */
public final class FailurePatternOrchestrator {

    private final GraphConfiguration graphConfig;
    private final SearchParameters params;
    private final Random random;
    private final StateGraphBuilder graphBuilder;
    private final PatternExtractor extractor;
    private final WarningSignRanker ranker;

    /**
     * Constructs an orchestrator.
     *
     * @param graphConfig discretization and state-component configuration
     * @param params      search parameters
     * @param random      source of randomness for sampling
     */
    public FailurePatternOrchestrator(GraphConfiguration graphConfig,
                                      SearchParameters params,
                                      Random random) {
        this.graphConfig = Objects.requireNonNull(graphConfig, "graphConfig");
        this.params = Objects.requireNonNull(params, "params");
        this.random = Objects.requireNonNull(random, "random");
        this.graphBuilder = new StateGraphBuilder(graphConfig);
        this.extractor = new PatternExtractor();
        this.ranker = new WarningSignRanker();
    }

    /**
     * Runs the full pipeline on one batch of records.
     *
     * @param records canonical sensor records
     * @return graph, paths, sequences and warning signs of this run
     */
    public DiscoveryResult run(List<SensorRecord> records) {
        long startTime = System.currentTimeMillis();

        // PHASE 1: Sampling
        List<SensorRecord> sampled = sampleRecords(records);
        if (params.isDebugMode()) {
            System.err.printf("[Phase 1: SAMPLING] %d of %d records kept%n", sampled.size(), records.size());
        }
        logPhaseCompletion(1, startTime);

        // PHASE 2: Graph construction
        long phase2Start = System.currentTimeMillis();
        StateGraph graph = graphBuilder.build(sampled);
        if (params.isDebugMode()) {
            System.err.printf("[Phase 2: GRAPH] %d states, %d edges, %d failure states%n",
                graph.nodeCount(), graph.edgeCount(), graph.getFailureStates().size());
        }
        logPhaseCompletion(2, phase2Start);

        // PHASE 3: Discovery
        long phase3Start = System.currentTimeMillis();
        List<List<State>> paths = discover(graph);
        logPhaseCompletion(3, phase3Start);

        // PHASE 4: Extraction and ranking
        long phase4Start = System.currentTimeMillis();
        List<FailureSequence> sequences = extractor.extract(paths, params.getMinPatternLength());
        List<WarningSign> warnings = ranker.rank(sequences);
        if (params.isDebugMode()) {
            System.err.printf("[Phase 4: PATTERNS] %d sequences, %d warning signs%n",
                sequences.size(), warnings.size());
        }
        logPhaseCompletion(4, phase4Start);

        if (params.isDebugMode()) {
            long totalTime = System.currentTimeMillis() - startTime;
            System.err.printf("[TOTAL] Time: %d ms%n", totalTime);
        }

        return new DiscoveryResult(sampled.size(), graph, paths, sequences, warnings);
    }

    // =========================================================================
    // Phase 1: Sampling
    // =========================================================================

    /**
     * Returns the batch unchanged when it fits {@code maxRecords}; otherwise keeps up to
     * {@code maxRecords / 2} failure records plus enough normal records to reach
     * {@code maxRecords}, combined and shuffled.
     *
     * @param records full batch
     * @return the records graph construction will see
     */
    public List<SensorRecord> sampleRecords(List<SensorRecord> records) {
        int maxRecords = params.getMaxRecords();
        if (records.size() <= maxRecords) {
            return records;
        }

        List<SensorRecord> failures = new ArrayList<>();
        List<SensorRecord> normals = new ArrayList<>();
        for (SensorRecord record : records) {
            (record.isFailure() ? failures : normals).add(record);
        }

        List<SensorRecord> sampled = new ArrayList<>(maxRecords);
        sampled.addAll(sample(failures, maxRecords / 2));
        sampled.addAll(sample(normals, maxRecords - sampled.size()));
        Collections.shuffle(sampled, random);
        return sampled;
    }

    // =========================================================================
    // Phase 3: Discovery
    // =========================================================================

    /**
     * Finds paths from the start states of {@code graph} into failure states.
     *
     * <p>Each start state is searched with depth {@code min(maxDepth, DISCOVERY_DEPTH_CAP)}
     * and at most {@code MAX_PATHS_PER_START} paths. No new search is issued once
     * {@code MAX_TOTAL_PATHS} paths were accepted.
     *
     * @param graph sealed state graph
     * @return accepted paths, in start-state order
     */
    public List<List<State>> discover(StateGraph graph) {
        return discover(graph, this.params);
    }

    /**
     * Same as {@link #discover(StateGraph)} with explicit parameters, e.g. to rerun
     * discovery on one graph with another strategy.
     */
    public List<List<State>> discover(StateGraph graph, SearchParameters params) {
        List<State> startStates = selectStartStates(graph);
        PathSearchEngine engine = SearchEngineFactory.createDiscoveryEngine(params);
        Predicate<State> goal = graph::isFailureState;
        PathBudget budget = new PathBudget(MAX_TOTAL_PATHS);

        if (params.isDebugMode()) {
            String mode = params.useParallelDiscovery() ? "parallel" : "sequential";
            System.err.printf("[Phase 3: DISCOVERY] Starting %s discovery from %d start states (strategy: %s)...%n",
                mode, startStates.size(), params.getDiscoveryStrategy());
        }

        List<List<State>> paths = params.useParallelDiscovery()
            ? discoverParallel(engine, graph, goal, startStates, budget)
            : discoverSequential(engine, graph, goal, startStates, budget);

        if (params.isDebugMode()) {
            System.err.printf("  Paths accepted: %d%n", paths.size());
        }
        return paths;
    }

    /**
     * Non-failure states with a direct edge into a failure state, in node insertion order.
     * When there are none, a random sample of at most {@code FALLBACK_SAMPLE_SIZE}
     * non-failure states.
     *
     * @param graph sealed state graph
     * @return start states for discovery
     */
    public List<State> selectStartStates(StateGraph graph) {
        List<State> starts = graph.getNonFailurePredecessorsOfFailures();
        if (!starts.isEmpty()) {
            return starts;
        }

        List<State> candidates = new ArrayList<>();
        for (State state : graph.getNodes()) {
            if (!graph.isFailureState(state)) {
                candidates.add(state);
            }
        }
        return sample(candidates, FALLBACK_SAMPLE_SIZE);
    }

    private List<List<State>> discoverSequential(PathSearchEngine engine,
                                                 StateGraph graph,
                                                 Predicate<State> goal,
                                                 List<State> startStates,
                                                 PathBudget budget) {
        List<List<State>> paths = new ArrayList<>();
        for (State start : startStates) {
            if (budget.isExhausted()) break;
            List<List<State>> found = engine.findPaths(graph, start, goal);
            if (budget.admit(found.size())) {
                paths.addAll(found);
            }
        }
        return paths;
    }

    private List<List<State>> discoverParallel(PathSearchEngine engine,
                                               StateGraph graph,
                                               Predicate<State> goal,
                                               List<State> startStates,
                                               PathBudget budget) {
        if (startStates.isEmpty()) {
            return new ArrayList<>();
        }

        StartStateSearchTask rootTask = new StartStateSearchTask(
            engine,
            graph,
            goal,
            startStates,
            budget,
            0,
            startStates.size(),
            DISCOVERY_LEAF_SIZE
        );

        ForkJoinPool pool = new ForkJoinPool(DEFAULT_PARALLELISM);
        try {
            return pool.invoke(rootTask);
        } finally {
            pool.shutdown();
        }
    }

    // =========================================================================
    // Helper Methods
    // =========================================================================

    /**
     * Uniform sample without replacement of at most {@code k} elements.
     */
    private <T> List<T> sample(List<T> items, int k) {
        if (items.size() <= k) {
            return new ArrayList<>(items);
        }
        List<T> shuffled = new ArrayList<>(items);
        Collections.shuffle(shuffled, random);
        return new ArrayList<>(shuffled.subList(0, k));
    }

    /**
     * Logs phase completion time if debug mode is enabled.
     *
     * @param phaseNumber the phase number (1 to 4)
     * @param startTime   phase start time in milliseconds
     */
    private void logPhaseCompletion(int phaseNumber, long startTime) {
        if (params.isDebugMode()) {
            long duration = System.currentTimeMillis() - startTime;
            System.err.printf("[Phase %d] Time: %d ms%n", phaseNumber, duration);
        }
    }

    public GraphConfiguration getGraphConfiguration() { return graphConfig; }

    public SearchParameters getSearchParameters() { return params; }
}
