package cli;

import application.SearchParameters;
import infrastructure.util.ValidationUtils;

import java.util.Locale;

/**
 * Parses and validates all command-line arguments for the failure-pattern miner.
 *
 * <h3>Syntax</h3>
 * <pre>
 *   &lt;records.csv&gt; &lt;graph_config.json&gt; &lt;search_params.json&gt;
 *       [--help | -h]
 *       [--debug]
 *       [--output-dir &lt;dir&gt; | -o &lt;dir&gt;]
 *       [--strategy BREADTH_FIRST|DEPTH_FIRST|A_STAR]
 *       [--seed &lt;n&gt;]
 *       [--max-records &lt;n&gt;]
 *       [--parallel]
 * </pre>
 *
 * <h3>Required positional arguments</h3>
 * <ol>
 *   <li>{@code records.csv}       : sensor records with header row</li>
 *   <li>{@code graph_config.json} : discretization and state components</li>
 *   <li>{@code search_params.json}: search parameters</li>
 * </ol>
 *
 * <p>Flags override the values read from {@code search_params.json}.
 *
 * @see SearchParameters
 */
public final class ArgumentParser {

    // =========================================================================
    // Error Messages
    // =========================================================================

    private static final String USAGE_MESSAGE =
        "Usage: <records.csv> <graph_config.json> <search_params.json> [OPTIONS]\n" +
        "Options:\n" +
        "  --help, -h               Show this help message and exit\n" +
        "  --debug                  Enable debug output with phase-level timing\n" +
        "  --output-dir, -o <dir>   Write sequences.json and warning_signs.json to dir\n" +
        "  --strategy <strategy>    Discovery strategy: BREADTH_FIRST, DEPTH_FIRST, A_STAR (default: BREADTH_FIRST)\n" +
        "  --seed <n>               Random seed for sampling (default: unseeded)\n" +
        "  --max-records <n>        Sample batches larger than n records (default: 1000)\n" +
        "  --parallel               Run start-state searches on a ForkJoin pool";

    private static final String MISSING_ARGS_ERROR =
        "Missing required arguments. " + USAGE_MESSAGE;

    private static final String MISSING_STRATEGY_VALUE =
        "--strategy requires a value (BREADTH_FIRST, DEPTH_FIRST, A_STAR)";

    private static final String UNKNOWN_STRATEGY_FORMAT =
        "Unknown strategy: %s. Valid strategies: BREADTH_FIRST, DEPTH_FIRST, A_STAR";

    private static final String MISSING_OUTPUT_VALUE =
        "--output-dir requires a directory path";

    private static final String MISSING_SEED_VALUE =
        "--seed requires an integer value";

    private static final String INVALID_SEED_FORMAT =
        "Invalid seed: %s. Must be an integer";

    private static final String MISSING_MAX_RECORDS_VALUE =
        "--max-records requires a positive integer";

    private static final String INVALID_MAX_RECORDS_FORMAT =
        "Invalid max-records: %s. Must be a positive integer";

    private static final String UNKNOWN_ARG_FORMAT =
        "Unknown argument: %s. Use --help for usage information.";

    // =========================================================================
    // Parsed Fields
    // =========================================================================

    private String recordsFile;
    private String graphConfigFile;
    private String searchParamsFile;
    private boolean helpRequested = false;
    private boolean debugMode = false;
    private String outputDir = null;
    private boolean parallel = false;
    private SearchParameters.DiscoveryStrategy strategy = null;
    private Long seed = null;
    private Integer maxRecords = null;

    // =========================================================================
    // Public API
    // =========================================================================

    /**
     * Parses command-line arguments.
     *
     * @param args command-line arguments from {@code main()}
     * @throws IllegalArgumentException if arguments are invalid or missing
     */
    public void parse(String[] args) {
        if (args.length > 0 && (args[0].equals("--help") || args[0].equals("-h"))) {
            helpRequested = true;
            return;
        }

        if (args.length < 3) {
            throw new IllegalArgumentException(MISSING_ARGS_ERROR);
        }

        recordsFile = args[0];
        graphConfigFile = args[1];
        searchParamsFile = args[2];

        parseOptionalFlags(args);
    }

    /**
     * Applies the command-line overrides on top of a builder pre-filled from the
     * search parameter file.
     *
     * <p>Must be called after {@link #parse(String[])}.
     *
     * @param builder builder with file-based values
     * @return the same builder
     */
    public SearchParameters.Builder applyOverrides(SearchParameters.Builder builder) {
        builder.setDebugMode(debugMode)
               .setParallelDiscovery(parallel);
        if (strategy != null) {
            builder.setDiscoveryStrategy(strategy);
        }
        if (maxRecords != null) {
            builder.setMaxRecords(maxRecords);
        }
        return builder;
    }

    // =========================================================================
    // Getters
    // =========================================================================

    public String getRecordsFile() { return recordsFile; }
    public String getGraphConfigFile() { return graphConfigFile; }
    public String getSearchParamsFile() { return searchParamsFile; }
    public boolean isHelpRequested() { return helpRequested; }
    public boolean isDebugMode() { return debugMode; }
    public String getOutputDir() { return outputDir; }
    public boolean isParallel() { return parallel; }
    /** @return the strategy override, or {@code null} when not given */
    public SearchParameters.DiscoveryStrategy getStrategy() { return strategy; }
    /** @return the seed, or {@code null} for an unseeded run */
    public Long getSeed() { return seed; }
    public Integer getMaxRecords() { return maxRecords; }

    /**
     * Prints help message to stderr.
     */
    public void printHelp() {
        System.err.println("Failure Pattern Miner: state-graph discovery of pre-failure sensor sequences");
        System.err.println();
        System.err.println(USAGE_MESSAGE);
        System.err.println();
        System.err.println("Example:");
        System.err.println("  java cli.CommandLineInterface data/records.csv config/graph.json config/search.json --seed 42 -o out");
    }

    // =========================================================================
    // Private Parsing Methods
    // =========================================================================

    /**
     * Parses optional flags starting after the three positional arguments.
     *
     * <p>Flags taking a value delegate to a {@code parseXFlag} helper that returns the
     * index of the consumed value; the loop increment then moves past it.
     *
     * @param args command-line arguments
     * @throws IllegalArgumentException if flags are invalid
     */
    private void parseOptionalFlags(String[] args) {
        for (int i = 3; i < args.length; i++) {
            String arg = args[i];

            switch (arg) {
                case "--help":
                case "-h":
                    helpRequested = true;
                    break;

                case "--debug":
                    debugMode = true;
                    break;

                case "--parallel":
                    parallel = true;
                    break;

                case "--output-dir":
                case "-o":
                    i = parseOutputFlag(args, i);
                    break;

                case "--strategy":
                    i = parseStrategyFlag(args, i);
                    break;

                case "--seed":
                    i = parseSeedFlag(args, i);
                    break;

                case "--max-records":
                    i = parseMaxRecordsFlag(args, i);
                    break;

                default:
                    throw new IllegalArgumentException(String.format(UNKNOWN_ARG_FORMAT, arg));
            }
        }
    }

    private int parseOutputFlag(String[] args, int i) {
        if (i + 1 >= args.length) {
            throw new IllegalArgumentException(MISSING_OUTPUT_VALUE);
        }

        outputDir = args[++i];
        return i;
    }

    private int parseStrategyFlag(String[] args, int i) {
        if (i + 1 >= args.length) {
            throw new IllegalArgumentException(MISSING_STRATEGY_VALUE);
        }

        String strategyStr = args[++i].toUpperCase(Locale.ROOT);

        try {
            strategy = SearchParameters.DiscoveryStrategy.valueOf(strategyStr);
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException(
                String.format(UNKNOWN_STRATEGY_FORMAT, strategyStr), e);
        }

        return i;
    }

    private int parseSeedFlag(String[] args, int i) {
        if (i + 1 >= args.length) {
            throw new IllegalArgumentException(MISSING_SEED_VALUE);
        }

        String seedStr = args[++i];

        try {
            seed = Long.parseLong(seedStr);
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException(String.format(INVALID_SEED_FORMAT, seedStr), e);
        }

        return i;
    }

    private int parseMaxRecordsFlag(String[] args, int i) {
        if (i + 1 >= args.length) {
            throw new IllegalArgumentException(MISSING_MAX_RECORDS_VALUE);
        }

        String value = args[++i];

        try {
            int parsed = Integer.parseInt(value);
            ValidationUtils.validatePositive(parsed, "max-records");
            maxRecords = parsed;
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException(String.format(INVALID_MAX_RECORDS_FORMAT, value), e);
        }

        return i;
    }
}
