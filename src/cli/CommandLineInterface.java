package cli;

import application.DiscoveryResult;
import application.FailurePatternOrchestrator;
import application.OrchestratorConfiguration;
import application.SearchParameters;
import infrastructure.io.JsonResultWriter;
import infrastructure.io.ResultWriter;

import java.io.IOException;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Random;

/**
 * Command-line entry point for the failure-pattern miner.
 *
 * <h3>Usage</h3>
 * <pre>
 *   java cli.CommandLineInterface &lt;records.csv&gt; &lt;graph_config.json&gt; &lt;search_params.json&gt; [options]
 * </pre>
 *
 * <h3>Output</h3>
 * <ul>
 *   <li>With {@code --output-dir}: {@code sequences.json} and {@code warning_signs.json}
 *       in that directory</li>
 *   <li>Otherwise: tables on stdout via {@link ResultFormatter}</li>
 *   <li>Debug output goes to stderr (if --debug is enabled)</li>
 *   <li>Exit code is 0 on success, 1 on error</li>
 * </ul>
 *
 * @see ArgumentParser
 * @see FailurePatternOrchestrator
 */
public final class CommandLineInterface {

    /**
     * Main entry point.
     *
     * @param args command-line arguments
     */
    public static void main(String[] args) {
        try {
            execute(args);
        } catch (IllegalArgumentException e) {
            System.err.println("Argument Error: " + e.getMessage());
            System.exit(1);
        } catch (IOException e) {
            System.err.println("I/O Error: " + e.getMessage());
            System.exit(1);
        } catch (Exception e) {
            System.err.println("Unexpected error: " + e.getMessage());
            e.printStackTrace();
            System.exit(1);
        }
    }

    /**
     * Executes the discovery workflow.
     *
     * @param args command-line arguments
     * @throws IOException if input files cannot be loaded or results not written
     * @throws IllegalArgumentException if arguments or configuration are invalid
     */
    static void execute(String[] args) throws IOException {
        ArgumentParser parser = new ArgumentParser();
        parser.parse(args);

        if (parser.isHelpRequested()) {
            parser.printHelp();
            return;
        }

        long startTime = System.currentTimeMillis();

        DataLoader.DiscoveryInput input = new DataLoader().loadAll(
            parser.getRecordsFile(),
            parser.getGraphConfigFile(),
            parser.getSearchParamsFile(),
            parser.applyOverrides(new SearchParameters.Builder()));

        SearchParameters params = input.getSearchParameters();
        if (params.isDebugMode()) {
            System.err.printf("[CLI] Loaded %d records from: %s%n", input.getRecordCount(), parser.getRecordsFile());
            System.err.printf("[CLI] Parameters: %s%n", params);
        }

        Random random = parser.getSeed() != null ? new Random(parser.getSeed()) : new Random();
        FailurePatternOrchestrator orchestrator =
            new FailurePatternOrchestrator(input.getGraphConfiguration(), params, random);
        DiscoveryResult result = orchestrator.run(input.getRecords());
        if (params.isDebugMode() && result.getRecordCount() < input.getRecordCount()) {
            System.err.printf("[CLI] Sampled %d of %d records%n", result.getRecordCount(), input.getRecordCount());
        }

        long executionTime = System.currentTimeMillis() - startTime;

        if (parser.getOutputDir() != null) {
            writeResults(Paths.get(parser.getOutputDir()), result);
        } else {
            new ResultFormatter().printResults(
                result.getSequences(),
                result.getWarningSigns(),
                executionTime,
                measureMemoryUsage());
        }
    }

    private static void writeResults(Path outputDir, DiscoveryResult result) throws IOException {
        ResultWriter writer = new JsonResultWriter();
        Path sequences = writer.writeSequences(result.getSequences(), outputDir);
        Path warnings = writer.writeWarningSigns(result.getWarningSigns(), outputDir);
        System.err.println("[CLI] Results written to: " + sequences + ", " + warnings);
    }

    /**
     * Measures memory usage after discovery completes.
     *
     * @return memory used in megabytes
     */
    private static double measureMemoryUsage() {
        Runtime runtime = Runtime.getRuntime();
        long memoryBytes = runtime.totalMemory() - runtime.freeMemory();
        return memoryBytes / OrchestratorConfiguration.BYTES_PER_MB;
    }

    private CommandLineInterface() {
    }
}
