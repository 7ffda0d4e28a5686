package cli;

import domain.model.FailureSequence;
import domain.model.WarningSign;

import java.io.PrintStream;
import java.util.List;
import java.util.Locale;

/**
 * Formats discovery results as plain-text tables.
 *
 * <p>Sequences are listed by descending frequency, warning signs by descending score,
 * followed by a run summary. Floating-point values use {@link Locale#ROOT} so the
 * output is identical regardless of the system locale.
 */
public final class ResultFormatter {

    private static final String RULE = "=================================================";

    private final PrintStream out;

    public ResultFormatter() {
        this(System.out);
    }

    public ResultFormatter(PrintStream out) {
        this.out = out;
    }

    /**
     * Prints sequences, warning signs and the performance summary.
     *
     * @param sequences       sequences sorted by frequency descending
     * @param warningSigns    warning signs sorted by score descending
     * @param executionTimeMs wall-clock time from load to result, in ms
     * @param memoryUsedMB    heap in use at result time, in megabytes
     */
    public void printResults(List<FailureSequence> sequences,
                             List<WarningSign> warningSigns,
                             long executionTimeMs,
                             double memoryUsedMB) {
        out.println(RULE);
        out.printf("FAILURE SEQUENCES (%d)%n", sequences.size());
        out.println(RULE);

        if (sequences.isEmpty()) {
            out.println("No sequences found.");
        } else {
            out.printf("%-6s %-10s %-12s %s%n", "Rank", "Frequency", "Machines", "Sequence");
            out.println("-------------------------------------------------");
            int rank = 1;
            for (FailureSequence sequence : sequences) {
                out.printf(Locale.ROOT, "%-6d %-10d %-12d %s%n",
                    rank++,
                    sequence.getFrequency(),
                    sequence.getMachines().size(),
                    String.join(" -> ", sequence.describeStates()));
            }
        }

        out.println(RULE);
        out.printf("WARNING SIGNS (%d)%n", warningSigns.size());
        out.println(RULE);

        if (warningSigns.isEmpty()) {
            out.println("No warning signs found.");
        } else {
            out.printf("%-6s %-8s %-10s %s%n", "Rank", "Score", "Frequency", "Pattern");
            out.println("-------------------------------------------------");
            int rank = 1;
            for (WarningSign sign : warningSigns) {
                out.printf(Locale.ROOT, "%-6d %-8.3f %-10d %s%n",
                    rank++,
                    sign.getPredictiveScore(),
                    sign.getFrequency(),
                    sign.getPattern());
            }
        }

        out.println(RULE);
        out.printf(Locale.ROOT, "Execution time: %.3f seconds%n", executionTimeMs / 1000.0);
        out.printf("Sequences found: %d%n", sequences.size());
        out.printf(Locale.ROOT, "Memory used: %.2f MB%n", memoryUsedMB);
        out.println(RULE);
    }
}
