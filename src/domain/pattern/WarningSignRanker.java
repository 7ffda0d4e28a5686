package domain.pattern;

import domain.model.FailureSequence;
import domain.model.State;
import domain.model.WarningSign;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Converts failure sequences into scored, human-readable {@link WarningSign}s.
 *
 * <p>The predictive score is frequency-based: {@code min(frequency / 10, 1.0)}, so a
 * sequence seen ten or more times saturates at {@code 1.0}. The false-positive rate is
 * not derived from data (always {@code 0.0}).
 *
 * <p>Output is stable-sorted by descending score; ties keep input order.
 */
public final class WarningSignRanker {

    /** Frequency at which the predictive score saturates. */
    public static final double SCORE_SATURATION_FREQUENCY = 10.0;

    /**
     * Ranks sequences into warning signs.
     *
     * @param sequences aggregated failure sequences
     * @return warning signs by descending predictive score
     */
    public List<WarningSign> rank(List<FailureSequence> sequences) {
        List<WarningSign> warnings = new ArrayList<>(sequences.size());
        for (FailureSequence seq : sequences) {
            double score = Math.min(seq.getFrequency() / SCORE_SATURATION_FREQUENCY, 1.0);
            warnings.add(new WarningSign(describe(seq), score, seq.getFrequency(), 0.0));
        }
        warnings.sort(Comparator.comparingDouble(WarningSign::getPredictiveScore).reversed());
        return warnings;
    }

    /**
     * Pattern text from the first and last state plus the sequence length, e.g.
     * {@code State transition: [low, low] -> [medium, high] (2 steps)}.
     */
    static String describe(FailureSequence seq) {
        List<State> states = seq.getStates();
        if (states.isEmpty()) {
            return "Empty sequence";
        }
        State first = states.get(0);
        State last = states.get(states.size() - 1);
        return "State transition: " + first.getLabels() + " -> " + last.getLabels()
            + " (" + states.size() + " steps)";
    }
}
