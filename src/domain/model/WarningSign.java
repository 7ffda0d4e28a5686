package domain.model;

import java.util.Locale;

/**
 * A ranked, human-readable warning sign derived from a {@link FailureSequence}.
 *
 * <p>{@code predictiveScore} is a heuristic severity in {@code [0, 1]}, not a calibrated
 * probability. {@code falsePositiveRate} is a known gap: it is never computed from data
 * and is always {@code 0.0}.
 *
 * @see domain.pattern.WarningSignRanker
 */
public final class WarningSign {

    private final String pattern;
    private final double predictiveScore;
    private final int frequency;
    private final double falsePositiveRate;

    public WarningSign(String pattern, double predictiveScore, int frequency, double falsePositiveRate) {
        if (pattern == null) {
            throw new IllegalArgumentException("pattern cannot be null");
        }
        if (predictiveScore < 0.0 || predictiveScore > 1.0) {
            throw new IllegalArgumentException("predictiveScore must be in [0, 1], got: " + predictiveScore);
        }
        this.pattern = pattern;
        this.predictiveScore = predictiveScore;
        this.frequency = frequency;
        this.falsePositiveRate = falsePositiveRate;
    }

    public String getPattern() { return pattern; }
    public double getPredictiveScore() { return predictiveScore; }
    public int getFrequency() { return frequency; }
    public double getFalsePositiveRate() { return falsePositiveRate; }

    @Override
    public String toString() {
        return String.format(Locale.ROOT, "WarningSign{pattern=%s, score=%.2f, frequency=%d}",
            pattern, predictiveScore, frequency);
    }
}
