package domain.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Immutable mapping from a continuous sensor value to a categorical bin label.
 *
 * <p>A scheme with boundaries {@code bins[0..n]} carries exactly {@code n} labels, one per
 * half-open interval {@code [bins[i], bins[i+1])}:
 * <pre>
 *   bins   = [0, 30, 50, 70, 100]
 *   labels = [low, medium, high, very_high]
 *
 *   bin(12.0)  = low
 *   bin(50.0)  = high
 *   bin(140.0) = very_high   (top interval is open-ended upward)
 *   bin(-1.0)  → BinningRangeException
 * </pre>
 *
 * <p><b>Invariants</b> (checked at construction, a violation is a configuration error):
 * <ul>
 *   <li>{@code labels.size() == bins.size() - 1}</li>
 *   <li>{@code bins} strictly increasing</li>
 * </ul>
 *
 * @see infrastructure.computation.SensorDiscretizer
 */
public final class BinningScheme {

    private final double[] bins;
    private final List<String> labels;

    /**
     * Constructs a scheme from boundary values and labels.
     *
     * @param bins   strictly increasing boundaries, at least two
     * @param labels one label per interval
     * @throws IllegalArgumentException if the lengths mismatch or boundaries are not increasing
     */
    public BinningScheme(List<Double> bins, List<String> labels) {
        if (bins == null || labels == null) {
            throw new IllegalArgumentException("bins and labels cannot be null");
        }
        if (bins.size() < 2) {
            throw new IllegalArgumentException("bins must contain at least two boundaries, got: " + bins.size());
        }
        if (labels.size() != bins.size() - 1) {
            throw new IllegalArgumentException(
                "labels must have exactly one entry per interval: expected " + (bins.size() - 1)
                    + ", got " + labels.size());
        }

        this.bins = new double[bins.size()];
        for (int i = 0; i < bins.size(); i++) {
            Double boundary = bins.get(i);
            if (boundary == null || boundary.isNaN()) {
                throw new IllegalArgumentException("bin boundary " + i + " is not a number");
            }
            if (i > 0 && boundary <= this.bins[i - 1]) {
                throw new IllegalArgumentException(
                    "bins must be strictly increasing, got " + this.bins[i - 1] + " then " + boundary);
            }
            this.bins[i] = boundary;
        }
        for (String label : labels) {
            if (label == null || label.isEmpty()) {
                throw new IllegalArgumentException("bin labels cannot be null or empty");
            }
        }
        this.labels = Collections.unmodifiableList(new ArrayList<>(labels));
    }

    /**
     * Returns the label of the interval containing {@code value}.
     *
     * @param value raw sensor reading
     * @return bin label
     * @throws BinningRangeException if {@code value < bins[0]} (or is NaN)
     */
    public String bin(double value) {
        for (int i = 0; i < bins.length - 1; i++) {
            if (bins[i] <= value && value < bins[i + 1]) {
                return labels.get(i);
            }
        }
        if (value >= bins[bins.length - 1]) {
            return labels.get(labels.size() - 1);
        }
        throw new BinningRangeException(value, bins[0]);
    }

    public List<Double> getBins() {
        List<Double> copy = new ArrayList<>(bins.length);
        for (double b : bins) copy.add(b);
        return copy;
    }

    public List<String> getLabels() { return labels; }

    @Override
    public String toString() {
        return "BinningScheme{bins=" + getBins() + ", labels=" + labels + "}";
    }
}
