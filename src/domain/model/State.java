package domain.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * A machine's discretized condition: one bin label per configured state component.
 *
 * <p>For state components {@code [Temperature, Vibration_Level]} a state might be
 * {@code (M-001, [medium, high])}, meaning medium temperature and high vibration on
 * machine {@code M-001}. A sensor that was missing or out of binning range is
 * represented by {@link #UNKNOWN_LABEL}.
 *
 * <h3>Equality</h3>
 * <p>Value semantics: two states with the same machine id and the same label sequence
 * are the same logical graph node regardless of how they were constructed.
 * {@code equals} and {@code hashCode} are consistent and use both fields.
 *
 * <p>Immutable; the label list is defensively copied.
 */
public final class State {

    /** Placeholder label for a component that could not be discretized. */
    public static final String UNKNOWN_LABEL = "unknown";

    private final String machineId;
    private final List<String> labels;
    private final int hash;

    /**
     * Constructs a state.
     *
     * @param machineId non-null machine identifier
     * @param labels    bin labels in state-component order
     */
    public State(String machineId, List<String> labels) {
        if (machineId == null) {
            throw new IllegalArgumentException("machineId cannot be null");
        }
        if (labels == null) {
            throw new IllegalArgumentException("labels cannot be null");
        }
        this.machineId = machineId;
        this.labels = Collections.unmodifiableList(new ArrayList<>(labels));
        this.hash = 31 * machineId.hashCode() + this.labels.hashCode();
    }

    public String getMachineId() { return machineId; }

    public List<String> getLabels() { return labels; }

    public int size() { return labels.size(); }

    /**
     * Number of label positions in which this state differs from {@code other},
     * ignoring machine ids.
     *
     * @param other state to compare against
     * @return Hamming distance, or {@code -1} if the label tuples have different lengths
     */
    public int labelDistance(State other) {
        if (other.labels.size() != labels.size()) return -1;
        int distance = 0;
        for (int i = 0; i < labels.size(); i++) {
            if (!labels.get(i).equals(other.labels.get(i))) distance++;
        }
        return distance;
    }

    /**
     * Human-readable form used in result files, e.g. {@code M-001[medium, high]}.
     */
    public String describe() {
        return machineId + labels;
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof State)) return false;
        State other = (State) obj;
        return hash == other.hash
            && machineId.equals(other.machineId)
            && labels.equals(other.labels);
    }

    @Override
    public int hashCode() {
        return hash;
    }

    @Override
    public String toString() {
        return "State{machine=" + machineId + ", labels=" + labels + "}";
    }
}
