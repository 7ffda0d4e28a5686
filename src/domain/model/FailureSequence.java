package domain.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * A state sequence observed to precede a failure state, with occurrence statistics.
 *
 * <p>The terminal failure state is <em>not</em> part of {@link #getStates()}.
 * {@code avgTimeToFailure} is reserved for a time-based statistic and is always
 * {@code 0.0} in the current aggregation.
 *
 * @see domain.pattern.PatternExtractor
 */
public final class FailureSequence {

    private final List<State> states;
    private final int frequency;
    private final Set<String> machines;
    private final double avgTimeToFailure;

    public FailureSequence(List<State> states, int frequency, Set<String> machines, double avgTimeToFailure) {
        if (states == null) {
            throw new IllegalArgumentException("states cannot be null");
        }
        if (frequency <= 0) {
            throw new IllegalArgumentException("frequency must be positive, got: " + frequency);
        }
        this.states = Collections.unmodifiableList(new ArrayList<>(states));
        this.frequency = frequency;
        this.machines = Collections.unmodifiableSet(
            machines == null ? new LinkedHashSet<>() : new LinkedHashSet<>(machines));
        this.avgTimeToFailure = avgTimeToFailure;
    }

    public List<State> getStates() { return states; }
    public int getFrequency() { return frequency; }
    public Set<String> getMachines() { return machines; }
    public double getAvgTimeToFailure() { return avgTimeToFailure; }

    /**
     * Returns each state's {@link State#describe()} form, in order.
     */
    public List<String> describeStates() {
        List<String> out = new ArrayList<>(states.size());
        for (State s : states) out.add(s.describe());
        return out;
    }

    @Override
    public String toString() {
        return "FailureSequence{length=" + states.size() + ", frequency=" + frequency
            + ", machines=" + machines + "}";
    }
}
