package domain.pattern;

import domain.model.FailureSequence;
import domain.model.State;
import infrastructure.util.ValidationUtils;

import java.util.*;

/**
 * Aggregates goal-terminated search paths into frequency-ranked {@link FailureSequence}s.
 *
 * <h3>Algorithm</h3>
 * <ol>
 *   <li>Drop every path with fewer than {@code minLength} states.</li>
 *   <li>Strip the terminal (failure) state to obtain the preceding sequence.</li>
 *   <li>Group state-wise equal sequences in first-seen order, counting occurrences and
 *       collecting the machine id of each path's first state.</li>
 *   <li>Stable sort by descending count, so ties keep first-seen order.</li>
 * </ol>
 *
 * <h3>Example</h3>
 * <pre>
 *   paths = [[A,B,C], [A,B,C], [A,B,C], [A,C]],  minLength = 2
 *   → [A,B] ×3,  [A] ×1
 * </pre>
 *
 * <p>Stateless and thread-safe.
 */
public final class PatternExtractor {

    /**
     * Extracts aggregated failure sequences.
     *
     * @param paths     paths whose last state is a failure state
     * @param minLength minimum path length (in states, terminal state included)
     * @return sequences sorted by descending frequency
     */
    public List<FailureSequence> extract(List<List<State>> paths, int minLength) {
        ValidationUtils.validateNonNegative(minLength, "minLength");

        Map<List<State>, Integer> counts = new LinkedHashMap<>();
        Map<List<State>, Set<String>> machines = new HashMap<>();

        for (List<State> path : paths) {
            if (path.isEmpty() || path.size() < minLength) continue;

            List<State> sequence = Collections.unmodifiableList(
                new ArrayList<>(path.subList(0, path.size() - 1)));
            counts.merge(sequence, 1, Integer::sum);
            machines.computeIfAbsent(sequence, k -> new LinkedHashSet<>())
                .add(path.get(0).getMachineId());
        }

        List<FailureSequence> sequences = new ArrayList<>(counts.size());
        for (Map.Entry<List<State>, Integer> e : counts.entrySet()) {
            sequences.add(new FailureSequence(e.getKey(), e.getValue(), machines.get(e.getKey()), 0.0));
        }

        // List.sort is stable: equal frequencies keep first-seen order
        sequences.sort(Comparator.comparingInt(FailureSequence::getFrequency).reversed());
        return sequences;
    }
}
