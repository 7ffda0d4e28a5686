package domain.pattern;

import domain.model.FailureSequence;
import domain.model.State;
import domain.model.WarningSign;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class WarningSignRankerTest {

    private static FailureSequence sequence(int frequency, String... labels) {
        List<State> states = new java.util.ArrayList<>();
        for (String label : labels) {
            states.add(new State("M-001", Arrays.asList(label, "low")));
        }
        return new FailureSequence(states, frequency, Collections.singleton("M-001"), 0.0);
    }

    private final WarningSignRanker ranker = new WarningSignRanker();

    @Test
    void scoreSaturatesAtOne() {
        List<WarningSign> signs = ranker.rank(Arrays.asList(sequence(5, "a"), sequence(15, "b")));

        assertThat(signs).extracting(WarningSign::getFrequency).containsExactly(15, 5);
        assertThat(signs.get(0).getPredictiveScore()).isEqualTo(1.0);
        assertThat(signs.get(1).getPredictiveScore()).isCloseTo(0.5, within(1e-12));
        assertThat(signs).allSatisfy(sign -> assertThat(sign.getFalsePositiveRate()).isZero());
    }

    @Test
    void equalScoresKeepInputOrder() {
        List<WarningSign> signs = ranker.rank(Arrays.asList(
            sequence(12, "a"), sequence(3, "b"), sequence(10, "c")));

        assertThat(signs).extracting(WarningSign::getFrequency).containsExactly(12, 10, 3);
    }

    @Test
    void describesFirstAndLastStateWithLength() {
        WarningSign sign = ranker.rank(Collections.singletonList(sequence(1, "a", "b", "c"))).get(0);

        assertThat(sign.getPattern()).isEqualTo("State transition: [a, low] -> [c, low] (3 steps)");
    }
}
