package domain.pattern;

import domain.model.FailureSequence;
import domain.model.State;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class PatternExtractorTest {

    private static final State A = new State("M-001", Collections.singletonList("a"));
    private static final State B = new State("M-001", Collections.singletonList("b"));
    private static final State C = new State("M-001", Collections.singletonList("c"));
    private static final State X = new State("M-002", Collections.singletonList("x"));

    private final PatternExtractor extractor = new PatternExtractor();

    @Test
    void groupsEqualSequencesAndExcludesTerminalState() {
        List<List<State>> paths = Arrays.asList(
            Arrays.asList(A, B, C),
            Arrays.asList(A, B, C),
            Arrays.asList(A, B, C),
            Arrays.asList(A, C));

        List<FailureSequence> sequences = extractor.extract(paths, 2);

        assertThat(sequences).hasSize(2);
        assertThat(sequences.get(0).getStates()).containsExactly(A, B);
        assertThat(sequences.get(0).getFrequency()).isEqualTo(3);
        assertThat(sequences.get(1).getStates()).containsExactly(A);
        assertThat(sequences.get(1).getFrequency()).isEqualTo(1);
        assertThat(sequences).allSatisfy(seq -> assertThat(seq.getStates()).doesNotContain(C));
    }

    @Test
    void dropsPathsShorterThanMinLength() {
        List<List<State>> paths = Arrays.asList(
            Arrays.asList(A, C),
            Arrays.asList(A, B, C));

        List<FailureSequence> sequences = extractor.extract(paths, 3);

        assertThat(sequences).singleElement()
            .satisfies(seq -> assertThat(seq.getStates()).containsExactly(A, B));
    }

    @Test
    void collectsOriginMachinesAndKeepsFirstSeenOrderOnTies() {
        List<List<State>> paths = Arrays.asList(
            Arrays.asList(X, C),
            Arrays.asList(A, C),
            Arrays.asList(X, C));

        List<FailureSequence> sequences = extractor.extract(paths, 2);

        assertThat(sequences.get(0).getStates()).containsExactly(X);
        assertThat(sequences.get(0).getMachines()).containsExactly("M-002");
        assertThat(sequences.get(1).getMachines()).containsExactly("M-001");
        assertThat(sequences).allSatisfy(seq -> assertThat(seq.getAvgTimeToFailure()).isZero());
    }

    @Test
    void emptyInputYieldsNoSequences() {
        assertThat(extractor.extract(Collections.emptyList(), 2)).isEmpty();
    }
}
