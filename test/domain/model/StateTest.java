package domain.model;

import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.Collections;

import static org.assertj.core.api.Assertions.assertThat;

class StateTest {

    @Test
    void equalMachineAndLabelsAreEqual() {
        State a = new State("M-001", Arrays.asList("low", "high"));
        State b = new State("M-001", Arrays.asList("low", "high"));

        assertThat(a).isEqualTo(b);
        assertThat(a.hashCode()).isEqualTo(b.hashCode());
    }

    @Test
    void machineIdIsPartOfIdentity() {
        State a = new State("M-001", Arrays.asList("low", "high"));
        State b = new State("M-002", Arrays.asList("low", "high"));

        assertThat(a).isNotEqualTo(b);
        assertThat(a.labelDistance(b)).isZero();
    }

    @Test
    void labelDistanceCountsDifferingPositions() {
        State a = new State("M-001", Arrays.asList("low", "high", "low"));
        State b = new State("M-001", Arrays.asList("low", "low", "high"));

        assertThat(a.labelDistance(b)).isEqualTo(2);
        assertThat(a.labelDistance(new State("M-001", Collections.singletonList("low")))).isEqualTo(-1);
    }

    @Test
    void labelsAreDefensivelyCopied() {
        java.util.List<String> labels = new java.util.ArrayList<>(Arrays.asList("low"));
        State state = new State("M-001", labels);
        labels.set(0, "high");

        assertThat(state.getLabels()).containsExactly("low");
        assertThat(state.describe()).isEqualTo("M-001[low]");
    }
}
