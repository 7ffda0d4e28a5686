package domain.model;

import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class BinningSchemeTest {

    private final BinningScheme temperature = new BinningScheme(
        Arrays.asList(0.0, 60.0, 80.0, 200.0),
        Arrays.asList("low", "medium", "high"));

    @Test
    void binsValueIntoHalfOpenInterval() {
        assertThat(temperature.bin(0.0)).isEqualTo("low");
        assertThat(temperature.bin(59.9)).isEqualTo("low");
        assertThat(temperature.bin(60.0)).isEqualTo("medium");
        assertThat(temperature.bin(79.99)).isEqualTo("medium");
        assertThat(temperature.bin(80.0)).isEqualTo("high");
    }

    @Test
    void valuesAtOrAboveLastBoundaryGetLastLabel() {
        assertThat(temperature.bin(200.0)).isEqualTo("high");
        assertThat(temperature.bin(1_000_000.0)).isEqualTo("high");
    }

    @Test
    void labelIndexNeverDecreasesAsValueRises() {
        List<String> labels = Arrays.asList("low", "medium", "high");
        int previous = -1;
        for (double v = 0.0; v <= 250.0; v += 0.25) {
            int index = labels.indexOf(temperature.bin(v));
            assertThat(index).as("label index at %s", v).isGreaterThanOrEqualTo(previous);
            previous = index;
        }
        assertThat(previous).isEqualTo(labels.size() - 1);
    }

    @Test
    void valueBelowFirstBoundaryIsRangeError() {
        assertThatThrownBy(() -> temperature.bin(-0.5))
            .isInstanceOf(BinningRangeException.class)
            .satisfies(e -> {
                BinningRangeException range = (BinningRangeException) e;
                assertThat(range.getValue()).isEqualTo(-0.5);
                assertThat(range.getLowerBound()).isEqualTo(0.0);
            });
    }

    @Test
    void nanIsRangeError() {
        assertThatThrownBy(() -> temperature.bin(Double.NaN))
            .isInstanceOf(BinningRangeException.class);
    }

    @Test
    void rejectsLabelCountMismatch() {
        assertThatThrownBy(() -> new BinningScheme(Arrays.asList(0.0, 1.0, 2.0), Arrays.asList("a")))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("one entry per interval");
    }

    @Test
    void rejectsNonIncreasingBoundaries() {
        assertThatThrownBy(() -> new BinningScheme(Arrays.asList(0.0, 5.0, 5.0), Arrays.asList("a", "b")))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("strictly increasing");
    }

    @Test
    void rejectsSingleBoundary() {
        assertThatThrownBy(() -> new BinningScheme(Arrays.asList(0.0), Arrays.asList()))
            .isInstanceOf(IllegalArgumentException.class);
    }
}
