package infrastructure.computation;

import application.GraphConfiguration;
import domain.model.SensorRecord;
import domain.model.State;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.HashMap;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class SensorDiscretizerTest {

    private final SensorDiscretizer discretizer = new SensorDiscretizer(new GraphConfiguration.Builder()
        .addScheme("Temperature", Arrays.asList(0.0, 60.0, 80.0, 200.0), Arrays.asList("low", "medium", "high"))
        .addScheme("Pressure", Arrays.asList(0.0, 5.0, 50.0), Arrays.asList("low", "high"))
        .setStateComponents(Arrays.asList("Temperature", "Pressure"))
        .build());

    @Test
    void dropsOutOfRangeAndUnconfiguredSensors() {
        Map<String, Double> sensors = new HashMap<>();
        sensors.put("Temperature", 70.0);
        sensors.put("Pressure", -3.0);
        sensors.put("Humidity", 40.0);

        assertThat(discretizer.discretize(sensors)).containsExactly(Map.entry("Temperature", "medium"));
    }

    @Test
    void missingComponentsBecomeUnknown() {
        Map<String, Double> sensors = new HashMap<>();
        sensors.put("Pressure", 10.0);

        State state = discretizer.toState(new SensorRecord("M-001", 0.0, sensors, false));

        assertThat(state.getMachineId()).isEqualTo("M-001");
        assertThat(state.getLabels()).containsExactly(State.UNKNOWN_LABEL, "high");
    }

    @Test
    void labelsFollowComponentOrder() {
        Map<String, Double> sensors = new HashMap<>();
        sensors.put("Pressure", 1.0);
        sensors.put("Temperature", 95.0);

        State state = discretizer.toState(new SensorRecord("M-002", 0.0, sensors, true));

        assertThat(state.getLabels()).containsExactly("high", "low");
    }
}
