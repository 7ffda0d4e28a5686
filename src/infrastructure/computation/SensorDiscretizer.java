package infrastructure.computation;

import application.GraphConfiguration;
import domain.model.BinningRangeException;
import domain.model.BinningScheme;
import domain.model.SensorRecord;
import domain.model.State;

import java.util.*;

/**
 * Maps raw sensor readings to bin labels and assembles {@link State}s.
 *
 * <h3>Range policy</h3>
 * <p>A value below its scheme's lowest boundary raises {@link BinningRangeException}
 * inside {@link BinningScheme#bin(double)}. This class is the only place that catches
 * it: the sensor is simply left out of the label map, and {@link #toState} renders its
 * position as {@link State#UNKNOWN_LABEL}.
 *
 * <p>Immutable and thread-safe.
 */
public final class SensorDiscretizer {

    private final Map<String, BinningScheme> schemes;
    private final List<String> stateComponents;

    public SensorDiscretizer(GraphConfiguration config) {
        this.schemes = config.getDiscretization();
        this.stateComponents = config.getStateComponents();
    }

    /**
     * Bins a single value.
     *
     * @throws BinningRangeException if the value is below the scheme's range
     */
    public static String bin(double value, BinningScheme scheme) {
        return scheme.bin(value);
    }

    /**
     * Discretizes every sensor that has a scheme, is present in {@code sensors} and is
     * in range. Iterates in scheme order.
     *
     * @param sensors sensor name → raw value
     * @return sensor name → bin label for the discretizable sensors only
     */
    public Map<String, String> discretize(Map<String, Double> sensors) {
        Map<String, String> labels = new LinkedHashMap<>();
        for (Map.Entry<String, BinningScheme> e : schemes.entrySet()) {
            Double value = sensors.get(e.getKey());
            if (value == null) continue;
            try {
                labels.put(e.getKey(), e.getValue().bin(value));
            } catch (BinningRangeException outOfRange) {
                // Out-of-range sensors are dropped; the state shows them as unknown
                continue;
            }
        }
        return labels;
    }

    /**
     * Builds the state of one record in state-component order.
     */
    public State toState(SensorRecord record) {
        Map<String, String> discretized = discretize(record.getSensors());
        List<String> labels = new ArrayList<>(stateComponents.size());
        for (String component : stateComponents) {
            labels.add(discretized.getOrDefault(component, State.UNKNOWN_LABEL));
        }
        return new State(record.getMachineId(), labels);
    }
}
