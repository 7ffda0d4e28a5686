package application;

import domain.model.BinningScheme;
import infrastructure.util.ValidationUtils;

import java.util.*;

/**
 * Immutable value object describing how sensor readings become graph states.
 *
 * <p>Constructed exclusively via the nested {@link Builder}, which validates the whole
 * configuration in {@link Builder#build()} so that malformed setups fail before any
 * graph construction starts.
 *
 * <h3>Key parameters</h3>
 * <ul>
 *   <li><b>discretization</b>: sensor name → {@link BinningScheme}.</li>
 *   <li><b>stateComponents</b>: ordered sensor names forming a state's label tuple,
 *       e.g. {@code [Temperature, Vibration_Level, Pressure]}.</li>
 *   <li><b>similarityNeighborCap</b>: maximum similarity-mode edges per source state.</li>
 * </ul>
 */
public final class GraphConfiguration {

    private final Map<String, BinningScheme> discretization;
    private final List<String> stateComponents;
    private final int similarityNeighborCap;

    private GraphConfiguration(Builder builder) {
        this.discretization = Collections.unmodifiableMap(new LinkedHashMap<>(builder.discretization));
        this.stateComponents = Collections.unmodifiableList(new ArrayList<>(builder.stateComponents));
        this.similarityNeighborCap = builder.similarityNeighborCap;
    }

    public Map<String, BinningScheme> getDiscretization() { return discretization; }
    public List<String> getStateComponents() { return stateComponents; }
    public int getSimilarityNeighborCap() { return similarityNeighborCap; }

    /**
     * Fluent builder for {@link GraphConfiguration}.
     *
     * <p>Defaults: {@code similarityNeighborCap}:
     * {@link OrchestratorConfiguration#DEFAULT_SIMILARITY_NEIGHBOR_CAP}.
     */
    public static class Builder {
        private final Map<String, BinningScheme> discretization = new LinkedHashMap<>();
        private final List<String> stateComponents = new ArrayList<>();
        private int similarityNeighborCap = OrchestratorConfiguration.DEFAULT_SIMILARITY_NEIGHBOR_CAP;

        public Builder addScheme(String sensor, BinningScheme scheme) {
            if (sensor == null || sensor.isEmpty()) {
                throw new IllegalArgumentException("sensor name cannot be null or empty");
            }
            if (scheme == null) throw new IllegalArgumentException("scheme for " + sensor + " cannot be null");
            discretization.put(sensor, scheme);
            return this;
        }

        public Builder addScheme(String sensor, List<Double> bins, List<String> labels) {
            try {
                return addScheme(sensor, new BinningScheme(bins, labels));
            } catch (IllegalArgumentException e) {
                throw new IllegalArgumentException("Invalid binning for sensor " + sensor + ": " + e.getMessage(), e);
            }
        }

        public Builder setStateComponents(List<String> components) {
            if (components == null) throw new IllegalArgumentException("stateComponents cannot be null");
            stateComponents.clear();
            stateComponents.addAll(components);
            return this;
        }

        public Builder setSimilarityNeighborCap(int cap) {
            ValidationUtils.validatePositive(cap, "similarityNeighborCap");
            this.similarityNeighborCap = cap;
            return this;
        }

        /**
         * @throws IllegalArgumentException if no state component is configured, a
         *         component is duplicated, or a component has no binning scheme
         */
        public GraphConfiguration build() {
            ValidationUtils.validateNotEmpty(stateComponents, "stateComponents");
            Set<String> seen = new HashSet<>();
            for (String component : stateComponents) {
                if (!seen.add(component)) {
                    throw new IllegalArgumentException("Duplicate state component: " + component);
                }
                if (!discretization.containsKey(component)) {
                    throw new IllegalArgumentException(
                        "Unknown sensor in state components: " + component
                            + ". Configured sensors: " + discretization.keySet());
                }
            }
            return new GraphConfiguration(this);
        }
    }
}
