package infrastructure.builder;

import application.GraphConfiguration;
import domain.graph.StateGraph;
import domain.model.SensorRecord;
import domain.model.State;
import org.junit.jupiter.api.Test;

import java.util.*;

import static org.assertj.core.api.Assertions.assertThat;

class StateGraphBuilderTest {

    private static GraphConfiguration.Builder config() {
        return new GraphConfiguration.Builder()
            .addScheme("Temperature", Arrays.asList(0.0, 60.0, 200.0), Arrays.asList("low", "high"))
            .addScheme("Vibration", Arrays.asList(0.0, 5.0, 100.0), Arrays.asList("low", "high"))
            .setStateComponents(Arrays.asList("Temperature", "Vibration"));
    }

    private static SensorRecord record(String machine, double time, double temperature, double vibration,
                                       boolean failure) {
        Map<String, Double> sensors = new LinkedHashMap<>();
        sensors.put("Temperature", temperature);
        sensors.put("Vibration", vibration);
        return new SensorRecord(machine, time, sensors, failure);
    }

    private static State state(String machine, String temperature, String vibration) {
        return new State(machine, Arrays.asList(temperature, vibration));
    }

    @Test
    void temporalModeLinksChronologicalNeighboursIncludingSelfLoops() {
        List<SensorRecord> records = Arrays.asList(
            record("M-1", 3.0, 90.0, 8.0, true),
            record("M-1", 1.0, 20.0, 1.0, false),
            record("M-1", 2.0, 25.0, 2.0, false));

        StateGraph graph = new StateGraphBuilder(config().build()).build(records);

        State normal = state("M-1", "low", "low");
        State failing = state("M-1", "high", "high");
        assertThat(graph.isSealed()).isTrue();
        assertThat(graph.nodeCount()).isEqualTo(2);
        assertThat(graph.hasEdge(normal, normal)).isTrue();
        assertThat(graph.hasEdge(normal, failing)).isTrue();
        assertThat(graph.edgeCount()).isEqualTo(2);
        assertThat(graph.getFailureStates()).containsExactly(failing);
        assertThat(graph.getRecords(normal)).hasSize(2);
    }

    @Test
    void similarityModeLinksStatesOneLabelApart() {
        List<SensorRecord> records = Arrays.asList(
            record("M-1", 0.0, 20.0, 1.0, false),
            record("M-2", 0.0, 20.0, 9.0, false),
            record("M-3", 0.0, 90.0, 9.0, true));

        StateGraph graph = new StateGraphBuilder(config().build()).build(records);

        State a = state("M-1", "low", "low");
        State b = state("M-2", "low", "high");
        State c = state("M-3", "high", "high");
        assertThat(graph.edgeCount()).isEqualTo(4);
        assertThat(graph.getNeighbors(a)).containsExactly(b);
        assertThat(graph.getNeighbors(b)).containsExactly(a, c);
        assertThat(graph.getNeighbors(c)).containsExactly(b);
        assertThat(graph.hasEdge(a, c)).isFalse();
    }

    @Test
    void similarityCapKeepsFirstCandidatesInInsertionOrder() {
        List<SensorRecord> records = Arrays.asList(
            record("M-1", 0.0, 20.0, 1.0, false),
            record("M-2", 0.0, 20.0, 9.0, false),
            record("M-3", 0.0, 90.0, 9.0, true));

        StateGraph graph = new StateGraphBuilder(config().setSimilarityNeighborCap(1).build()).build(records);

        assertThat(graph.getNeighbors(state("M-2", "low", "high"))).containsExactly(state("M-1", "low", "low"));
        assertThat(graph.edgeCount()).isEqualTo(3);
    }

    @Test
    void modeIsTemporalAsSoonAsOneMachineRepeats() {
        Map<String, List<SensorRecord>> byMachine = StateGraphBuilder.groupByMachine(Arrays.asList(
            record("M-1", 0.0, 20.0, 1.0, false),
            record("M-2", 0.0, 20.0, 1.0, false),
            record("M-2", 1.0, 20.0, 1.0, false)));

        assertThat(StateGraphBuilder.selectMode(byMachine)).isEqualTo(StateGraphBuilder.EdgeMode.TEMPORAL);
        assertThat(byMachine).containsOnlyKeys("M-1", "M-2");
    }

    @Test
    void emptyBatchGivesEmptySealedGraph() {
        StateGraph graph = new StateGraphBuilder(config().build()).build(Collections.emptyList());

        assertThat(graph.nodeCount()).isZero();
        assertThat(graph.isSealed()).isTrue();
    }
}
