package infrastructure.builder;

import application.GraphConfiguration;
import domain.graph.StateGraph;
import domain.model.SensorRecord;
import domain.model.State;
import infrastructure.computation.SensorDiscretizer;

import java.util.*;

/**
 * Builds a sealed {@link StateGraph} from a batch of canonical sensor records.
 *
 * <h3>Two-step algorithm</h3>
 * <ol>
 *   <li><b>Node registration</b>: group records by machine (first-seen order), sort each
 *       group by time key, discretize every record to a {@link State}, resolve it to the
 *       canonical node, attach the record and mark failure states.</li>
 *   <li><b>Edge construction</b>: one strategy for the whole batch:
 *     <ul>
 *       <li><b>Temporal</b> (some machine has more than one record): an edge between
 *           every pair of chronologically consecutive states of a machine, self-loops
 *           included.</li>
 *       <li><b>Similarity</b> (every machine has exactly one record): an edge from each
 *           state to the states whose labels differ in exactly one position, machine id
 *           ignored, at most {@code similarityNeighborCap} per source.</li>
 *     </ul>
 *   </li>
 * </ol>
 *
 * <p>The similarity cap is applied while scanning candidates in node insertion order,
 * so the accepted neighbors depend on record order, not on any notion of nearness.
 *
 * @see GraphConfiguration
 */
public final class StateGraphBuilder {

    /**
     * Edge-construction strategy chosen once per batch.
     */
    public enum EdgeMode {
        TEMPORAL,
        SIMILARITY
    }

    private final GraphConfiguration config;
    private final SensorDiscretizer discretizer;

    public StateGraphBuilder(GraphConfiguration config) {
        this.config = config;
        this.discretizer = new SensorDiscretizer(config);
    }

    /**
     * Builds and seals the graph.
     *
     * @param records canonical records in any order
     * @return sealed state graph
     */
    public StateGraph build(List<SensorRecord> records) {
        Map<String, List<SensorRecord>> byMachine = groupByMachine(records);
        StateGraph graph = new StateGraph();

        // Step 1: node registration, keeping each machine's chronological state sequence
        Map<String, List<State>> sequences = new LinkedHashMap<>();
        for (Map.Entry<String, List<SensorRecord>> e : byMachine.entrySet()) {
            List<State> sequence = new ArrayList<>(e.getValue().size());
            for (SensorRecord record : e.getValue()) {
                State state = graph.addNode(discretizer.toState(record));
                graph.attachRecord(state, record);
                if (record.isFailure()) {
                    graph.markFailureState(state);
                }
                sequence.add(state);
            }
            sequences.put(e.getKey(), sequence);
        }

        // Step 2: edges
        if (selectMode(byMachine) == EdgeMode.TEMPORAL) {
            addTemporalEdges(graph, sequences);
        } else {
            addSimilarityEdges(graph, config.getSimilarityNeighborCap());
        }

        graph.seal();
        return graph;
    }

    /**
     * Temporal mode as soon as any machine contributes more than one record.
     */
    public static EdgeMode selectMode(Map<String, List<SensorRecord>> byMachine) {
        for (List<SensorRecord> group : byMachine.values()) {
            if (group.size() > 1) return EdgeMode.TEMPORAL;
        }
        return EdgeMode.SIMILARITY;
    }

    /**
     * Groups records by machine id in first-seen order, each group sorted by time key.
     * The sort is stable, so equal time keys keep input order.
     */
    static Map<String, List<SensorRecord>> groupByMachine(List<SensorRecord> records) {
        Map<String, List<SensorRecord>> byMachine = new LinkedHashMap<>();
        for (SensorRecord record : records) {
            byMachine.computeIfAbsent(record.getMachineId(), k -> new ArrayList<>()).add(record);
        }
        for (List<SensorRecord> group : byMachine.values()) {
            group.sort(Comparator.comparingDouble(SensorRecord::getTimeKey));
        }
        return byMachine;
    }

    private static void addTemporalEdges(StateGraph graph, Map<String, List<State>> sequences) {
        for (List<State> sequence : sequences.values()) {
            for (int i = 0; i + 1 < sequence.size(); i++) {
                graph.addEdge(sequence.get(i), sequence.get(i + 1));
            }
        }
    }

    private static void addSimilarityEdges(StateGraph graph, int neighborCap) {
        List<State> states = new ArrayList<>(graph.getNodes());
        for (State source : states) {
            int accepted = 0;
            for (State candidate : states) {
                if (accepted >= neighborCap) break;
                if (source.equals(candidate)) continue;
                if (source.labelDistance(candidate) == 1) {
                    graph.addEdge(source, candidate);
                    accepted++;
                }
            }
        }
    }
}
