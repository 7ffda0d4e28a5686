package domain.graph;

import domain.model.SensorRecord;
import domain.model.State;

import java.util.*;

/**
 * Directed graph of equipment states and the transitions observed or inferred between them.
 *
 * <h3>Structure</h3>
 * <ul>
 *   <li><b>Nodes</b>: unique {@link State}s in insertion order. The node registry is a
 *       direct key → node map, so {@link #addNode(State)} resolves an equal state to the
 *       already-registered instance in O(1).</li>
 *   <li><b>Adjacency</b>: node → ordered successor list; duplicate edges are suppressed,
 *       self-loops are allowed.</li>
 *   <li><b>Failure states</b>: nodes at least one contributing record of which carried
 *       the failure flag.</li>
 *   <li><b>Records</b>: node → canonical records that discretized to it.</li>
 * </ul>
 *
 * <p>{@link #addEdge} and {@link #markFailureState} register missing endpoints, so every
 * node referenced by an edge or failure mark is always in the node set.
 *
 * <h3>Lifecycle</h3>
 * <p>Built once by {@link infrastructure.builder.StateGraphBuilder}, then {@link #seal() sealed}.
 * A sealed graph rejects mutation and may be read concurrently by independent searches.
 */
public final class StateGraph {

    private final Map<State, State> nodes = new LinkedHashMap<>();
    private final Map<State, List<State>> successors = new HashMap<>();
    private final Map<State, Set<State>> successorSets = new HashMap<>();
    private final Set<State> failureStates = new LinkedHashSet<>();
    private final Map<State, List<SensorRecord>> records = new HashMap<>();
    private int edgeCount;
    private volatile boolean sealed;

    /**
     * Registers a state, or returns the already-registered equal instance.
     *
     * @param state state to register
     * @return the canonical node instance for {@code state}
     */
    public State addNode(State state) {
        checkMutable();
        State existing = nodes.get(state);
        if (existing != null) return existing;

        nodes.put(state, state);
        successors.put(state, new ArrayList<>());
        successorSets.put(state, new HashSet<>());
        records.put(state, new ArrayList<>());
        return state;
    }

    /**
     * Adds a directed edge, registering either endpoint if needed.
     *
     * @return {@code true} if the edge is new
     */
    public boolean addEdge(State from, State to) {
        State source = addNode(from);
        State target = addNode(to);
        if (!successorSets.get(source).add(target)) return false;
        successors.get(source).add(target);
        edgeCount++;
        return true;
    }

    /**
     * Marks a state as a failure state, registering it if needed.
     */
    public void markFailureState(State state) {
        failureStates.add(addNode(state));
    }

    /**
     * Attaches a contributing record to a state, registering it if needed.
     */
    public void attachRecord(State state, SensorRecord record) {
        records.get(addNode(state)).add(record);
    }

    /**
     * Freezes the graph; all further mutation throws {@link IllegalStateException}.
     */
    public void seal() {
        sealed = true;
    }

    public boolean isSealed() { return sealed; }

    // =========================================================================
    // Queries
    // =========================================================================

    /**
     * Returns the successors of {@code state} in edge-insertion order (empty for unknown states).
     */
    public List<State> getNeighbors(State state) {
        List<State> out = successors.get(state);
        return out == null ? Collections.emptyList() : Collections.unmodifiableList(out);
    }

    public boolean isFailureState(State state) {
        return failureStates.contains(state);
    }

    public boolean containsNode(State state) {
        return nodes.containsKey(state);
    }

    public boolean hasEdge(State from, State to) {
        Set<State> out = successorSets.get(from);
        return out != null && out.contains(to);
    }

    /**
     * Returns the registered instance equal to {@code state}, or {@code null}.
     */
    public State getNode(State state) {
        return nodes.get(state);
    }

    /** Nodes in insertion order. */
    public Collection<State> getNodes() {
        return Collections.unmodifiableCollection(nodes.keySet());
    }

    /** Failure states in marking order. */
    public Set<State> getFailureStates() {
        return Collections.unmodifiableSet(failureStates);
    }

    public List<SensorRecord> getRecords(State state) {
        List<SensorRecord> out = records.get(state);
        return out == null ? Collections.emptyList() : Collections.unmodifiableList(out);
    }

    /**
     * Returns every non-failure node that has a direct edge into some failure state,
     * in node insertion order.
     */
    public List<State> getNonFailurePredecessorsOfFailures() {
        List<State> out = new ArrayList<>();
        for (State node : nodes.keySet()) {
            if (failureStates.contains(node)) continue;
            for (State next : successors.get(node)) {
                if (failureStates.contains(next)) {
                    out.add(node);
                    break;
                }
            }
        }
        return out;
    }

    public int nodeCount() { return nodes.size(); }

    public int edgeCount() { return edgeCount; }

    private void checkMutable() {
        if (sealed) {
            throw new IllegalStateException("StateGraph is sealed and can no longer be modified");
        }
    }

    @Override
    public String toString() {
        return "StateGraph{nodes=" + nodes.size() + ", edges=" + edgeCount
            + ", failureStates=" + failureStates.size() + "}";
    }
}
