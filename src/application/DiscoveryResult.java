package application;

import domain.graph.StateGraph;
import domain.model.FailureSequence;
import domain.model.State;
import domain.model.WarningSign;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Read-only outputs of one discovery run, in pipeline order.
 *
 * <pre>
 *   recordCount → graph → paths → sequences → warningSigns
 * </pre>
 */
public final class DiscoveryResult {

    private final int recordCount;
    private final StateGraph graph;
    private final List<List<State>> paths;
    private final List<FailureSequence> sequences;
    private final List<WarningSign> warningSigns;

    public DiscoveryResult(int recordCount,
                           StateGraph graph,
                           List<List<State>> paths,
                           List<FailureSequence> sequences,
                           List<WarningSign> warningSigns) {
        this.recordCount = recordCount;
        this.graph = graph;
        this.paths = Collections.unmodifiableList(new ArrayList<>(paths));
        this.sequences = Collections.unmodifiableList(new ArrayList<>(sequences));
        this.warningSigns = Collections.unmodifiableList(new ArrayList<>(warningSigns));
    }

    /** Number of records the graph was built from (after sampling). */
    public int getRecordCount() { return recordCount; }
    public StateGraph getGraph() { return graph; }
    public List<List<State>> getPaths() { return paths; }
    public List<FailureSequence> getSequences() { return sequences; }
    public List<WarningSign> getWarningSigns() { return warningSigns; }
}
