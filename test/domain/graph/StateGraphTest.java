package domain.graph;

import domain.model.State;
import org.junit.jupiter.api.Test;

import java.util.Collections;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class StateGraphTest {

    private static State state(String label) {
        return new State("M-001", Collections.singletonList(label));
    }

    @Test
    void addNodeReturnsCanonicalInstance() {
        StateGraph graph = new StateGraph();
        State first = graph.addNode(state("a"));
        State second = graph.addNode(state("a"));

        assertThat(second).isSameAs(first);
        assertThat(graph.getNode(state("a"))).isSameAs(first);
        assertThat(graph.containsNode(state("a"))).isTrue();
        assertThat(graph.containsNode(state("b"))).isFalse();
        assertThat(graph.getNode(state("b"))).isNull();
        assertThat(graph.nodeCount()).isEqualTo(1);
    }

    @Test
    void duplicateEdgesAreIgnored() {
        StateGraph graph = new StateGraph();
        assertThat(graph.addEdge(state("a"), state("b"))).isTrue();
        assertThat(graph.addEdge(state("a"), state("b"))).isFalse();

        assertThat(graph.edgeCount()).isEqualTo(1);
        assertThat(graph.getNeighbors(state("a"))).containsExactly(state("b"));
        assertThat(graph.getNeighbors(state("zzz"))).isEmpty();
    }

    @Test
    void predecessorsOfFailuresExcludeFailureStates() {
        StateGraph graph = new StateGraph();
        graph.addEdge(state("a"), state("b"));
        graph.addEdge(state("b"), state("f"));
        graph.addEdge(state("f"), state("g"));
        graph.addEdge(state("g"), state("f"));
        graph.markFailureState(state("f"));
        graph.markFailureState(state("g"));

        assertThat(graph.getNonFailurePredecessorsOfFailures()).containsExactly(state("b"));
    }

    @Test
    void sealedGraphRejectsMutation() {
        StateGraph graph = new StateGraph();
        graph.addNode(state("a"));
        graph.seal();

        assertThat(graph.isSealed()).isTrue();
        assertThatThrownBy(() -> graph.addEdge(state("a"), state("b")))
            .isInstanceOf(IllegalStateException.class);
        assertThatThrownBy(() -> graph.markFailureState(state("a")))
            .isInstanceOf(IllegalStateException.class);
    }
}
