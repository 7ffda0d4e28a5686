package domain.engine;

import domain.graph.StateGraph;
import domain.model.State;

import java.util.Collections;

/**
 * Small hand-built graphs shared by the engine tests.
 */
final class GraphFixtures {

    static State s(String label) {
        return new State("M-001", Collections.singletonList(label));
    }

    /** a → b → f, a → c → d → f; f is the failure state. */
    static StateGraph diamond() {
        StateGraph graph = new StateGraph();
        graph.addEdge(s("a"), s("b"));
        graph.addEdge(s("a"), s("c"));
        graph.addEdge(s("b"), s("f"));
        graph.addEdge(s("c"), s("d"));
        graph.addEdge(s("d"), s("f"));
        graph.markFailureState(s("f"));
        graph.seal();
        return graph;
    }

    /** a ⇄ b, b → f, with a self-loop on a. */
    static StateGraph cyclic() {
        StateGraph graph = new StateGraph();
        graph.addEdge(s("a"), s("a"));
        graph.addEdge(s("a"), s("b"));
        graph.addEdge(s("b"), s("a"));
        graph.addEdge(s("b"), s("f"));
        graph.markFailureState(s("f"));
        graph.seal();
        return graph;
    }

    private GraphFixtures() {
    }
}
