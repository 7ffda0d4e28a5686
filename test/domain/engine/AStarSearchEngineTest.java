package domain.engine;

import domain.graph.StateGraph;
import domain.model.State;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.List;
import java.util.Optional;

import static domain.engine.GraphFixtures.s;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class AStarSearchEngineTest {

    @Test
    void constantHeuristicFindsShortestPath() {
        StateGraph graph = GraphFixtures.diamond();
        AStarSearchEngine engine = new AStarSearchEngine(new ConstantHeuristic(), 10, 1.0);

        Optional<List<State>> path = engine.findPath(graph, s("a"), graph::isFailureState);

        assertThat(path).contains(Arrays.asList(s("a"), s("b"), s("f")));
    }

    @Test
    void tiesAreBrokenByInsertionOrder() {
        // a → x → f and a → y → f have equal cost; x was pushed first
        StateGraph graph = new StateGraph();
        graph.addEdge(s("a"), s("x"));
        graph.addEdge(s("a"), s("y"));
        graph.addEdge(s("x"), s("f"));
        graph.addEdge(s("y"), s("f"));
        graph.markFailureState(s("f"));
        graph.seal();

        AStarSearchEngine engine = new AStarSearchEngine(new ConstantHeuristic(), 10, 1.0);

        assertThat(engine.findPath(graph, s("a"), graph::isFailureState))
            .contains(Arrays.asList(s("a"), s("x"), s("f")));
    }

    @Test
    void emptyWhenGoalBeyondDepthBound() {
        StateGraph graph = GraphFixtures.diamond();
        AStarSearchEngine engine = new AStarSearchEngine(new ConstantHeuristic(), 1, 1.0);

        assertThat(engine.findPath(graph, s("a"), graph::isFailureState)).isEmpty();
        assertThat(engine.findPaths(graph, s("a"), graph::isFailureState)).isEmpty();
    }

    @Test
    void terminatesOnCycles() {
        StateGraph graph = GraphFixtures.cyclic();
        AStarSearchEngine engine = new AStarSearchEngine(new SensorDistanceHeuristic(), 50, 2.0);

        assertThat(engine.findPaths(graph, s("a"), graph::isFailureState))
            .containsExactly(Arrays.asList(s("a"), s("b"), s("f")));
    }

    @Test
    void rejectsNonPositiveWeight() {
        assertThatThrownBy(() -> new AStarSearchEngine(new ConstantHeuristic(), 5, 0.0))
            .isInstanceOf(IllegalArgumentException.class);
    }
}
