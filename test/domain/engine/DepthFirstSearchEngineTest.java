package domain.engine;

import domain.graph.StateGraph;
import domain.model.State;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;

import static domain.engine.GraphFixtures.s;
import static org.assertj.core.api.Assertions.assertThat;

class DepthFirstSearchEngineTest {

    @Test
    void findsEveryGoalPathInAdjacencyOrder() {
        StateGraph graph = GraphFixtures.diamond();
        DepthFirstSearchEngine engine = new DepthFirstSearchEngine(10);

        List<List<State>> paths = engine.findPaths(graph, s("a"), graph::isFailureState);

        assertThat(paths).containsExactly(
            Arrays.asList(s("a"), s("b"), s("f")),
            Arrays.asList(s("a"), s("c"), s("d"), s("f")));
    }

    @Test
    void cyclesDoNotRepeatStatesOnAPath() {
        StateGraph graph = GraphFixtures.cyclic();
        DepthFirstSearchEngine engine = new DepthFirstSearchEngine(10);

        List<List<State>> paths = engine.findPaths(graph, s("a"), graph::isFailureState);

        assertThat(paths).containsExactly(Arrays.asList(s("a"), s("b"), s("f")));
        assertThat(paths).allSatisfy(path -> assertThat(new HashSet<>(path)).hasSameSizeAs(path));
    }

    @Test
    void depthBoundLimitsPathLength() {
        StateGraph graph = GraphFixtures.diamond();

        assertThat(new DepthFirstSearchEngine(2).findPaths(graph, s("a"), graph::isFailureState))
            .containsExactly(Arrays.asList(s("a"), s("b"), s("f")));
        assertThat(new DepthFirstSearchEngine(1).findPaths(graph, s("a"), graph::isFailureState))
            .isEmpty();
    }

    @Test
    void pathCapStopsEarly() {
        StateGraph graph = GraphFixtures.diamond();
        DepthFirstSearchEngine engine = new DepthFirstSearchEngine(10, 1);

        assertThat(engine.findPaths(graph, s("a"), graph::isFailureState)).hasSize(1);
    }

    @Test
    void startAtGoalIsSingleStatePath() {
        StateGraph graph = GraphFixtures.diamond();
        DepthFirstSearchEngine engine = new DepthFirstSearchEngine(10);

        assertThat(engine.findPaths(graph, s("f"), graph::isFailureState))
            .containsExactly(Collections.singletonList(s("f")));
    }
}
