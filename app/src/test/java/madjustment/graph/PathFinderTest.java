package madjustment.graph;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;
import madjustment.core.model.CausalPath;
import madjustment.core.model.MGraph;
import madjustment.examples.Examples;
import org.junit.jupiter.api.Test;

final class PathFinderTest {

  @Test
  void findsAllMediatedPaths() {
    MGraph graph = Examples.properPaths().graph();

    List<CausalPath> paths = PathFinder.properCausalPaths(graph, "A", "Y");

    assertEquals(
        List.of(
            CausalPath.ofVertices("A", "M1", "Y"),
            CausalPath.ofVertices("A", "M1", "M2", "Y"),
            CausalPath.ofVertices("A", "M2", "Y")),
        paths,
        "Depth-first over successors in edge order");
  }

  @Test
  void findsPathsThroughSharedVertices() {
    MGraph graph = Examples.fourPaths().graph();

    List<CausalPath> paths = PathFinder.properCausalPaths(graph, "U", "Y");

    assertEquals(
        List.of(
            CausalPath.ofVertices("U", "W", "B", "Y"),
            CausalPath.ofVertices("U", "W", "Y"),
            CausalPath.ofVertices("U", "A", "B", "Y"),
            CausalPath.ofVertices("U", "A", "Y")),
        paths);
  }

  @Test
  void singleDirectEdge() {
    MGraph graph = Examples.fourPaths().graph();
    assertEquals(
        List.of(CausalPath.ofVertices("X", "Y")), PathFinder.properCausalPaths(graph, "X", "Y"));
  }

  @Test
  void stopsAtOutcome() {
    MGraph graph = MGraph.builder().addEdge("X", "Y").addEdge("Y", "Z").addEdge("Z", "W").build();
    assertEquals(
        List.of(CausalPath.ofVertices("X", "Y")), PathFinder.properCausalPaths(graph, "X", "Y"));
  }

  @Test
  void unreachableOutcomeGivesNoPaths() {
    MGraph graph = MGraph.builder().addEdge("Y", "X").addVertex("Z").build();
    assertTrue(PathFinder.properCausalPaths(graph, "X", "Y").isEmpty());
    assertTrue(PathFinder.properCausalPaths(graph, "X", "Z").isEmpty());
  }

  @Test
  void rejectsUnknownOrEqualEndpoints() {
    MGraph graph = MGraph.builder().addEdge("X", "Y").build();
    assertThrows(
        IllegalArgumentException.class, () -> PathFinder.properCausalPaths(graph, "X", "Q"));
    assertThrows(
        IllegalArgumentException.class, () -> PathFinder.properCausalPaths(graph, "X", "X"));
  }
}
