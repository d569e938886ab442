package madjustment.separation;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import edu.cmu.tetrad.graph.Graph;
import java.util.Set;
import madjustment.core.model.Edge;
import madjustment.core.model.MGraph;
import org.junit.jupiter.api.Test;

final class TetradDSeparationTest {
  private final DSeparationOracle oracle = new TetradDSeparation();

  @Test
  void chainBlockedByMiddle() {
    MGraph graph = MGraph.builder().addEdge("A", "B").addEdge("B", "C").build();
    assertFalse(oracle.isSeparated(graph, Set.of("A"), Set.of("C"), Set.of()));
    assertTrue(oracle.isSeparated(graph, Set.of("A"), Set.of("C"), Set.of("B")));
  }

  @Test
  void forkBlockedByCommonCause() {
    MGraph graph = MGraph.builder().addEdge("B", "A").addEdge("B", "C").build();
    assertFalse(oracle.isSeparated(graph, Set.of("A"), Set.of("C"), Set.of()));
    assertTrue(oracle.isSeparated(graph, Set.of("C"), Set.of("A"), Set.of("B")));
  }

  @Test
  void colliderOpenedByItselfOrDescendant() {
    MGraph graph =
        MGraph.builder().addEdge("A", "C").addEdge("B", "C").addEdge("C", "D").build();
    assertTrue(oracle.isSeparated(graph, Set.of("A"), Set.of("B"), Set.of()));
    assertFalse(oracle.isSeparated(graph, Set.of("A"), Set.of("B"), Set.of("C")));
    assertFalse(
        oracle.isSeparated(graph, Set.of("A"), Set.of("B"), Set.of("D")),
        "Conditioning on a descendant of the collider opens it");
  }

  @Test
  void mStructure() {
    MGraph graph =
        MGraph.builder()
            .addEdge("U1", "X")
            .addEdge("U1", "M")
            .addEdge("U2", "M")
            .addEdge("U2", "Y")
            .build();
    assertTrue(oracle.isSeparated(graph, Set.of("X"), Set.of("Y"), Set.of()));
    assertFalse(oracle.isSeparated(graph, Set.of("X"), Set.of("Y"), Set.of("M")));
    assertTrue(oracle.isSeparated(graph, Set.of("X"), Set.of("Y"), Set.of("M", "U1")));
  }

  @Test
  void isolatedVerticesAreSeparated() {
    MGraph graph = MGraph.builder().addEdge("X", "Y").addVertices("R1", "R2").build();
    assertTrue(oracle.isSeparated(graph, Set.of("Y"), Set.of("R1", "R2"), Set.of("X")));
  }

  @Test
  void derivedGraphsAreConvertedSeparately() {
    MGraph graph =
        MGraph.builder().addEdge("Z", "X").addEdge("Z", "Y").addEdge("X", "Y").build();
    MGraph backdoor = graph.withoutEdges(Set.of(Edge.of("X", "Y")));
    MGraph copy = graph.withoutEdges(Set.of());

    assertFalse(oracle.isSeparated(graph, Set.of("X"), Set.of("Y"), Set.of("Z")));
    assertTrue(oracle.isSeparated(backdoor, Set.of("X"), Set.of("Y"), Set.of("Z")));
    assertFalse(oracle.isSeparated(copy, Set.of("X"), Set.of("Y"), Set.of("Z")));
    assertTrue(oracle.isSeparated(backdoor, Set.of("Y"), Set.of("X"), Set.of("Z")));
  }

  @Test
  void conversionKeepsEveryVertexAndEdge() {
    MGraph graph = MGraph.builder().addEdge("A", "B").addVertices("R1", "R2").build();

    Graph converted = TetradDSeparation.toTetrad(graph);

    assertEquals(4, converted.getNumNodes());
    assertEquals(1, converted.getNumEdges());
    assertTrue(converted.isParentOf(converted.getNode("A"), converted.getNode("B")));
  }

  @Test
  void emptySideIsTriviallySeparated() {
    MGraph graph = MGraph.builder().addEdge("X", "Y").build();
    assertTrue(oracle.isSeparated(graph, Set.of("Y"), Set.of(), Set.of("X")));
    assertTrue(oracle.isSeparated(graph, Set.of(), Set.of("Y"), Set.of()));
  }

  @Test
  void rejectsOverlappingOrUnknownSets() {
    MGraph graph = MGraph.builder().addEdge("X", "Y").addEdge("Y", "Z").build();
    assertThrows(
        IllegalArgumentException.class,
        () -> oracle.isSeparated(graph, Set.of("X"), Set.of("Z"), Set.of("X")));
    assertThrows(
        IllegalArgumentException.class,
        () -> oracle.isSeparated(graph, Set.of("X"), Set.of("X", "Z"), Set.of()));
    assertThrows(
        IllegalArgumentException.class,
        () -> oracle.isSeparated(graph, Set.of("X"), Set.of("Q"), Set.of()));
  }
}
