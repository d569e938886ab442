package madjustment.core.model;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;
import java.util.Set;
import org.junit.jupiter.api.Test;

final class MGraphTest {

  private static MGraph diamond() {
    return MGraph.builder()
        .addEdge("A", "B")
        .addEdge("A", "C")
        .addEdge("B", "D")
        .addEdge("C", "D")
        .build();
  }

  @Test
  void edgesAddTheirEndpoints() {
    MGraph graph = MGraph.builder().addVertex("R").addEdge("A", "B").build();
    assertEquals(List.of("R", "A", "B"), List.copyOf(graph.vertices()));
    assertTrue(graph.hasEdge("A", "B"));
    assertFalse(graph.hasEdge("B", "A"), "Edges are directed");
  }

  @Test
  void duplicateEdgesCollapse() {
    MGraph graph = MGraph.builder().addEdge("A", "B").addEdge("A", "B").build();
    assertEquals(1, graph.edgeCount());
    assertEquals(List.of("B"), graph.successors("A"));
  }

  @Test
  void adjacencyFollowsEdgeOrder() {
    MGraph graph = diamond();
    assertEquals(List.of("B", "C"), graph.successors("A"));
    assertEquals(List.of("B", "C"), graph.predecessors("D"));
    assertTrue(graph.predecessors("A").isEmpty());
  }

  @Test
  void withoutEdgesLeavesReceiverUntouched() {
    MGraph graph = diamond();
    MGraph cut = graph.withoutEdges(List.of(Edge.of("A", "B"), Edge.of("X", "Y")));

    assertNotSame(graph, cut);
    assertEquals(4, graph.edgeCount(), "Receiver keeps every edge");
    assertEquals(3, cut.edgeCount());
    assertFalse(cut.hasEdge("A", "B"));
    assertEquals(graph.vertices(), cut.vertices(), "Vertices survive edge removal");
  }

  @Test
  void withoutNoEdgesStillCopies() {
    MGraph graph = diamond();
    MGraph copy = graph.withoutEdges(Set.of());
    assertNotSame(graph, copy);
    assertEquals(graph, copy);
  }

  @Test
  void rejectsSelfLoops() {
    assertThrows(IllegalArgumentException.class, () -> MGraph.builder().addEdge("A", "A"));
  }

  @Test
  void rejectsUnknownVertexQueries() {
    MGraph graph = diamond();
    assertThrows(IllegalArgumentException.class, () -> graph.successors("Q"));
    assertThrows(IllegalArgumentException.class, () -> graph.predecessors("Q"));
    assertFalse(graph.hasEdge("Q", "A"));
  }
}
