package madjustment.graph;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;
import java.util.Set;
import madjustment.core.model.MGraph;
import org.junit.jupiter.api.Test;

final class AncestryQueriesTest {

  private static MGraph chain() {
    return MGraph.builder()
        .addEdge("A", "B")
        .addEdge("B", "C")
        .addEdge("D", "C")
        .addVertex("R")
        .build();
  }

  @Test
  void ancestorReachesTargetsDownstream() {
    MGraph graph = chain();
    assertTrue(AncestryQueries.isAncestor(graph, "A", List.of("C")));
    assertTrue(AncestryQueries.isAncestor(graph, "A", List.of("R", "B")), "One match suffices");
    assertFalse(AncestryQueries.isAncestor(graph, "C", List.of("A")), "Direction matters");
    assertFalse(AncestryQueries.isAncestor(graph, "A", List.of("D", "R")));
  }

  @Test
  void vertexIsItsOwnAncestor() {
    assertTrue(AncestryQueries.isAncestor(chain(), "B", Set.of("B")));
  }

  @Test
  void emptyTargetsNeverMatch() {
    assertFalse(AncestryQueries.isAncestor(chain(), "A", Set.of()));
  }

  @Test
  void descendantsIncludeTheStart() {
    MGraph graph = chain();
    assertEquals(Set.of("A", "B", "C"), AncestryQueries.descendantsOf(graph, "A"));
    assertEquals(Set.of("R"), AncestryQueries.descendantsOf(graph, "R"));
    assertEquals(Set.of("C"), AncestryQueries.descendantsOf(graph, "C"));
  }

  @Test
  void addingAnOutgoingEdgeNeverShrinksDescendants() {
    MGraph before = chain();
    MGraph after =
        MGraph.builder()
            .addEdge("A", "B")
            .addEdge("B", "C")
            .addEdge("D", "C")
            .addVertex("R")
            .addEdge("B", "R")
            .build();

    for (String vertex : before.vertices()) {
      Set<String> grown = AncestryQueries.descendantsOf(after, vertex);
      assertTrue(
          grown.containsAll(AncestryQueries.descendantsOf(before, vertex)),
          vertex + " lost descendants");
    }
    assertEquals(Set.of("A", "B", "C", "R"), AncestryQueries.descendantsOf(after, "A"));
  }
}
