package madjustment.graph;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import madjustment.core.model.CausalPath;
import madjustment.core.model.MGraph;

/**
 * Enumerates proper causal paths: directed paths from the treatment to the outcome that only meet
 * the treatment at their first vertex.
 */
public final class PathFinder {
  private PathFinder() {}

  /**
   * Returns every proper causal path from {@code treatment} to {@code outcome}, in depth-first
   * order over the successor lists of {@code graph}. An empty list means the outcome is not
   * reachable.
   *
   * @throws IllegalArgumentException if either vertex is missing from the graph or they coincide
   */
  public static List<CausalPath> properCausalPaths(MGraph graph, String treatment, String outcome) {
    Objects.requireNonNull(graph, "graph");
    requireVertex(graph, treatment);
    requireVertex(graph, outcome);
    if (treatment.equals(outcome)) {
      throw new IllegalArgumentException("Treatment and outcome must differ: " + treatment);
    }

    List<CausalPath> paths = new ArrayList<>();
    List<String> current = new ArrayList<>();
    current.add(treatment);
    extend(graph, treatment, outcome, current, paths);
    return List.copyOf(paths);
  }

  private static void extend(
      MGraph graph, String treatment, String outcome, List<String> current, List<CausalPath> out) {
    String tail = current.get(current.size() - 1);
    for (String child : graph.successors(tail)) {
      // only reachable through a cycle, which the DAG precondition rules out
      if (child.equals(treatment)) {
        continue;
      }
      current.add(child);
      if (child.equals(outcome)) {
        out.add(CausalPath.ofVertices(current));
      } else {
        extend(graph, treatment, outcome, current, out);
      }
      current.remove(current.size() - 1);
    }
  }

  private static void requireVertex(MGraph graph, String vertex) {
    Objects.requireNonNull(vertex, "vertex");
    if (!graph.contains(vertex)) {
      throw new IllegalArgumentException("Vertex not in graph: " + vertex);
    }
  }
}
