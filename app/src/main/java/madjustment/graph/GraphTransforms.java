package madjustment.graph;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import madjustment.core.model.CausalPath;
import madjustment.core.model.Edge;
import madjustment.core.model.MGraph;

/** Derived graphs used by the separation checks. Every method returns a fresh graph. */
public final class GraphTransforms {
  private GraphTransforms() {}

  /** Removes the first edge of each proper causal path; later path edges stay in place. */
  public static MGraph properBackdoorGraph(MGraph graph, List<CausalPath> paths) {
    Objects.requireNonNull(graph, "graph");
    Objects.requireNonNull(paths, "paths");
    Set<Edge> firstEdges = new LinkedHashSet<>();
    for (CausalPath path : paths) {
      Edge first = path.firstEdge();
      if (graph.hasEdge(first)) {
        firstEdges.add(first);
      }
    }
    return graph.withoutEdges(firstEdges);
  }

  /** Removes every edge pointing into {@code vertex}. */
  public static MGraph aboveCut(MGraph graph, String vertex) {
    Objects.requireNonNull(graph, "graph");
    List<Edge> incoming = new ArrayList<>();
    for (String parent : graph.predecessors(vertex)) {
      incoming.add(new Edge(parent, vertex));
    }
    return graph.withoutEdges(incoming);
  }

  /** Removes every edge leaving {@code vertex}. */
  public static MGraph belowCut(MGraph graph, String vertex) {
    Objects.requireNonNull(graph, "graph");
    List<Edge> outgoing = new ArrayList<>();
    for (String child : graph.successors(vertex)) {
      outgoing.add(new Edge(vertex, child));
    }
    return graph.withoutEdges(outgoing);
  }
}
