package madjustment.core.model;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Directed path from the treatment to the outcome, stored as its consecutive edges. A proper
 * causal path never revisits its first vertex.
 */
public record CausalPath(List<Edge> edges) {

  public CausalPath {
    Objects.requireNonNull(edges, "edges");
    if (edges.isEmpty()) {
      throw new IllegalArgumentException("A causal path needs at least one edge");
    }
    for (int i = 1; i < edges.size(); i++) {
      if (!edges.get(i - 1).target().equals(edges.get(i).source())) {
        throw new IllegalArgumentException("Edges do not form a walk: " + edges);
      }
    }
    edges = List.copyOf(edges);
  }

  /** Builds a path from a vertex sequence of length two or more. */
  public static CausalPath ofVertices(List<String> vertices) {
    Objects.requireNonNull(vertices, "vertices");
    List<Edge> edges = new ArrayList<>(Math.max(0, vertices.size() - 1));
    for (int i = 0; i + 1 < vertices.size(); i++) {
      edges.add(new Edge(vertices.get(i), vertices.get(i + 1)));
    }
    return new CausalPath(edges);
  }

  public static CausalPath ofVertices(String... vertices) {
    return ofVertices(List.of(vertices));
  }

  public Edge firstEdge() {
    return edges.get(0);
  }

  public String source() {
    return firstEdge().source();
  }

  public List<String> vertices() {
    List<String> vertices = new ArrayList<>(edges.size() + 1);
    vertices.add(source());
    for (Edge edge : edges) {
      vertices.add(edge.target());
    }
    return vertices;
  }

  @Override
  public String toString() {
    return String.join("->", vertices());
  }
}
