package madjustment.core.model;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Immutable directed graph over named vertices, augmented with missingness-indicator vertices.
 *
 * <p>Vertices keep their insertion order and edges are de-duplicated in insertion order, so every
 * traversal over the graph is deterministic. Acyclicity is a caller precondition and is not
 * re-validated; only self-loops are rejected.
 */
public final class MGraph {
  private final Set<String> vertices;
  private final List<Edge> edges;
  private final Map<String, List<String>> successors;
  private final Map<String, List<String>> predecessors;

  private MGraph(Set<String> vertices, List<Edge> edges) {
    this.vertices = Collections.unmodifiableSet(new LinkedHashSet<>(vertices));
    this.edges = List.copyOf(edges);
    Map<String, List<String>> out = new LinkedHashMap<>();
    Map<String, List<String>> in = new LinkedHashMap<>();
    for (String vertex : this.vertices) {
      out.put(vertex, new ArrayList<>());
      in.put(vertex, new ArrayList<>());
    }
    for (Edge edge : this.edges) {
      out.get(edge.source()).add(edge.target());
      in.get(edge.target()).add(edge.source());
    }
    out.replaceAll((vertex, list) -> List.copyOf(list));
    in.replaceAll((vertex, list) -> List.copyOf(list));
    this.successors = out;
    this.predecessors = in;
  }

  public static Builder builder() {
    return new Builder();
  }

  public Set<String> vertices() {
    return vertices;
  }

  public List<Edge> edges() {
    return edges;
  }

  public int vertexCount() {
    return vertices.size();
  }

  public int edgeCount() {
    return edges.size();
  }

  public boolean contains(String vertex) {
    return vertices.contains(vertex);
  }

  public boolean hasEdge(String source, String target) {
    return contains(source) && successors.get(source).contains(target);
  }

  public boolean hasEdge(Edge edge) {
    return hasEdge(edge.source(), edge.target());
  }

  public List<String> successors(String vertex) {
    return successors.get(requireVertex(vertex));
  }

  public List<String> predecessors(String vertex) {
    return predecessors.get(requireVertex(vertex));
  }

  /** Returns a new graph with the same vertices and every listed edge removed. */
  public MGraph withoutEdges(Collection<Edge> removed) {
    Objects.requireNonNull(removed, "removed");
    Set<Edge> drop = new HashSet<>(removed);
    List<Edge> kept = new ArrayList<>(edges.size());
    for (Edge edge : edges) {
      if (!drop.contains(edge)) {
        kept.add(edge);
      }
    }
    return new MGraph(vertices, kept);
  }

  private String requireVertex(String vertex) {
    Objects.requireNonNull(vertex, "vertex");
    if (!vertices.contains(vertex)) {
      throw new IllegalArgumentException("Unknown vertex: " + vertex);
    }
    return vertex;
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof MGraph other)) {
      return false;
    }
    return vertices.equals(other.vertices)
        && new HashSet<>(edges).equals(new HashSet<>(other.edges));
  }

  @Override
  public int hashCode() {
    return Objects.hash(vertices, new HashSet<>(edges));
  }

  @Override
  public String toString() {
    return "MGraph" + vertices + " " + edges;
  }

  /** Mutable accumulator for {@link MGraph} instances. */
  public static final class Builder {
    private final Set<String> vertices = new LinkedHashSet<>();
    private final Set<Edge> edges = new LinkedHashSet<>();

    private Builder() {}

    public Builder addVertex(String vertex) {
      vertices.add(Objects.requireNonNull(vertex, "vertex"));
      return this;
    }

    public Builder addVertices(String... names) {
      for (String name : names) {
        addVertex(name);
      }
      return this;
    }

    public Builder addEdge(String source, String target) {
      return addEdge(new Edge(source, target));
    }

    public Builder addEdge(Edge edge) {
      Objects.requireNonNull(edge, "edge");
      if (edge.source().equals(edge.target())) {
        throw new IllegalArgumentException("Self-loop on " + edge.source());
      }
      vertices.add(edge.source());
      vertices.add(edge.target());
      edges.add(edge);
      return this;
    }

    public MGraph build() {
      return new MGraph(vertices, new ArrayList<>(edges));
    }
  }
}
