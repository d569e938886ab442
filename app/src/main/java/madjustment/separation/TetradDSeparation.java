package madjustment.separation;

import com.google.common.cache.Cache;
import com.google.common.cache.CacheBuilder;
import edu.cmu.tetrad.graph.EdgeListGraph;
import edu.cmu.tetrad.graph.Graph;
import edu.cmu.tetrad.graph.GraphNode;
import edu.cmu.tetrad.graph.Node;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import madjustment.core.model.Edge;
import madjustment.core.model.MGraph;

/**
 * D-separation answered by Tetrad's {@link EdgeListGraph}.
 *
 * <p>Each {@link MGraph} is converted once and kept while the instance is reachable, so the many
 * queries a criterion search issues against the same derived graph share one Tetrad graph. Set
 * separation is checked pairwise, which is equivalent for d-separation.
 */
public final class TetradDSeparation implements DSeparationOracle {
  private final Cache<MGraph, Graph> converted =
      CacheBuilder.newBuilder().weakKeys().maximumSize(16).build();

  @Override
  public boolean isSeparated(MGraph graph, Set<String> a, Set<String> b, Set<String> given) {
    Objects.requireNonNull(graph, "graph");
    Objects.requireNonNull(a, "a");
    Objects.requireNonNull(b, "b");
    Objects.requireNonNull(given, "given");
    requireKnown(graph, a);
    requireKnown(graph, b);
    requireKnown(graph, given);
    requireDisjoint(a, b, given);
    if (a.isEmpty() || b.isEmpty()) {
      return true;
    }

    Graph dag = tetradGraph(graph);
    List<Node> conditioning = new ArrayList<>(given.size());
    for (String vertex : given) {
      conditioning.add(dag.getNode(vertex));
    }
    for (String x : a) {
      Node source = dag.getNode(x);
      for (String y : b) {
        if (!dag.isDSeparatedFrom(source, dag.getNode(y), conditioning)) {
          return false;
        }
      }
    }
    return true;
  }

  private Graph tetradGraph(MGraph graph) {
    Graph dag = converted.getIfPresent(graph);
    if (dag == null) {
      dag = toTetrad(graph);
      converted.put(graph, dag);
    }
    return dag;
  }

  static Graph toTetrad(MGraph graph) {
    List<Node> nodes = new ArrayList<>(graph.vertexCount());
    for (String vertex : graph.vertices()) {
      nodes.add(new GraphNode(vertex));
    }
    Graph dag = new EdgeListGraph(nodes);
    for (Edge edge : graph.edges()) {
      dag.addDirectedEdge(dag.getNode(edge.source()), dag.getNode(edge.target()));
    }
    return dag;
  }

  private static void requireKnown(MGraph graph, Set<String> vertices) {
    for (String vertex : vertices) {
      if (!graph.contains(vertex)) {
        throw new IllegalArgumentException("Vertex not in graph: " + vertex);
      }
    }
  }

  private static void requireDisjoint(Set<String> a, Set<String> b, Set<String> given) {
    Set<String> seen = new HashSet<>(a);
    for (Set<String> other : List.of(b, given)) {
      for (String vertex : other) {
        if (!seen.add(vertex)) {
          throw new IllegalArgumentException("Separation sets are not disjoint at " + vertex);
        }
      }
    }
  }
}
