package madjustment.graph;

import java.util.ArrayDeque;
import java.util.Collection;
import java.util.Deque;
import java.util.LinkedHashSet;
import java.util.Objects;
import java.util.Set;
import madjustment.core.model.MGraph;

/** Ancestor and descendant lookups over directed edges. */
public final class AncestryQueries {
  private AncestryQueries() {}

  /**
   * Returns true if {@code vertex} is an ancestor of at least one member of {@code targets}. A
   * vertex counts as its own ancestor, so a target equal to {@code vertex} also matches.
   */
  public static boolean isAncestor(MGraph graph, String vertex, Collection<String> targets) {
    Objects.requireNonNull(graph, "graph");
    Objects.requireNonNull(targets, "targets");
    if (targets.isEmpty()) {
      return false;
    }
    Set<String> visited = new LinkedHashSet<>();
    Deque<String> stack = new ArrayDeque<>();
    stack.push(vertex);
    while (!stack.isEmpty()) {
      String current = stack.pop();
      if (!visited.add(current)) {
        continue;
      }
      if (targets.contains(current)) {
        return true;
      }
      for (String child : graph.successors(current)) {
        if (!visited.contains(child)) {
          stack.push(child);
        }
      }
    }
    return false;
  }

  /** Returns {@code source} together with every vertex reachable from it along directed edges. */
  public static Set<String> descendantsOf(MGraph graph, String source) {
    Objects.requireNonNull(graph, "graph");
    Set<String> visited = new LinkedHashSet<>();
    Deque<String> stack = new ArrayDeque<>();
    stack.push(source);
    while (!stack.isEmpty()) {
      String current = stack.pop();
      if (!visited.add(current)) {
        continue;
      }
      for (String next : graph.successors(current)) {
        if (!visited.contains(next)) {
          stack.push(next);
        }
      }
    }
    return visited;
  }
}
