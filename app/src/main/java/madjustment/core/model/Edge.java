package madjustment.core.model;

import java.util.Objects;

/** Immutable directed edge {@code source -> target} of an m-graph. */
public record Edge(String source, String target) {

  public Edge {
    Objects.requireNonNull(source, "source");
    Objects.requireNonNull(target, "target");
  }

  public static Edge of(String source, String target) {
    return new Edge(source, target);
  }

  @Override
  public String toString() {
    return source + "->" + target;
  }
}
