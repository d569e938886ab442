package madjustment.separation;

import java.util.Set;
import madjustment.core.model.MGraph;

/**
 * Decides d-separation of two vertex sets given a conditioning set in a directed acyclic graph.
 *
 * <p>Implementations treat an empty {@code a} or {@code b} as trivially separated and reject sets
 * that overlap or name vertices outside the graph with {@link IllegalArgumentException}.
 */
@FunctionalInterface
public interface DSeparationOracle {

  boolean isSeparated(MGraph graph, Set<String> a, Set<String> b, Set<String> given);
}
