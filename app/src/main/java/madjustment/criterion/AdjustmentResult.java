package madjustment.criterion;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import madjustment.core.model.CausalPath;

/** Aggregated outcome of one M-adjustment search. */
public record AdjustmentResult(
    String treatment,
    String outcome,
    List<CausalPath> properCausalPaths,
    Set<String> exclusionSet,
    List<List<String>> validSets,
    List<String> bestSet,
    long candidatesExamined,
    List<CandidateRejection> rejections,
    long elapsedMillis) {

  public AdjustmentResult {
    Objects.requireNonNull(treatment, "treatment");
    Objects.requireNonNull(outcome, "outcome");
    Objects.requireNonNull(properCausalPaths, "properCausalPaths");
    Objects.requireNonNull(exclusionSet, "exclusionSet");
    Objects.requireNonNull(validSets, "validSets");
    properCausalPaths = List.copyOf(properCausalPaths);
    exclusionSet = Collections.unmodifiableSet(new LinkedHashSet<>(exclusionSet));
    validSets = validSets.stream().map(List::copyOf).toList();
    bestSet = bestSet == null ? null : List.copyOf(bestSet);
    rejections = rejections == null ? List.of() : List.copyOf(rejections);
  }

  /** The smallest valid set, the earliest one found on ties; empty when none is valid. */
  public Optional<List<String>> best() {
    return Optional.ofNullable(bestSet);
  }

  public boolean hasValidSet() {
    return bestSet != null;
  }
}
