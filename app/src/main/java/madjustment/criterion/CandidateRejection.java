package madjustment.criterion;

import java.util.List;
import java.util.Objects;
import java.util.Set;

/** Records why a candidate adjustment set was discarded. */
public record CandidateRejection(
    List<String> candidate, Set<String> missingnessIndicators, CriterionCondition condition) {

  public CandidateRejection {
    Objects.requireNonNull(condition, "condition");
    candidate = candidate == null ? List.of() : List.copyOf(candidate);
    missingnessIndicators =
        missingnessIndicators == null ? Set.of() : Set.copyOf(missingnessIndicators);
  }
}
