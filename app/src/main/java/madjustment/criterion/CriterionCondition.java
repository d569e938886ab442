package madjustment.criterion;

/** The four conditions of the M-adjustment criterion, in the order they are checked. */
public enum CriterionCondition {
  /** No member of the candidate lies on, or descends from, a proper causal path. */
  EXCLUSION,
  /** Treatment and outcome are separated by the candidate and R_W in the proper backdoor graph. */
  BACKDOOR_SEPARATION,
  /** Outcome and R_W are separated by the treatment once its incoming edges are cut. */
  OUTCOME_MISSINGNESS_SEPARATION,
  /** When the treatment is an ancestor of R_W, it is separated from the outcome below the cut. */
  TREATMENT_OUTCOME_SEPARATION;
}
