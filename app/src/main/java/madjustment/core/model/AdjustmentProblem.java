package madjustment.core.model;

import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Input to one criterion evaluation: the m-graph, treatment and outcome vertices, and the ordered
 * variable list whose subsets are candidate adjustment sets.
 */
public record AdjustmentProblem(
    String name, MGraph graph, String treatment, String outcome, List<Variable> variables) {

  public AdjustmentProblem {
    Objects.requireNonNull(graph, "graph");
    Objects.requireNonNull(treatment, "treatment");
    Objects.requireNonNull(outcome, "outcome");
    Objects.requireNonNull(variables, "variables");
    name = name == null || name.isBlank() ? treatment + "->" + outcome : name;
    variables = List.copyOf(variables);
  }

  public AdjustmentProblem withTreatment(String newTreatment) {
    return new AdjustmentProblem(name, graph, newTreatment, outcome, variables);
  }

  public AdjustmentProblem withOutcome(String newOutcome) {
    return new AdjustmentProblem(name, graph, treatment, newOutcome, variables);
  }

  /** Names of variables (or indicators) that do not appear as vertices of the graph. */
  public Set<String> unknownVertices() {
    Set<String> unknown = new HashSet<>();
    for (Variable variable : variables) {
      if (!graph.contains(variable.name())) {
        unknown.add(variable.name());
      }
      variable.missingnessIndicator().filter(r -> !graph.contains(r)).ifPresent(unknown::add);
    }
    return unknown;
  }
}
