package madjustment.examples;

import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.function.Supplier;
import madjustment.core.model.AdjustmentProblem;
import madjustment.core.model.MGraph;
import madjustment.core.model.Variable;

/** Built-in m-graphs from the M-adjustment study, addressable by name. */
public final class Examples {
  private static final Map<String, Supplier<AdjustmentProblem>> CATALOGUE = buildCatalogue();

  private Examples() {}

  public static Set<String> names() {
    return CATALOGUE.keySet();
  }

  public static AdjustmentProblem byName(String name) {
    if (name == null || name.isBlank()) {
      throw new IllegalArgumentException("Unknown example: " + name);
    }
    Supplier<AdjustmentProblem> supplier = CATALOGUE.get(name.trim().toLowerCase(Locale.ROOT));
    if (supplier == null) {
      throw new IllegalArgumentException(
          "Unknown example: " + name + " (known: " + String.join(", ", names()) + ")");
    }
    return supplier.get();
  }

  /** Three proper causal paths from A to Y, one of them through both mediators. */
  public static AdjustmentProblem properPaths() {
    MGraph graph =
        MGraph.builder()
            .addVertices("A", "M1", "M2", "Y", "C1", "C2", "C3", "C4", "C5")
            .addEdge("A", "M1")
            .addEdge("A", "M2")
            .addEdge("M1", "Y")
            .addEdge("M2", "Y")
            .addEdge("C1", "C3")
            .addEdge("C1", "C4")
            .addEdge("C2", "C4")
            .addEdge("C2", "C5")
            .addEdge("C3", "A")
            .addEdge("C4", "A")
            .addEdge("C4", "M1")
            .addEdge("C4", "Y")
            .addEdge("C5", "Y")
            .addEdge("M1", "M2")
            .build();
    return new AdjustmentProblem(
        "proper-paths",
        graph,
        "A",
        "Y",
        observed("A", "M1", "M2", "Y", "C1", "C2", "C3", "C4", "C5"));
  }

  /** Four proper causal paths from U to Y, sharing the W and A prefixes. */
  public static AdjustmentProblem fourPaths() {
    MGraph graph =
        MGraph.builder()
            .addVertices("U", "V", "A", "W", "X", "T", "C", "B", "Y", "Z")
            .addEdge("U", "W")
            .addEdge("U", "A")
            .addEdge("V", "W")
            .addEdge("V", "X")
            .addEdge("V", "T")
            .addEdge("A", "C")
            .addEdge("A", "B")
            .addEdge("A", "Y")
            .addEdge("W", "B")
            .addEdge("W", "Y")
            .addEdge("X", "Y")
            .addEdge("T", "Z")
            .addEdge("B", "Y")
            .build();
    return new AdjustmentProblem(
        "four-paths", graph, "U", "Y", observed("U", "V", "A", "W", "X", "T", "C", "B", "Y", "Z"));
  }

  /** {Z1} and {Z1, Z2} are both valid; Z is a stray parent of R_Z1. */
  public static AdjustmentProblem twoAdjustmentSets() {
    MGraph graph =
        MGraph.builder()
            .addVertices("Z2", "Z1", "R_Z1", "R_Z2", "X", "Y")
            .addEdge("Z", "R_Z1")
            .addEdge("Z2", "R_Z2")
            .addEdge("Z2", "X")
            .addEdge("Z1", "X")
            .addEdge("Z1", "Y")
            .addEdge("X", "Y")
            .build();
    return new AdjustmentProblem(
        "two-adjustment-sets",
        graph,
        "X",
        "Y",
        List.of(
            Variable.observed("X"),
            Variable.observed("Y"),
            Variable.partiallyObserved("Z1", "R_Z1"),
            Variable.partiallyObserved("Z2", "R_Z2")));
  }

  /**
   * Adjusting for Z1 forces conditioning on R_Z1, a descendant of the collider Z2. Without missing
   * data {Z1} would suffice.
   */
  public static AdjustmentProblem colliderMissingness() {
    MGraph graph =
        MGraph.builder()
            .addVertices("X", "Y", "Z1", "R_Z1", "Z2")
            .addEdge("X", "Y")
            .addEdge("Z1", "X")
            .addEdge("Z1", "Y")
            .addEdge("X", "Z2")
            .addEdge("Y", "Z2")
            .addEdge("Z2", "R_Z1")
            .build();
    return new AdjustmentProblem(
        "collider-missingness",
        graph,
        "X",
        "Y",
        List.of(
            Variable.observed("X"),
            Variable.observed("Y"),
            Variable.partiallyObserved("Z1", "R_Z1"),
            Variable.observed("Z2")));
  }

  /** Y and R_Y share the parent Z3, so they cannot be separated given X alone. */
  public static AdjustmentProblem outcomeMissingness() {
    MGraph graph =
        MGraph.builder()
            .addVertices("X", "Y", "R_Y", "Z1", "Z2", "Z3")
            .addEdge("X", "Y")
            .addEdge("Z1", "X")
            .addEdge("Z1", "Y")
            .addEdge("Z2", "Z1")
            .addEdge("Z2", "Z3")
            .addEdge("Z3", "Y")
            .addEdge("Z3", "R_Y")
            .build();
    return new AdjustmentProblem(
        "outcome-missingness",
        graph,
        "X",
        "Y",
        List.of(
            Variable.observed("X"),
            Variable.partiallyObserved("Y", "R_Y"),
            Variable.observed("Z1"),
            Variable.observed("Z2"),
            Variable.observed("Z3")));
  }

  /** Effect of condom use on AIDS with missingness driven by observed covariates. */
  public static AdjustmentProblem aids() {
    MGraph.Builder builder = aidsBase();
    builder
        .addEdge("Partners", "R_Partners")
        .addEdge("Drug", "R_Drug")
        .addEdge("Condom", "R_Condom")
        .addEdge("Age", "R_Condom");
    return new AdjustmentProblem("aids", builder.build(), "Condom", "AIDS", aidsVariables());
  }

  /** Same causal structure as {@link #aids()} with every indicator isolated (MCAR). */
  public static AdjustmentProblem aidsMcar() {
    return new AdjustmentProblem(
        "aids-mcar", aidsBase().build(), "Condom", "AIDS", aidsVariables());
  }

  /**
   * No valid m-adjustment set although the effect is recoverable by inverse probability
   * weighting.
   */
  public static AdjustmentProblem ipwOnly() {
    MGraph graph =
        MGraph.builder()
            .addVertices("C", "R_C", "A", "R_A", "Y", "R_Y")
            .addEdge("C", "A")
            .addEdge("C", "Y")
            .addEdge("C", "R_Y")
            .addEdge("C", "R_A")
            .addEdge("A", "Y")
            .addEdge("A", "R_C")
            .addEdge("A", "R_Y")
            .addEdge("Y", "R_C")
            .addEdge("Y", "R_A")
            .build();
    return new AdjustmentProblem(
        "ipw-only",
        graph,
        "A",
        "Y",
        List.of(
            Variable.partiallyObserved("C", "R_C"),
            Variable.partiallyObserved("A", "R_A"),
            Variable.partiallyObserved("Y", "R_Y")));
  }

  /** Two mediators meeting in the collider C; only the empty set adjusts. */
  public static AdjustmentProblem collider() {
    MGraph graph =
        MGraph.builder()
            .addEdge("A", "M1")
            .addEdge("A", "M2")
            .addEdge("M1", "C")
            .addEdge("M2", "C")
            .build();
    return new AdjustmentProblem("collider", graph, "A", "C", observed("A", "M1", "M2", "C"));
  }

  private static MGraph.Builder aidsBase() {
    return MGraph.builder()
        .addVertices(
            "Age", "Partners", "Income", "Drug", "Condom", "AIDS", "R_Partners", "R_Drug",
            "R_Condom")
        .addEdge("Age", "Partners")
        .addEdge("Age", "Income")
        .addEdge("Age", "Drug")
        .addEdge("Age", "Condom")
        .addEdge("Partners", "AIDS")
        .addEdge("Income", "AIDS")
        .addEdge("Income", "Drug")
        .addEdge("Income", "Condom")
        .addEdge("Drug", "AIDS")
        .addEdge("Drug", "Condom")
        .addEdge("Condom", "AIDS");
  }

  private static List<Variable> aidsVariables() {
    return List.of(
        Variable.observed("Age"),
        Variable.partiallyObserved("Partners", "R_Partners"),
        Variable.observed("Income"),
        Variable.partiallyObserved("Drug", "R_Drug"),
        Variable.partiallyObserved("Condom", "R_Condom"),
        Variable.observed("AIDS"));
  }

  private static List<Variable> observed(String... names) {
    return Arrays.stream(names).map(Variable::observed).toList();
  }

  private static Map<String, Supplier<AdjustmentProblem>> buildCatalogue() {
    Map<String, Supplier<AdjustmentProblem>> catalogue = new LinkedHashMap<>();
    catalogue.put("proper-paths", Examples::properPaths);
    catalogue.put("four-paths", Examples::fourPaths);
    catalogue.put("two-adjustment-sets", Examples::twoAdjustmentSets);
    catalogue.put("collider-missingness", Examples::colliderMissingness);
    catalogue.put("outcome-missingness", Examples::outcomeMissingness);
    catalogue.put("aids", Examples::aids);
    catalogue.put("aids-mcar", Examples::aidsMcar);
    catalogue.put("ipw-only", Examples::ipwOnly);
    catalogue.put("collider", Examples::collider);
    return Collections.unmodifiableMap(catalogue);
  }
}
