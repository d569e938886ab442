package madjustment.criterion;

import com.google.common.base.Stopwatch;
import java.util.ArrayList;
import java.util.BitSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.TimeUnit;
import madjustment.core.model.AdjustmentProblem;
import madjustment.core.model.CausalPath;
import madjustment.core.model.Edge;
import madjustment.core.model.MGraph;
import madjustment.core.model.Variable;
import madjustment.graph.AncestryQueries;
import madjustment.graph.GraphTransforms;
import madjustment.graph.PathFinder;
import madjustment.separation.DSeparationOracle;
import madjustment.separation.TetradDSeparation;
import madjustment.util.BitsetUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Lists every adjustment set satisfying the M-adjustment criterion of Saadati and Tian, and picks
 * the smallest one.
 *
 * <p>Candidates are the subsets of the variable list, enumerated by counting a mask upward and
 * reading it as a zero-padded binary string whose leftmost digit selects the first variable. Each
 * candidate Z, together with the missingness indicators R_W of the treatment, the outcome and the
 * partially observed members of Z, must satisfy:
 *
 * <ol>
 *   <li>no member of Z is on, or descends from a vertex on, a proper causal path;
 *   <li>X and Y are d-separated by Z and R_W in the proper backdoor graph;
 *   <li>Y and R_W are d-separated by X once the edges into X are removed;
 *   <li>if X is an ancestor of R_W, X and Y are d-separated once the edges out of X are removed.
 * </ol>
 *
 * <p>The search is exhaustive and exponential in the number of variables. The input graph must be
 * acyclic and the variable list free of duplicates; neither is re-validated here.
 */
public final class CriterionEvaluator {
  private static final Logger LOG = LoggerFactory.getLogger(CriterionEvaluator.class);

  private final DSeparationOracle oracle;
  private final CriterionOptions options;

  public CriterionEvaluator(DSeparationOracle oracle, CriterionOptions options) {
    this.oracle = Objects.requireNonNull(oracle, "oracle");
    this.options = CriterionOptions.normalize(options);
  }

  public CriterionEvaluator(DSeparationOracle oracle) {
    this(oracle, CriterionOptions.defaults());
  }

  public CriterionEvaluator() {
    this(new TetradDSeparation(), CriterionOptions.defaults());
  }

  public AdjustmentResult evaluate(AdjustmentProblem problem) {
    Objects.requireNonNull(problem, "problem");
    return evaluate(problem.graph(), problem.treatment(), problem.outcome(), problem.variables());
  }

  public AdjustmentResult evaluate(
      MGraph graph, String treatment, String outcome, List<Variable> variables) {
    Objects.requireNonNull(graph, "graph");
    Objects.requireNonNull(variables, "variables");
    if (variables.size() > options.maxVariables()) {
      throw new IllegalArgumentException(
          "Too many variables for exhaustive search: "
              + variables.size()
              + " (limit "
              + options.maxVariables()
              + ")");
    }
    Stopwatch stopwatch = Stopwatch.createStarted();

    List<CausalPath> paths = PathFinder.properCausalPaths(graph, treatment, outcome);
    Set<String> exclusion = exclusionSet(graph, treatment, outcome, paths);
    LOG.debug("Proper causal paths {} -> {}: {}", treatment, outcome, paths);
    LOG.debug("Exclusion set: {}", exclusion);

    SearchContext context =
        new SearchContext(
            graph,
            GraphTransforms.properBackdoorGraph(graph, paths),
            GraphTransforms.aboveCut(graph, treatment),
            GraphTransforms.belowCut(graph, treatment),
            treatment,
            outcome,
            exclusion);

    int size = variables.size();
    long maskCount = BitsetUtils.maskCount(size);
    long firstMask = options.includeEmptySet() ? 0L : 1L;

    List<List<String>> validSets = new ArrayList<>();
    List<String> bestSet = null;
    List<CandidateRejection> rejections = new ArrayList<>();
    long examined = 0;

    for (long mask = firstMask; mask < maskCount; mask++) {
      examined++;
      BitSet selected = BitsetUtils.fromMaskMostSignificantFirst(mask, size);
      List<String> candidate = candidate(variables, selected);
      Set<String> indicators = missingnessIndicators(variables, selected, treatment, outcome);

      CriterionCondition failed = firstFailedCondition(context, candidate, indicators);
      if (failed != null) {
        if (LOG.isDebugEnabled()) {
          LOG.debug(
              "Rejected {} {} (R_W={}): {}",
              BitsetUtils.signature(selected, size),
              candidate,
              indicators,
              failed);
        }
        if (options.recordRejections()) {
          rejections.add(new CandidateRejection(candidate, indicators, failed));
        }
        continue;
      }

      validSets.add(candidate);
      if (bestSet == null || candidate.size() < bestSet.size()) {
        bestSet = candidate;
      }
    }

    long elapsed = stopwatch.elapsed(TimeUnit.MILLISECONDS);
    LOG.info(
        "M-adjustment {} -> {}: {} candidate(s), {} valid, best={} ({} ms)",
        treatment,
        outcome,
        examined,
        validSets.size(),
        bestSet,
        elapsed);
    return new AdjustmentResult(
        treatment,
        outcome,
        paths,
        exclusion,
        validSets,
        bestSet,
        examined,
        rejections,
        elapsed);
  }

  private CriterionCondition firstFailedCondition(
      SearchContext context, List<String> candidate, Set<String> indicators) {
    for (String vertex : candidate) {
      if (context.exclusion().contains(vertex)) {
        return CriterionCondition.EXCLUSION;
      }
    }

    Set<String> conditioning = new LinkedHashSet<>(candidate);
    conditioning.addAll(indicators);
    if (!oracle.isSeparated(
        context.backdoorGraph(), context.outcomeSet(), context.treatmentSet(), conditioning)) {
      return CriterionCondition.BACKDOOR_SEPARATION;
    }

    if (!oracle.isSeparated(
        context.aboveCut(), context.outcomeSet(), indicators, context.treatmentSet())) {
      return CriterionCondition.OUTCOME_MISSINGNESS_SEPARATION;
    }

    if (AncestryQueries.isAncestor(context.graph(), context.treatment(), indicators)
        && !oracle.isSeparated(
            context.belowCut(), context.treatmentSet(), context.outcomeSet(), Set.of())) {
      return CriterionCondition.TREATMENT_OUTCOME_SEPARATION;
    }
    return null;
  }

  /**
   * Union of the descendants of the treatment, the outcome and every vertex on a proper causal
   * path, each vertex counting as its own descendant.
   */
  public static Set<String> exclusionSet(
      MGraph graph, String treatment, String outcome, List<CausalPath> paths) {
    Set<String> roots = new LinkedHashSet<>();
    roots.add(treatment);
    roots.add(outcome);
    for (CausalPath path : paths) {
      for (Edge edge : path.edges()) {
        roots.add(edge.source());
        roots.add(edge.target());
      }
    }
    Set<String> exclusion = new LinkedHashSet<>();
    for (String root : roots) {
      if (!exclusion.contains(root)) {
        exclusion.addAll(AncestryQueries.descendantsOf(graph, root));
      }
    }
    return exclusion;
  }

  private static List<String> candidate(List<Variable> variables, BitSet selected) {
    List<String> candidate = new ArrayList<>(selected.cardinality());
    for (int i = selected.nextSetBit(0); i >= 0; i = selected.nextSetBit(i + 1)) {
      candidate.add(variables.get(i).name());
    }
    return candidate;
  }

  /**
   * R_W: indicators of the treatment and outcome (whether selected or not) and of every other
   * selected variable that is partially observed, in variable-list order.
   */
  static Set<String> missingnessIndicators(
      List<Variable> variables, BitSet selected, String treatment, String outcome) {
    Set<String> indicators = new LinkedHashSet<>();
    for (int i = 0; i < variables.size(); i++) {
      Variable variable = variables.get(i);
      if (!variable.isPartiallyObserved()) {
        continue;
      }
      boolean endpoint = variable.name().equals(treatment) || variable.name().equals(outcome);
      if (endpoint || selected.get(i)) {
        indicators.add(variable.indicator());
      }
    }
    return indicators;
  }

  /** Per-evaluation state shared by every candidate. */
  private record SearchContext(
      MGraph graph,
      MGraph backdoorGraph,
      MGraph aboveCut,
      MGraph belowCut,
      String treatment,
      String outcome,
      Set<String> exclusion) {

    Set<String> treatmentSet() {
      return Set.of(treatment);
    }

    Set<String> outcomeSet() {
      return Set.of(outcome);
    }
  }
}
