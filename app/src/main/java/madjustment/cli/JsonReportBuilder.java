package madjustment.cli;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import madjustment.core.model.AdjustmentProblem;
import madjustment.core.model.CausalPath;
import madjustment.core.model.Edge;
import madjustment.core.model.Variable;
import madjustment.criterion.AdjustmentResult;
import madjustment.criterion.CandidateRejection;

final class JsonReportBuilder {
  private static final String VERSION = "1.0.0";
  private final Gson gson = new GsonBuilder().setPrettyPrinting().serializeNulls().create();

  String build(AdjustmentProblem problem, AdjustmentResult result) {
    Map<String, Object> root = new LinkedHashMap<>();
    root.put("meta", meta(problem, result));
    root.put("proper_causal_paths", paths(result.properCausalPaths()));
    root.put("exclusion_set", new ArrayList<>(result.exclusionSet()));
    root.put("valid_sets", result.validSets());
    root.put("best_set", result.bestSet());
    if (!result.rejections().isEmpty()) {
      root.put("rejections", rejections(result.rejections()));
    }
    return gson.toJson(root);
  }

  private Map<String, Object> meta(AdjustmentProblem problem, AdjustmentResult result) {
    Map<String, Object> meta = new LinkedHashMap<>();
    meta.put("version", VERSION);
    meta.put("problem", problem.name());
    meta.put("treatment", result.treatment());
    meta.put("outcome", result.outcome());
    meta.put("vertex_count", problem.graph().vertexCount());
    meta.put("edge_count", problem.graph().edgeCount());
    meta.put("variables", variables(problem.variables()));
    meta.put("candidates_examined", result.candidatesExamined());
    meta.put("time_ms", result.elapsedMillis());
    return meta;
  }

  private List<Map<String, Object>> variables(List<Variable> variables) {
    List<Map<String, Object>> list = new ArrayList<>();
    for (Variable variable : variables) {
      Map<String, Object> entry = new LinkedHashMap<>();
      entry.put("name", variable.name());
      entry.put("indicator", variable.indicator());
      list.add(entry);
    }
    return list;
  }

  private List<List<String>> paths(List<CausalPath> paths) {
    List<List<String>> list = new ArrayList<>();
    for (CausalPath path : paths) {
      List<String> edges = new ArrayList<>();
      for (Edge edge : path.edges()) {
        edges.add(edge.toString());
      }
      list.add(edges);
    }
    return list;
  }

  private List<Map<String, Object>> rejections(List<CandidateRejection> rejections) {
    List<Map<String, Object>> list = new ArrayList<>();
    for (CandidateRejection rejection : rejections) {
      Map<String, Object> entry = new LinkedHashMap<>();
      entry.put("candidate", rejection.candidate());
      entry.put(
          "missingness_indicators",
          rejection.missingnessIndicators().stream().sorted().toList());
      entry.put("failed", rejection.condition().name().toLowerCase(Locale.ROOT));
      list.add(entry);
    }
    return list;
  }
}
