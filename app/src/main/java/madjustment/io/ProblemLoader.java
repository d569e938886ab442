package madjustment.io;

import com.google.common.base.Splitter;
import com.google.gson.JsonArray;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.google.gson.JsonParseException;
import com.google.gson.JsonParser;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import madjustment.core.model.AdjustmentProblem;
import madjustment.core.model.Edge;
import madjustment.core.model.MGraph;
import madjustment.core.model.Variable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Reads an {@link AdjustmentProblem} from JSON.
 *
 * <pre>{@code
 * {
 *   "name": "example",
 *   "treatment": "X",
 *   "outcome": "Y",
 *   "vertices": ["X", "Y", "Z1", "R_Z1"],
 *   "edges": [["Z1", "X"], "Z1 -> Y", "X -> Y"],
 *   "variables": ["X", "Y", {"name": "Z1", "indicator": "R_Z1"}]
 * }
 * }</pre>
 *
 * <p>{@code vertices} is optional since edge endpoints are added automatically; it is needed only
 * for isolated vertices such as indicators of data missing completely at random.
 */
public final class ProblemLoader {
  private static final Logger LOG = LoggerFactory.getLogger(ProblemLoader.class);
  private static final Splitter ARROW = Splitter.on("->").trimResults();

  private ProblemLoader() {}

  public static AdjustmentProblem load(Path file) throws IOException {
    Objects.requireNonNull(file, "file");
    if (!Files.isRegularFile(file)) {
      throw new IllegalArgumentException("Problem file not found: " + file);
    }
    String content = Files.readString(file, StandardCharsets.UTF_8);
    AdjustmentProblem problem = parse(content, file.toString());
    LOG.debug(
        "Loaded {} from {}: {} vertices, {} edges, {} variables",
        problem.name(),
        file,
        problem.graph().vertexCount(),
        problem.graph().edgeCount(),
        problem.variables().size());
    return problem;
  }

  public static AdjustmentProblem parse(String json, String origin) {
    JsonElement parsed;
    try {
      parsed = JsonParser.parseString(json);
    } catch (JsonParseException ex) {
      throw new IllegalArgumentException(
          "Malformed JSON in " + origin + ": " + ex.getMessage(), ex);
    }
    if (!parsed.isJsonObject()) {
      throw new IllegalArgumentException("Expected JSON object in " + origin);
    }
    JsonObject root = parsed.getAsJsonObject();

    MGraph.Builder builder = MGraph.builder();
    for (JsonElement vertex : optionalArray(root, "vertices", origin)) {
      builder.addVertex(asString(vertex, "vertices", origin));
    }
    for (JsonElement edge : requiredArray(root, "edges", origin)) {
      builder.addEdge(readEdge(edge, origin));
    }

    List<Variable> variables = new ArrayList<>();
    for (JsonElement element : requiredArray(root, "variables", origin)) {
      variables.add(readVariable(element, origin));
    }
    for (Variable variable : variables) {
      builder.addVertex(variable.name());
      variable.missingnessIndicator().ifPresent(builder::addVertex);
    }

    String name = root.has("name") ? asString(root.get("name"), "name", origin) : null;
    String treatment = readRequiredString(root, "treatment", origin);
    String outcome = readRequiredString(root, "outcome", origin);
    return new AdjustmentProblem(name, builder.build(), treatment, outcome, variables);
  }

  private static Edge readEdge(JsonElement element, String origin) {
    if (element.isJsonArray()) {
      JsonArray pair = element.getAsJsonArray();
      if (pair.size() != 2) {
        throw new IllegalArgumentException(
            "Edge must have two endpoints in " + origin + ": " + pair);
      }
      return new Edge(
          asString(pair.get(0), "edges", origin), asString(pair.get(1), "edges", origin));
    }
    String raw = asString(element, "edges", origin);
    List<String> parts = ARROW.splitToList(raw);
    if (parts.size() != 2 || parts.get(0).isEmpty() || parts.get(1).isEmpty()) {
      throw new IllegalArgumentException("Invalid edge in " + origin + ": " + raw);
    }
    return new Edge(parts.get(0), parts.get(1));
  }

  private static Variable readVariable(JsonElement element, String origin) {
    if (element.isJsonPrimitive()) {
      return Variable.observed(asString(element, "variables", origin));
    }
    if (!element.isJsonObject()) {
      throw new IllegalArgumentException("Invalid variable in " + origin + ": " + element);
    }
    JsonObject obj = element.getAsJsonObject();
    String name = readRequiredString(obj, "name", origin);
    JsonElement indicator = obj.get("indicator");
    if (indicator == null || indicator.isJsonNull()) {
      return Variable.observed(name);
    }
    return new Variable(name, asString(indicator, "indicator", origin));
  }

  private static Iterable<JsonElement> requiredArray(JsonObject obj, String key, String origin) {
    JsonElement element = obj.get(key);
    if (element == null || !element.isJsonArray()) {
      throw new IllegalArgumentException("Missing array '" + key + "' in " + origin);
    }
    return element.getAsJsonArray();
  }

  private static Iterable<JsonElement> optionalArray(JsonObject obj, String key, String origin) {
    JsonElement element = obj.get(key);
    if (element == null || element.isJsonNull()) {
      return Set.of();
    }
    if (!element.isJsonArray()) {
      throw new IllegalArgumentException("Field '" + key + "' must be an array in " + origin);
    }
    return element.getAsJsonArray();
  }

  private static String readRequiredString(JsonObject obj, String key, String origin) {
    JsonElement element = obj.get(key);
    if (element == null || element.isJsonNull()) {
      throw new IllegalArgumentException("Missing '" + key + "' in " + origin);
    }
    return asString(element, key, origin);
  }

  private static String asString(JsonElement element, String key, String origin) {
    if (!element.isJsonPrimitive() || !element.getAsJsonPrimitive().isString()) {
      throw new IllegalArgumentException(
          "Expected string for '" + key + "' in " + origin + ": " + element);
    }
    String value = element.getAsString().trim();
    if (value.isEmpty()) {
      throw new IllegalArgumentException("Blank value for '" + key + "' in " + origin);
    }
    return value;
  }
}
