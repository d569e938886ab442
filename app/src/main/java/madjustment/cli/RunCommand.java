package madjustment.cli;

import java.io.IOException;
import java.io.PrintStream;
import java.util.Arrays;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.function.BiConsumer;
import java.util.function.Consumer;
import madjustment.core.model.AdjustmentProblem;
import madjustment.criterion.AdjustmentResult;
import madjustment.criterion.CandidateRejection;
import madjustment.criterion.CriterionCondition;
import madjustment.criterion.CriterionEvaluator;
import madjustment.separation.TetradDSeparation;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** Handles the primary `run` command: one M-adjustment search on an example or a problem file. */
final class RunCommand {
  private static final Logger LOG = LoggerFactory.getLogger(RunCommand.class);

  private final PrintStream out;

  RunCommand(PrintStream out) {
    this.out = out;
  }

  RunCommand() {
    this(System.out);
  }

  int execute(String[] args) throws IOException {
    CliOptions options = parseArgs(args);
    AdjustmentProblem problem = CliParsers.loadProblem(options);
    if (!problem.unknownVertices().isEmpty()) {
      LOG.warn("Variables missing from the graph: {}", problem.unknownVertices());
    }

    CriterionEvaluator evaluator =
        new CriterionEvaluator(new TetradDSeparation(), options.criterionOptions());
    AdjustmentResult result = evaluator.evaluate(problem);

    logSummary(problem, result);
    if (options.json()) {
      out.println(new JsonReportBuilder().build(problem, result));
    }
    return 0;
  }

  CliOptions parseArgs(String[] args) {
    String[] effectiveArgs = stripCommand(args);
    CliOptions.Builder builder = CliOptions.builder();
    Map<String, OptionSpec> specs = optionSpecs();

    for (int i = 0; i < effectiveArgs.length; i++) {
      ParsedArg parsed = ParsedArg.parse(effectiveArgs[i]);
      OptionSpec spec = specs.get(parsed.option());
      if (spec == null) {
        throw new IllegalArgumentException("Unknown option: " + effectiveArgs[i]);
      }

      String value = parsed.value();
      if (spec.requiresValue()) {
        if (value == null || value.isBlank()) {
          if (i + 1 >= effectiveArgs.length) {
            throw new IllegalArgumentException("Missing value for " + parsed.option());
          }
          value = effectiveArgs[++i];
        }
      }
      spec.apply(builder, value);
    }

    return builder.build();
  }

  private Map<String, OptionSpec> optionSpecs() {
    Map<String, OptionSpec> specs = new LinkedHashMap<>();
    specs.put("--file", OptionSpec.withValue((b, raw) -> b.problemFile(raw)));
    specs.put("--example", OptionSpec.withValue((b, raw) -> b.exampleName(raw)));
    specs.put("--treatment", OptionSpec.withValue((b, raw) -> b.treatment(raw)));
    specs.put("--outcome", OptionSpec.withValue((b, raw) -> b.outcome(raw)));
    specs.put("--non-empty", OptionSpec.flag(b -> b.includeEmptySet(false)));
    specs.put("--diagnostics", OptionSpec.flag(b -> b.diagnostics(true)));
    specs.put("--json", OptionSpec.flag(b -> b.json(true)));
    specs.put(
        "--max-variables",
        OptionSpec.withValue(
            (b, raw) -> b.maxVariables(CliParsers.parseInt(raw, 0, "--max-variables"))));
    return specs;
  }

  private String[] stripCommand(String[] args) {
    if (args == null || args.length == 0) {
      return new String[0];
    }
    if ("run".equalsIgnoreCase(args[0])) {
      return Arrays.copyOfRange(args, 1, args.length);
    }
    return args;
  }

  private void logSummary(AdjustmentProblem problem, AdjustmentResult result) {
    LOG.info(
        "Problem {}: treatment={} outcome={} ({} vertices, {} edges)",
        problem.name(),
        result.treatment(),
        result.outcome(),
        problem.graph().vertexCount(),
        problem.graph().edgeCount());
    LOG.info("Proper causal paths: {}", result.properCausalPaths().size());
    result.properCausalPaths().forEach(path -> LOG.info("  {}", path));
    LOG.info("Excluded vertices: {}", result.exclusionSet());
    LOG.info("Valid adjustment sets: {}", result.validSets().size());
    for (int i = 0; i < result.validSets().size(); i++) {
      LOG.info("  #{}: {}", i + 1, result.validSets().get(i));
    }
    if (result.hasValidSet()) {
      LOG.info("Best adjustment set: {}", result.bestSet());
    } else {
      LOG.info("No valid adjustment set.");
    }

    if (!result.rejections().isEmpty()) {
      Map<CriterionCondition, Integer> counts = new EnumMap<>(CriterionCondition.class);
      for (CandidateRejection rejection : result.rejections()) {
        counts.merge(rejection.condition(), 1, Integer::sum);
      }
      counts.forEach((condition, count) -> LOG.info("Rejected by {}: {}", condition, count));
    }
  }

  private record ParsedArg(String option, String value) {
    static ParsedArg parse(String raw) {
      if (raw == null || raw.isBlank()) {
        throw new IllegalArgumentException("Unknown option: " + raw);
      }
      if (raw.startsWith("--")) {
        int equalsIndex = raw.indexOf('=');
        if (equalsIndex > 0) {
          String option = raw.substring(0, equalsIndex);
          String value = raw.substring(equalsIndex + 1);
          return new ParsedArg(option, value.isEmpty() ? null : value);
        }
      }
      return new ParsedArg(raw, null);
    }
  }

  private record OptionSpec(boolean requiresValue, BiConsumer<CliOptions.Builder, String> apply) {
    static OptionSpec withValue(BiConsumer<CliOptions.Builder, String> consumer) {
      return new OptionSpec(true, consumer);
    }

    static OptionSpec flag(Consumer<CliOptions.Builder> consumer) {
      return new OptionSpec(false, (builder, ignored) -> consumer.accept(builder));
    }

    void apply(CliOptions.Builder builder, String value) {
      apply.accept(builder, value);
    }
  }
}
