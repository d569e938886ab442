package madjustment.cli;

import java.io.IOException;
import java.nio.file.Path;
import madjustment.core.model.AdjustmentProblem;
import madjustment.examples.Examples;
import madjustment.io.ProblemLoader;

/** Shared helpers for CLI argument parsing and problem loading. */
final class CliParsers {
  private CliParsers() {}

  static int parseInt(String raw, int defaultValue, String optionName) {
    if (raw == null || raw.isBlank()) {
      return defaultValue;
    }
    try {
      return Integer.parseInt(raw.trim());
    } catch (NumberFormatException ex) {
      throw new IllegalArgumentException("Invalid integer for " + optionName + ": " + raw);
    }
  }

  static AdjustmentProblem loadProblem(CliOptions options) throws IOException {
    AdjustmentProblem problem;
    if (options.hasExample()) {
      problem = Examples.byName(options.exampleName());
    } else if (options.hasProblemFile()) {
      problem = ProblemLoader.load(Path.of(options.problemFile()));
    } else {
      throw new IllegalStateException("Missing problem input.");
    }
    if (options.treatment() != null && !options.treatment().isBlank()) {
      problem = problem.withTreatment(options.treatment().trim());
    }
    if (options.outcome() != null && !options.outcome().isBlank()) {
      problem = problem.withOutcome(options.outcome().trim());
    }
    return problem;
  }
}
