package madjustment.cli;

import madjustment.criterion.CriterionOptions;

record CliOptions(
    String problemFile,
    String exampleName,
    String treatment,
    String outcome,
    boolean includeEmptySet,
    boolean diagnostics,
    boolean json,
    int maxVariables) {

  CliOptions {
    if (maxVariables < 1) {
      throw new IllegalArgumentException("--max-variables must be at least 1");
    }
  }

  boolean hasProblemFile() {
    return problemFile != null && !problemFile.isBlank();
  }

  boolean hasExample() {
    return exampleName != null && !exampleName.isBlank();
  }

  CriterionOptions criterionOptions() {
    return new CriterionOptions(includeEmptySet, diagnostics, maxVariables);
  }

  static Builder builder() {
    return new Builder();
  }

  static final class Builder {
    private String problemFile;
    private String exampleName;
    private String treatment;
    private String outcome;
    private boolean includeEmptySet = CriterionOptions.defaults().includeEmptySet();
    private boolean diagnostics;
    private boolean json;
    private int maxVariables = CriterionOptions.defaults().maxVariables();

    Builder problemFile(String problemFile) {
      this.problemFile = problemFile;
      return this;
    }

    Builder exampleName(String exampleName) {
      this.exampleName = exampleName;
      return this;
    }

    Builder treatment(String treatment) {
      this.treatment = treatment;
      return this;
    }

    Builder outcome(String outcome) {
      this.outcome = outcome;
      return this;
    }

    Builder includeEmptySet(boolean includeEmptySet) {
      this.includeEmptySet = includeEmptySet;
      return this;
    }

    Builder diagnostics(boolean diagnostics) {
      this.diagnostics = diagnostics;
      return this;
    }

    Builder json(boolean json) {
      this.json = json;
      return this;
    }

    Builder maxVariables(int maxVariables) {
      this.maxVariables = maxVariables;
      return this;
    }

    CliOptions build() {
      boolean hasFile = problemFile != null && !problemFile.isBlank();
      boolean hasExample = exampleName != null && !exampleName.isBlank();
      if (hasFile == hasExample) {
        throw new IllegalArgumentException("Provide exactly one of --file or --example");
      }
      return new CliOptions(
          problemFile,
          exampleName,
          treatment,
          outcome,
          includeEmptySet,
          diagnostics,
          json,
          maxVariables);
    }
  }
}
