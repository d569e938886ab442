package madjustment.criterion;

import madjustment.util.BitsetUtils;

/** Configuration for an M-adjustment search. */
public record CriterionOptions(
    boolean includeEmptySet, boolean recordRejections, int maxVariables) {

  public static final int DEFAULT_MAX_VARIABLES = 30;

  public static CriterionOptions defaults() {
    return new CriterionOptions(true, false, DEFAULT_MAX_VARIABLES);
  }

  public static CriterionOptions normalize(CriterionOptions options) {
    if (options == null) {
      return defaults();
    }
    int maxVariables =
        options.maxVariables() > 0
            ? Math.min(options.maxVariables(), BitsetUtils.MAX_MASK_WIDTH)
            : DEFAULT_MAX_VARIABLES;
    return new CriterionOptions(
        options.includeEmptySet(), options.recordRejections(), maxVariables);
  }

  public CriterionOptions withIncludeEmptySet(boolean value) {
    return new CriterionOptions(value, recordRejections, maxVariables);
  }

  public CriterionOptions withRecordRejections(boolean value) {
    return new CriterionOptions(includeEmptySet, value, maxVariables);
  }

  public CriterionOptions withMaxVariables(int value) {
    return new CriterionOptions(includeEmptySet, recordRejections, value);
  }
}
