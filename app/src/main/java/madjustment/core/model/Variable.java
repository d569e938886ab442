package madjustment.core.model;

import java.util.Objects;
import java.util.Optional;

/**
 * A variable under consideration for adjustment, paired with the vertex of its missingness
 * indicator. Fully observed variables carry no indicator.
 */
public record Variable(String name, String indicator) {

  public Variable {
    Objects.requireNonNull(name, "name");
    if (indicator != null && indicator.isBlank()) {
      indicator = null;
    }
  }

  public static Variable observed(String name) {
    return new Variable(name, null);
  }

  public static Variable partiallyObserved(String name, String indicator) {
    return new Variable(name, Objects.requireNonNull(indicator, "indicator"));
  }

  public boolean isPartiallyObserved() {
    return indicator != null;
  }

  public Optional<String> missingnessIndicator() {
    return Optional.ofNullable(indicator);
  }

  @Override
  public String toString() {
    return indicator == null ? name : name + "[" + indicator + "]";
  }
}
