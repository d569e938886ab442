package madjustment.examples;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import madjustment.core.model.AdjustmentProblem;
import org.junit.jupiter.api.Test;

final class ExamplesTest {

  @Test
  void everyExampleIsWellFormed() {
    for (String name : Examples.names()) {
      AdjustmentProblem problem = Examples.byName(name);
      assertEquals(name, problem.name());
      assertTrue(problem.graph().contains(problem.treatment()), name);
      assertTrue(problem.graph().contains(problem.outcome()), name);
      assertTrue(problem.unknownVertices().isEmpty(), name + ": " + problem.unknownVertices());
    }
  }

  @Test
  void lookupIgnoresCase() {
    assertEquals("aids-mcar", Examples.byName(" AIDS-MCAR ").name());
  }

  @Test
  void unknownNameListsCatalogue() {
    IllegalArgumentException ex =
        assertThrows(IllegalArgumentException.class, () -> Examples.byName("nope"));
    assertTrue(ex.getMessage().contains("two-adjustment-sets"), ex.getMessage());
  }

  @Test
  void mcarIndicatorsAreIsolated() {
    AdjustmentProblem problem = Examples.aidsMcar();
    assertTrue(problem.graph().predecessors("R_Condom").isEmpty());
    assertTrue(Examples.aids().graph().hasEdge("Age", "R_Condom"));
  }
}
