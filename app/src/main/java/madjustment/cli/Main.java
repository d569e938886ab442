package madjustment.cli;

import java.io.IOException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Command-line entrypoint.
 *
 * <p>Usage:
 *
 * <ul>
 *   <li>{@code Main run --example two-adjustment-sets}
 *   <li>{@code Main run --file problem.json --json --diagnostics}
 * </ul>
 */
public final class Main {
  private static final Logger LOG = LoggerFactory.getLogger(Main.class);
  static final int EXIT_USAGE = 2;

  private Main() {}

  public static void main(String[] args) {
    System.exit(run(args));
  }

  static int run(String[] args) {
    try {
      return new RunCommand().execute(args);
    } catch (IllegalArgumentException | IllegalStateException ex) {
      LOG.error("{}", ex.getMessage());
      return EXIT_USAGE;
    } catch (IOException ex) {
      LOG.error("Failed to read input: {}", ex.getMessage(), ex);
      return EXIT_USAGE;
    }
  }
}
