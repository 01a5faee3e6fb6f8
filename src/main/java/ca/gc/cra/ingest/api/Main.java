package ca.gc.cra.ingest.api;

import ca.gc.cra.ingest.config.IngestMode;
import java.util.Locale;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Ingestion CLI dispatcher that routes to a mode.
 *
 * @since 0.1.0
 */
public final class Main {
  private static final Logger log = LoggerFactory.getLogger(Main.class);
  private static final String SUMMARY_USAGE = "usage: ingest <api|local|s3> [key=value...] [options]";
  private static final String HELP_TEXT = """
      Tabular ingestion

      Usage:
        ingest <mode> [key=value...] [options]

      Modes:
        api     Paginated JSON API (api --help for details)
        local   CSV files under a local directory
        s3      CSV objects under an S3 prefix

      Global flags:
        --help      Show this message
        --verbose   Enable DEBUG logging before dispatching
      """;

  private Main() {}

  /**
   * Entry point invoked by the JVM.
   *
   * @param args raw CLI arguments
   */
  public static void main(String[] args) {
    ExitCode exit = run(args);
    System.exit(exit.code());
  }

  /**
   * Dispatches a mode and returns its exit code without terminating the JVM.
   *
   * @param args dispatcher arguments; the first non-flag token is the mode
   * @return exit code reported by the mode
   */
  static ExitCode run(String[] args) {
    String[] safeArgs = args == null ? new String[0] : args;
    int modeIndex = -1;
    for (int i = 0; i < safeArgs.length; i++) {
      String arg = safeArgs[i] == null ? "" : safeArgs[i].trim();
      if (!arg.isEmpty() && !arg.startsWith("-") && !arg.contains("=")) {
        modeIndex = i;
        break;
      }
    }

    if (modeIndex < 0 || "help".equalsIgnoreCase(safeArgs[modeIndex].trim())) {
      CliInput input = CliInput.parse(safeArgs);
      if (input.help()) {
        CliPrinter.println(HELP_TEXT.stripTrailing());
        return ExitCode.SUCCESS;
      }
      log.error("Missing mode");
      CliPrinter.println(SUMMARY_USAGE);
      return ExitCode.INVALID_ARGS;
    }

    String command = safeArgs[modeIndex].trim().toLowerCase(Locale.ROOT);
    IngestMode mode;
    try {
      mode = IngestMode.fromString(command);
    } catch (IllegalArgumentException ex) {
      log.error("Unknown mode: {}", command);
      CliPrinter.println(SUMMARY_USAGE);
      return ExitCode.INVALID_ARGS;
    }

    String[] delegateArgs = new String[safeArgs.length - 1];
    System.arraycopy(safeArgs, 0, delegateArgs, 0, modeIndex);
    System.arraycopy(safeArgs, modeIndex + 1, delegateArgs, modeIndex, safeArgs.length - modeIndex - 1);
    log.debug("Dispatching {} with {} arguments", mode.key(), delegateArgs.length);
    return IngestCli.run(mode, delegateArgs);
  }
}
