package ca.gc.cra.harvest.api;

import ca.gc.cra.harvest.logging.LoggingConfigurator;
import java.util.Arrays;
import java.util.Locale;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Harvest CLI dispatcher that routes to subcommands.
 *
 * <p>Flags before the command name are global; everything after it, flags included, belongs to the
 * subcommand.</p>
 *
 * @since 0.1.0
 */
public final class Main {
  private static final Logger log = LoggerFactory.getLogger(Main.class);
  private static final String SUMMARY_USAGE = "usage: harvest <ingest|watch> [options]";
  private static final String HELP_TEXT = String.join("\n",
      "Harvest command dispatcher",
      "",
      "Usage:",
      "  harvest <command> [options]",
      "",
      "Commands:",
      "  ingest    Store new export rows in the SQLite sample database (ingest --help for details)",
      "  watch     Print new export rows to stdout (watch --help for details)",
      "",
      "Global flags:",
      "  --help    Show this message",
      "  --verbose Enable DEBUG logging before dispatching to subcommand");

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
   * Dispatches a subcommand and returns its exit code without terminating the JVM.
   *
   * @param args dispatcher arguments; the first token not starting with {@code -} is the command
   * @return exit code reported by the delegated CLI
   */
  static ExitCode run(String[] args) {
    String[] raw = args == null ? new String[0] : args;
    int commandIndex = 0;
    while (commandIndex < raw.length && raw[commandIndex] != null && raw[commandIndex].startsWith("-")) {
      commandIndex++;
    }
    CliInput global = CliInput.parse(Arrays.copyOfRange(raw, 0, commandIndex));
    if (global.help()) {
      CliPrinter.println(HELP_TEXT);
      return ExitCode.SUCCESS;
    }
    if (global.verbose()) {
      LoggingConfigurator.enableVerboseLogging();
      log.debug("Verbose logging enabled for dispatcher");
    }

    if (commandIndex >= raw.length || raw[commandIndex] == null || raw[commandIndex].isBlank()) {
      log.error("Missing command");
      CliPrinter.println(SUMMARY_USAGE);
      return ExitCode.INVALID_ARGS;
    }

    String command = raw[commandIndex].trim().toLowerCase(Locale.ROOT);
    String[] delegateArgs = Arrays.copyOfRange(raw, commandIndex + 1, raw.length);

    return switch (command) {
      case "ingest" -> IngestCli.run(delegateArgs);
      case "watch" -> WatchCli.run(delegateArgs);
      default -> {
        log.error("Unknown command: {}", command);
        CliPrinter.println(SUMMARY_USAGE);
        yield ExitCode.INVALID_ARGS;
      }
    };
  }
}
