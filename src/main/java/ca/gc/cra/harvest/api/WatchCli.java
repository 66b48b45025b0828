package ca.gc.cra.harvest.api;

import ca.gc.cra.harvest.application.pipeline.HarvestUseCase;
import ca.gc.cra.harvest.application.port.MeasurementSink;
import ca.gc.cra.harvest.application.port.MetricsPort;
import ca.gc.cra.harvest.config.CompositionRoot;
import ca.gc.cra.harvest.config.HarvestConfig;
import ca.gc.cra.harvest.config.HarvestMode;
import ca.gc.cra.harvest.infrastructure.exec.StopSignal;
import ca.gc.cra.harvest.logging.LoggingConfigurator;
import java.time.Duration;
import java.util.Map;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Entry point for the {@code watch} command: prints each new measurement as a tab-separated line.
 *
 * @since 0.1.0
 */
public final class WatchCli {
  private static final Logger log = LoggerFactory.getLogger(WatchCli.class);
  private static final Duration SHUTDOWN_GRACE = Duration.ofSeconds(5);
  private static final Set<String> FLAGS = Set.of("--backfill", "--dry-run");
  private static final Map<String, String> BOOLEAN_FLAGS = Map.of("--backfill", "backfill");
  private static final String SUMMARY_USAGE =
      "usage: watch [dir=PATH] [interval=SECONDS] [filePrefix=P] [config=YAML] [--backfill] [--dry-run] "
          + "[--verbose]";
  private static final String HELP_TEXT = String.join("\n",
      "Harvest watch",
      "",
      "Usage:",
      "  watch dir=./exports [options]",
      "",
      "Prints timestamp, source, channel, value and origin file, tab-separated, for each new measurement.",
      "",
      "Options:",
      "  dir=PATH          Directory holding export files (env BENCHVUE_DIR, default current directory)",
      "  interval=SECONDS  Wait between poll cycles (default 7.4)",
      "  filePrefix=P      Export file name prefix (default AutoExportTrace_)",
      "  config=PATH       YAML file with common/watch sections",
      "  --backfill        Print rows already present in newly found files",
      "  --dry-run         Print the resolved settings and exit",
      "  --verbose         Enable DEBUG logging",
      "  --help            Show this message");

  private WatchCli() {}

  /**
   * Entry point invoked by the JVM.
   *
   * @param args raw CLI arguments
   */
  public static void main(String[] args) {
    ExitCode exit = run(args);
    System.exit(exit.code());
  }

  static ExitCode run(String[] args) {
    return run(args, new StopSignal(), true);
  }

  static ExitCode run(String[] args, StopSignal stop, boolean installHook) {
    CliInput input = CliInput.parse(args);
    if (input.help()) {
      CliPrinter.println(HELP_TEXT);
      return ExitCode.SUCCESS;
    }
    if (input.verbose()) {
      LoggingConfigurator.enableVerboseLogging();
      log.debug("Verbose logging enabled for watch CLI");
    }

    HarvestCliSupport.Resolution resolution = HarvestCliSupport.resolve(
        HarvestMode.WATCH, input, FLAGS, BOOLEAN_FLAGS, SUMMARY_USAGE, log);
    if (!resolution.ok()) {
      return resolution.failure();
    }
    HarvestConfig config = resolution.config();
    if (input.hasFlag("--dry-run")) {
      HarvestCliSupport.printDryRunPlan(config);
      return ExitCode.SUCCESS;
    }

    CompositionRoot root = new CompositionRoot(config, MetricsPort.NO_OP);
    MeasurementSink printer = measurement -> CliPrinter.println(measurement.toTabSeparated());
    HarvestUseCase useCase = root.harvestUseCase(printer, stop);
    log.info("Watching: {}", config.directory());

    Thread hook = installHook ? stop.installShutdownHook("harvest-watch-shutdown", SHUTDOWN_GRACE) : null;
    try {
      HarvestUseCase.RunSummary summary = useCase.run();
      log.info("Watch stopped after {} measurements", summary.measurements());
      return ExitCode.SUCCESS;
    } catch (InterruptedException ex) {
      Thread.currentThread().interrupt();
      log.error("Watch loop interrupted; shutting down", ex);
      return ExitCode.INTERRUPTED;
    } catch (RuntimeException ex) {
      log.error("Unexpected runtime failure in watch loop", ex);
      return ExitCode.RUNTIME_FAILURE;
    } finally {
      stop.markFinished();
      if (hook != null) {
        StopSignal.removeShutdownHook(hook);
      }
    }
  }
}
