package ca.gc.cra.harvest.api;

import ca.gc.cra.harvest.application.ingest.IdempotentBatchIngester;
import ca.gc.cra.harvest.application.ingest.IngestStats;
import ca.gc.cra.harvest.application.pipeline.HarvestUseCase;
import ca.gc.cra.harvest.application.port.MetricsPort;
import ca.gc.cra.harvest.application.port.SampleStoreException;
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
 * Entry point for the {@code ingest} command: tails export files into the SQLite sample store until stopped.
 *
 * @since 0.1.0
 */
public final class IngestCli {
  private static final Logger log = LoggerFactory.getLogger(IngestCli.class);
  private static final Duration SHUTDOWN_GRACE = Duration.ofSeconds(30);
  private static final Set<String> FLAGS = Set.of("--backfill", "--progress", "--dry-run");
  private static final Map<String, String> BOOLEAN_FLAGS = Map.of("--backfill", "backfill", "--progress", "progress");
  private static final String SUMMARY_USAGE =
      "usage: ingest [dir=PATH] [db=PATH] [interval=SECONDS] [commitMode=standard|balanced|aggressive] "
          + "[batchRows=N] [batchSeconds=S] [insertStrategy=auto|conditional] [filePrefix=P] [config=YAML] "
          + "[metricsExporter=otlp|none] [otelEndpoint=URL] [--backfill] [--progress] [--dry-run] [--verbose]";
  private static final String HELP_TEXT = String.join("\n",
      "Harvest ingest",
      "",
      "Usage:",
      "  ingest dir=./exports db=./benchvue.sqlite3 [options]",
      "",
      "Options:",
      "  dir=PATH                 Directory holding export files (env BENCHVUE_DIR, default current directory)",
      "  db=PATH                  SQLite database file (env BENCHVUE_DB, default ./benchvue.sqlite3)",
      "  interval=SECONDS         Wait between poll cycles (default 1.0)",
      "  commitMode=MODE          standard (250 rows/2 s), balanced (5000/10 s), aggressive (50000/30 s)",
      "  batchRows=N              Override the commit row threshold",
      "  batchSeconds=S           Override the commit time threshold",
      "  insertStrategy=STRATEGY  auto (unique index, falls back) or conditional (existence check)",
      "  filePrefix=P             Export file name prefix (default AutoExportTrace_)",
      "  config=PATH              YAML file with common/ingest sections",
      "  metricsExporter=otlp|none  Metrics exporter (default none)",
      "  otelEndpoint=URL         OTLP metrics endpoint when exporter=otlp",
      "  --backfill               Ingest rows already present in newly found files",
      "  --progress               Log every accepted measurement",
      "  --dry-run                Print the resolved settings and exit",
      "  --verbose                Enable DEBUG logging",
      "  --help                   Show this message");

  private IngestCli() {}

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
   * Runs the command with a JVM shutdown hook as the stop trigger.
   *
   * @param args raw CLI arguments
   * @return exit code capturing the outcome
   */
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
      log.debug("Verbose logging enabled for ingest CLI");
    }

    HarvestCliSupport.Resolution resolution = HarvestCliSupport.resolve(
        HarvestMode.INGEST, input, FLAGS, BOOLEAN_FLAGS, SUMMARY_USAGE, log);
    if (!resolution.ok()) {
      return resolution.failure();
    }
    HarvestConfig config = resolution.config();
    if (input.hasFlag("--dry-run")) {
      HarvestCliSupport.printDryRunPlan(config);
      return ExitCode.SUCCESS;
    }

    MetricsPort metrics = CompositionRoot.createMetrics();
    try {
      return ingest(new CompositionRoot(config, metrics), stop, installHook);
    } finally {
      closeMetrics(metrics);
    }
  }

  private static ExitCode ingest(CompositionRoot root, StopSignal stop, boolean installHook) {
    HarvestConfig config = root.config();
    IdempotentBatchIngester ingester;
    try {
      ingester = root.batchIngester();
    } catch (IllegalArgumentException ex) {
      log.error("Unusable database location: {}", ex.getMessage());
      return ExitCode.CONFIG_ERROR;
    }

    log.info("Watching: {}", config.directory());
    log.info("Database: {}", config.database().orElseThrow());
    if (config.backfill()) {
      log.info("Backfill: enabled");
    }

    Thread hook = installHook ? stop.installShutdownHook("harvest-ingest-shutdown", SHUTDOWN_GRACE) : null;
    ExitCode exit;
    try {
      ingester.open();
      HarvestUseCase useCase = root.harvestUseCase(ingester, stop);
      useCase.run();
      exit = ExitCode.SUCCESS;
    } catch (SampleStoreException ex) {
      log.error("Sample store failure; stopping", ex);
      exit = ExitCode.IO_ERROR;
    } catch (InterruptedException ex) {
      Thread.currentThread().interrupt();
      log.error("Ingest loop interrupted; shutting down", ex);
      exit = ExitCode.INTERRUPTED;
    } catch (RuntimeException ex) {
      log.error("Unexpected runtime failure in ingest loop", ex);
      exit = ExitCode.RUNTIME_FAILURE;
    }

    try {
      ingester.close();
    } catch (SampleStoreException ex) {
      log.error("Final flush failed; buffered rows were not stored", ex);
      if (exit == ExitCode.SUCCESS) {
        exit = ExitCode.IO_ERROR;
      }
    } finally {
      IngestStats stats = ingester.stats();
      log.info("Inserted rows: {} (attempted={}, duplicates={})",
          stats.written(), stats.attempted(), stats.duplicates());
      stop.markFinished();
      if (hook != null) {
        StopSignal.removeShutdownHook(hook);
      }
    }
    return exit;
  }

  private static void closeMetrics(MetricsPort metrics) {
    if (metrics instanceof AutoCloseable closeable) {
      try {
        closeable.close();
      } catch (Exception ex) {
        log.warn("Failed to close metrics exporter", ex);
      }
    }
  }
}
