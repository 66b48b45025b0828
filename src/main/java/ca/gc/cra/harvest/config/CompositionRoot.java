package ca.gc.cra.harvest.config;

import ca.gc.cra.harvest.application.ingest.IdempotentBatchIngester;
import ca.gc.cra.harvest.application.pipeline.HarvestUseCase;
import ca.gc.cra.harvest.application.port.CancellationToken;
import ca.gc.cra.harvest.application.port.ClockPort;
import ca.gc.cra.harvest.application.port.MeasurementSink;
import ca.gc.cra.harvest.application.port.MetricsPort;
import ca.gc.cra.harvest.application.port.ProgressListener;
import ca.gc.cra.harvest.domain.tail.ExportFileNames;
import ca.gc.cra.harvest.infrastructure.events.LoggingProgressListener;
import ca.gc.cra.harvest.infrastructure.metrics.OpenTelemetryMetricsAdapter;
import ca.gc.cra.harvest.infrastructure.persistence.JdbcSampleStore;
import ca.gc.cra.harvest.infrastructure.tail.ExportFileSet;
import ca.gc.cra.harvest.infrastructure.tail.IncrementalTailer;
import ca.gc.cra.harvest.infrastructure.time.SystemClockAdapter;
import java.nio.file.Path;
import java.util.Locale;
import java.util.Objects;

/**
 * <strong>What:</strong> Wires the harvest pipeline from a {@link HarvestConfig}.
 * <p><strong>Role:</strong> The only place where adapters are chosen and constructed; CLIs ask it for ready-made
 * components.</p>
 * <p><strong>Thread-safety:</strong> Not thread-safe; used once during startup.</p>
 *
 * @since 0.1.0
 */
public final class CompositionRoot {
  private final HarvestConfig config;
  private final MetricsPort metrics;
  private final ClockPort clock;

  /**
   * Creates a composition root with the system clock.
   *
   * @param config validated configuration
   * @param metrics metrics adapter shared by every component
   */
  public CompositionRoot(HarvestConfig config, MetricsPort metrics) {
    this(config, metrics, new SystemClockAdapter());
  }

  /**
   * Creates a composition root with an explicit clock.
   *
   * @param config validated configuration
   * @param metrics metrics adapter shared by every component
   * @param clock monotonic clock for commit timing
   */
  public CompositionRoot(HarvestConfig config, MetricsPort metrics, ClockPort clock) {
    this.config = Objects.requireNonNull(config, "config");
    this.metrics = Objects.requireNonNull(metrics, "metrics");
    this.clock = Objects.requireNonNull(clock, "clock");
  }

  /**
   * Chooses the metrics adapter from the {@code otel.metrics.exporter} system property set by the CLI.
   *
   * @return OpenTelemetry adapter when an exporter is enabled, otherwise {@link MetricsPort#NO_OP}
   */
  public static MetricsPort createMetrics() {
    String exporter = System.getProperty("otel.metrics.exporter", "none").trim().toLowerCase(Locale.ROOT);
    if (exporter.isEmpty() || exporter.equals("none")) {
      return MetricsPort.NO_OP;
    }
    return new OpenTelemetryMetricsAdapter();
  }

  /**
   * Builds the export file set for the configured directory and prefix.
   *
   * @return new file set with no tracked files
   */
  public ExportFileSet exportFileSet() {
    return new ExportFileSet(
        config.directory(),
        new ExportFileNames(config.filePrefix()),
        new IncrementalTailer(metrics),
        config.backfill(),
        metrics);
  }

  /**
   * Builds the SQLite-backed ingester. Creates the database directory when missing; the schema is created by
   * {@link IdempotentBatchIngester#open()}.
   *
   * @return unopened ingester
   */
  public IdempotentBatchIngester batchIngester() {
    Path db = config.prepareDatabase();
    JdbcSampleStore store = new JdbcSampleStore(db, config.commitMode(), config.insertStrategy());
    return new IdempotentBatchIngester(store, config.commitPolicy(), clock, metrics, progressListener());
  }

  /**
   * Returns the progress listener selected by the {@code progress} setting.
   *
   * @return logging listener or {@link ProgressListener#NO_OP}
   */
  public ProgressListener progressListener() {
    return config.progress() ? new LoggingProgressListener() : ProgressListener.NO_OP;
  }

  /**
   * Builds the poll loop.
   *
   * @param sink receiver of measurements
   * @param cancellation stop request
   * @return loop ready to {@link HarvestUseCase#run()}
   */
  public HarvestUseCase harvestUseCase(MeasurementSink sink, CancellationToken cancellation) {
    return new HarvestUseCase(
        config.mode().key(), exportFileSet(), sink, cancellation, config.pollInterval());
  }

  public HarvestConfig config() {
    return config;
  }

  public MetricsPort metrics() {
    return metrics;
  }
}
