package ca.gc.cra.harvest.application.ingest;

import ca.gc.cra.harvest.application.port.ClockPort;
import ca.gc.cra.harvest.application.port.MeasurementSink;
import ca.gc.cra.harvest.application.port.MetricsPort;
import ca.gc.cra.harvest.application.port.ProgressListener;
import ca.gc.cra.harvest.application.port.SampleStoreException;
import ca.gc.cra.harvest.application.port.SampleStorePort;
import ca.gc.cra.harvest.domain.sample.Measurement;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> {@link MeasurementSink} that persists every measurement at most once, committing in
 * batches.
 * <p><strong>Why:</strong> Committing per row is too slow for a backlog, while never committing risks losing a
 * long stretch of data; the {@link CommitPolicy} bounds both.</p>
 * <p><strong>Role:</strong> Application service between the tailer and the {@link SampleStorePort}.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Buffer accepted measurements and flush them when the policy says so.</li>
 *   <li>Track attempted, written and duplicate counts.</li>
 *   <li>Always perform a final flush on {@link #close()}.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> {@link #accept}, {@link #tick} and {@link #close} synchronize on the
 * instance so a shutdown hook may close while the poll loop is idle.</p>
 * <p><strong>Observability:</strong> Emits {@code ingest.rows.attempted}, {@code ingest.rows.written},
 * {@code ingest.rows.duplicate}, {@code ingest.flush.count} and {@code ingest.flush.latencyNanos}.</p>
 *
 * @since 0.1.0
 */
public final class IdempotentBatchIngester implements MeasurementSink, AutoCloseable {
  private static final Logger log = LoggerFactory.getLogger(IdempotentBatchIngester.class);

  private final SampleStorePort store;
  private final CommitPolicy policy;
  private final ClockPort clock;
  private final MetricsPort metrics;
  private final ProgressListener progress;
  private final List<Measurement> pending = new ArrayList<>();

  private IngestStats stats = IngestStats.EMPTY;
  private long accepted;
  private long lastFlushNanos;
  private boolean open;
  private boolean closed;

  /**
   * Creates an ingester; call {@link #open()} before accepting measurements.
   *
   * @param store durable store
   * @param policy commit thresholds
   * @param clock monotonic clock
   * @param metrics metrics sink
   * @param progress flush listener
   */
  public IdempotentBatchIngester(
      SampleStorePort store,
      CommitPolicy policy,
      ClockPort clock,
      MetricsPort metrics,
      ProgressListener progress) {
    this.store = Objects.requireNonNull(store, "store");
    this.policy = Objects.requireNonNull(policy, "policy");
    this.clock = Objects.requireNonNull(clock, "clock");
    this.metrics = Objects.requireNonNull(metrics, "metrics");
    this.progress = Objects.requireNonNull(progress, "progress");
  }

  /**
   * Prepares the store schema and starts the flush timer.
   *
   * @throws SampleStoreException if the store cannot be prepared
   */
  public synchronized void open() {
    if (closed) {
      throw new IllegalStateException("ingester already closed");
    }
    if (open) {
      return;
    }
    store.ensureSchema();
    lastFlushNanos = clock.nanoTime();
    open = true;
    log.debug("Ingester open (batchRows={}, batchInterval={})", policy.batchRows(), policy.batchInterval());
  }

  @Override
  public synchronized void accept(Measurement measurement) {
    Objects.requireNonNull(measurement, "measurement");
    requireOpen();
    pending.add(measurement);
    accepted++;
    progress.onMeasurement(measurement, accepted);
    flushIfDue();
  }

  /** Checks the time threshold once per poll cycle, so a quiet period still commits pending rows. */
  @Override
  public synchronized void tick() {
    if (!open || closed) {
      return;
    }
    flushIfDue();
  }

  /**
   * Commits all pending measurements now.
   *
   * @return rows written by this flush
   * @throws SampleStoreException if the batch cannot be committed; pending rows are kept
   */
  public synchronized int flush() {
    requireOpen();
    if (pending.isEmpty()) {
      lastFlushNanos = clock.nanoTime();
      return 0;
    }
    int batchSize = pending.size();
    long started = clock.nanoTime();
    int written = store.insertBatch(List.copyOf(pending));
    long finished = clock.nanoTime();
    pending.clear();
    lastFlushNanos = finished;
    stats = stats.plusBatch(batchSize, written);

    metrics.increment("ingest.flush.count");
    metrics.observe("ingest.flush.latencyNanos", finished - started);
    metrics.observe("ingest.rows.attempted", batchSize);
    metrics.observe("ingest.rows.written", written);
    metrics.observe("ingest.rows.duplicate", batchSize - written);
    log.debug("Committed batch: {} attempted, {} written", batchSize, written);
    progress.onFlush(written, stats);
    return written;
  }

  /**
   * Returns cumulative counters of committed batches.
   *
   * @return statistics snapshot
   */
  public synchronized IngestStats stats() {
    return stats;
  }

  /** Rows accepted but not yet committed. */
  public synchronized int pendingRows() {
    return pending.size();
  }

  /**
   * Performs the final flush and closes the store. Idempotent.
   *
   * @throws SampleStoreException if the final flush or the store close fails; a close failure after a flush
   *     failure is attached as suppressed
   */
  @Override
  public synchronized void close() {
    if (closed) {
      return;
    }
    closed = true;
    if (!open) {
      store.close();
      return;
    }
    SampleStoreException failure = null;
    try {
      flushPending();
    } catch (SampleStoreException ex) {
      failure = ex;
    }
    try {
      store.close();
    } catch (SampleStoreException ex) {
      if (failure == null) {
        failure = ex;
      } else {
        failure.addSuppressed(ex);
      }
    }
    open = false;
    if (failure != null) {
      throw failure;
    }
  }

  private void flushPending() {
    if (!pending.isEmpty()) {
      flush();
    }
  }

  private void flushIfDue() {
    if (policy.flushDue(pending.size(), clock.nanoTime() - lastFlushNanos)) {
      flush();
    }
  }

  private void requireOpen() {
    if (!open) {
      throw new IllegalStateException(closed ? "ingester already closed" : "ingester not open");
    }
  }
}
