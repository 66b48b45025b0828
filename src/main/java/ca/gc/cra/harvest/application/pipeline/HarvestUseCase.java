package ca.gc.cra.harvest.application.pipeline;

import ca.gc.cra.harvest.application.port.CancellationToken;
import ca.gc.cra.harvest.application.port.ExportPoller;
import ca.gc.cra.harvest.application.port.MeasurementSink;
import java.time.Duration;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

/**
 * <strong>What:</strong> The long-running poll loop shared by the {@code ingest} and {@code watch} commands.
 * <p><strong>Why:</strong> Both commands tail the same files; they differ only in the {@link MeasurementSink}.</p>
 * <p><strong>Role:</strong> Application use case; the only suspension point is the inter-poll wait.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Check cancellation before each cycle and before each wait.</li>
 *   <li>Run one {@link ExportPoller#pollOnce} per cycle, then {@link MeasurementSink#tick()}.</li>
 *   <li>Wait the poll interval, returning early on a stop request.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> {@link #run()} must be invoked from a single thread at most once.</p>
 * <p><strong>Observability:</strong> Sets MDC key {@code pipeline} for the duration of {@link #run()}.</p>
 *
 * @since 0.1.0
 */
public final class HarvestUseCase {
  private static final Logger log = LoggerFactory.getLogger(HarvestUseCase.class);
  private static final String MDC_PIPELINE = "pipeline";

  private final String pipeline;
  private final ExportPoller poller;
  private final MeasurementSink sink;
  private final CancellationToken cancellation;
  private final Duration interval;

  /**
   * Creates the loop.
   *
   * @param pipeline name placed in the MDC, e.g. {@code ingest}
   * @param poller file set to poll
   * @param sink receiver of measurements
   * @param cancellation stop request, also used for the inter-poll wait
   * @param interval wait between the end of one cycle and the start of the next
   */
  public HarvestUseCase(
      String pipeline,
      ExportPoller poller,
      MeasurementSink sink,
      CancellationToken cancellation,
      Duration interval) {
    this.pipeline = Objects.requireNonNull(pipeline, "pipeline");
    this.poller = Objects.requireNonNull(poller, "poller");
    this.sink = Objects.requireNonNull(sink, "sink");
    this.cancellation = Objects.requireNonNull(cancellation, "cancellation");
    this.interval = Objects.requireNonNull(interval, "interval");
    if (interval.isNegative()) {
      throw new IllegalArgumentException("interval must not be negative");
    }
  }

  /**
   * Polls until cancelled.
   *
   * @return totals of the run
   * @throws InterruptedException if the thread is interrupted while waiting between cycles
   */
  public RunSummary run() throws InterruptedException {
    MDC.put(MDC_PIPELINE, pipeline);
    long cycles = 0;
    long emitted = 0;
    try {
      log.info("Polling every {} ms", interval.toMillis());
      while (!cancellation.isCancelled()) {
        emitted += poller.pollOnce(sink, cancellation);
        sink.tick();
        cycles++;
        if (cancellation.isCancelled()) {
          break;
        }
        cancellation.awaitCancellation(interval);
      }
      log.info("Poll loop stopped after {} cycles ({} measurements)", cycles, emitted);
      return new RunSummary(cycles, emitted);
    } finally {
      MDC.remove(MDC_PIPELINE);
    }
  }

  /**
   * Totals of one {@link #run()}.
   *
   * @param cycles completed poll cycles
   * @param measurements measurements emitted to the sink
   */
  public record RunSummary(long cycles, long measurements) {}
}
