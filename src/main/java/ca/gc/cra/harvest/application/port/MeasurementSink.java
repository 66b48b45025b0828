package ca.gc.cra.harvest.application.port;

import ca.gc.cra.harvest.domain.sample.Measurement;

/**
 * <strong>What:</strong> Consumer of measurements emitted by the tailer.
 * <p><strong>Why:</strong> Decouples tailing from what happens to rows: the {@code watch} command prints them, the
 * {@code ingest} command batches them into the sample store.</p>
 * <p><strong>Role:</strong> Application port; {@code IdempotentBatchIngester} is the persistent implementation.</p>
 * <p><strong>Thread-safety:</strong> Called from the polling thread only.</p>
 *
 * @since 0.1.0
 */
@FunctionalInterface
public interface MeasurementSink {
  /**
   * Accepts one measurement.
   *
   * @param measurement measurement in file order; never {@code null}
   */
  void accept(Measurement measurement);

  /**
   * Invoked once per poll cycle after all files were read. Sinks that batch may flush here.
   */
  default void tick() {}

  /** Sink that discards every measurement. */
  MeasurementSink DISCARD = measurement -> {};
}
