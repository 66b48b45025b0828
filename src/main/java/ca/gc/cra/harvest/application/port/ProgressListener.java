package ca.gc.cra.harvest.application.port;

import ca.gc.cra.harvest.application.ingest.IngestStats;
import ca.gc.cra.harvest.domain.sample.Measurement;

/**
 * <strong>What:</strong> Receives ingest progress for each accepted row and each committed batch.
 * <p><strong>Why:</strong> The {@code --progress} flag reports running totals without coupling the ingester to
 * logging.</p>
 * <p><strong>Thread-safety:</strong> Invoked from whichever thread performed the flush.</p>
 *
 * @since 0.1.0
 */
public interface ProgressListener {
  /**
   * Called for every measurement handed to the ingester, before it is committed.
   *
   * @param measurement accepted measurement
   * @param accepted number of measurements accepted so far, including this one
   */
  default void onMeasurement(Measurement measurement, long accepted) {}

  /**
   * Called after a batch is committed.
   *
   * @param batchWritten rows written by this batch
   * @param totals cumulative statistics including this batch
   */
  void onFlush(int batchWritten, IngestStats totals);

  /** Listener that ignores progress. */
  ProgressListener NO_OP = new ProgressListener() {
    @Override public void onFlush(int batchWritten, IngestStats totals) {}
  };
}
