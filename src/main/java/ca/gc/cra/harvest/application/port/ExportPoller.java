package ca.gc.cra.harvest.application.port;

/**
 * One discovery-and-tail pass over the watched export files.
 *
 * @since 0.1.0
 * @see ca.gc.cra.harvest.infrastructure.tail.ExportFileSet
 */
@FunctionalInterface
public interface ExportPoller {
  /**
   * Runs one poll cycle.
   *
   * @param sink receiver of measurements, in per-file row order
   * @param cancellation checked between files
   * @return number of measurements emitted
   */
  int pollOnce(MeasurementSink sink, CancellationToken cancellation);
}
