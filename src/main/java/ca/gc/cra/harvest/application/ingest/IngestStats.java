package ca.gc.cra.harvest.application.ingest;

/**
 * Cumulative ingest counters.
 *
 * @param attempted measurements handed to the store
 * @param written rows actually inserted
 * @param duplicates rows skipped because an identical {@code (timestamp, source, channel)} already existed
 * @param flushes committed batches, empty final flushes excluded
 * @since 0.1.0
 */
public record IngestStats(long attempted, long written, long duplicates, long flushes) {
  /** Counters before anything was ingested. */
  public static final IngestStats EMPTY = new IngestStats(0, 0, 0, 0);

  IngestStats plusBatch(int batchSize, int batchWritten) {
    return new IngestStats(
        attempted + batchSize,
        written + batchWritten,
        duplicates + (batchSize - batchWritten),
        flushes + 1);
  }
}
