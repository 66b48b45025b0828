package ca.gc.cra.harvest.application.port;

import ca.gc.cra.harvest.domain.sample.Measurement;
import java.util.List;

/**
 * <strong>What:</strong> Durable, deduplicating store of measurements.
 * <p><strong>Why:</strong> Re-reading a file after a restart or a truncation must never produce duplicate rows.</p>
 * <p><strong>Role:</strong> Application port implemented by {@code JdbcSampleStore}.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Ensure the schema exists.</li>
 *   <li>Insert a batch atomically, skipping rows whose {@code (timestamp, source, channel)} already exists.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Not required; the ingester serializes all calls.</p>
 *
 * @since 0.1.0
 */
public interface SampleStorePort extends AutoCloseable {
  /**
   * Creates the samples table and its indexes when missing.
   *
   * @throws SampleStoreException if the store cannot be prepared
   */
  void ensureSchema();

  /**
   * Inserts the batch in one transaction.
   *
   * @param batch measurements to insert; may be empty
   * @return number of rows actually written (duplicates excluded)
   * @throws SampleStoreException if the transaction fails; nothing from
   *     the batch is committed in that case
   */
  int insertBatch(List<Measurement> batch);

  /**
   * Releases the underlying connection.
   */
  @Override
  void close();
}
