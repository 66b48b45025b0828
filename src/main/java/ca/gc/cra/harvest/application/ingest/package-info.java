/**
 * Idempotent batched persistence of measurements.
 * <p>{@link ca.gc.cra.harvest.application.ingest.IdempotentBatchIngester} buffers rows and commits them through
 * {@link ca.gc.cra.harvest.application.port.SampleStorePort} according to a
 * {@link ca.gc.cra.harvest.application.ingest.CommitPolicy}.</p>
 */
package ca.gc.cra.harvest.application.ingest;
