/**
 * Poll loop orchestrating the export file set and the measurement sink.
 * <p><strong>Concurrency:</strong> Single-threaded and cooperative; cancellation is sampled at loop boundaries.</p>
 * <p><strong>Metrics:</strong> None directly; the tailer and ingester emit {@code tail.*} and {@code ingest.*}.</p>
 */
package ca.gc.cra.harvest.application.pipeline;
