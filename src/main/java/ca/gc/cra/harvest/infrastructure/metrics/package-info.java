/**
 * OpenTelemetry bridge for {@link ca.gc.cra.harvest.application.port.MetricsPort}.
 * <p><strong>Concurrency:</strong> Instruments are cached in concurrent maps; safe for concurrent updates.</p>
 * <p><strong>Metrics:</strong> Publishes the {@code tail.*} and {@code ingest.*} namespaces.</p>
 */
package ca.gc.cra.harvest.infrastructure.metrics;
