package ca.gc.cra.harvest.application.port;

/**
 * <strong>What:</strong> Port abstracting harvest metrics emission.
 * <p><strong>Why:</strong> Lets the tailer and the ingester record counters and latencies without binding to a vendor
 * SDK.</p>
 * <p><strong>Role:</strong> Application port implemented by {@code OpenTelemetryMetricsAdapter} and
 * {@code NoOpMetricsAdapter}.</p>
 * <p><strong>Thread-safety:</strong> Implementations must accept updates from the polling thread and the shutdown
 * hook concurrently.</p>
 * <p><strong>Observability:</strong> Defines the metric name contract (e.g., {@code ingest.flush.latencyNanos}).</p>
 *
 * @since 0.1.0
 */
public interface MetricsPort {
  /**
   * Increments the named counter by one.
   *
   * @param key dotted metric identifier (e.g., {@code tail.truncation}); must not be {@code null}
   */
  void increment(String key);

  /**
   * Records an observation for a histogram style metric.
   *
   * @param key dotted metric identifier; must not be {@code null}
   * @param value observed value; unit is implied by the key suffix
   */
  void observe(String key, long value);

  /** Metrics implementation that ignores all updates. */
  MetricsPort NO_OP = new MetricsPort() {
    @Override public void increment(String key) {}

    @Override public void observe(String key, long value) {}
  };
}
