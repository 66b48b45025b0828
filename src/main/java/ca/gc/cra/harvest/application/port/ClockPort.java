package ca.gc.cra.harvest.application.port;

/**
 * <strong>What:</strong> Port supplying monotonic time to the batch ingester.
 * <p><strong>Why:</strong> Time-based flushing must be testable without sleeping.</p>
 * <p><strong>Thread-safety:</strong> Implementations must be thread-safe.</p>
 *
 * @since 0.1.0
 * @see ca.gc.cra.harvest.infrastructure.time.SystemClockAdapter
 */
public interface ClockPort {
  /**
   * Returns a monotonic timestamp in nanoseconds; only differences between two readings are meaningful.
   *
   * @return monotonic nanoseconds
   */
  long nanoTime();

  /** Default clock backed by {@link System#nanoTime()}. */
  ClockPort SYSTEM = System::nanoTime;
}
