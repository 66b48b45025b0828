package ca.gc.cra.harvest.infrastructure.time;

import ca.gc.cra.harvest.application.port.ClockPort;

/**
 * {@link ClockPort} implementation backed by {@link System#nanoTime()}.
 *
 * @since 0.1.0
 */
public final class SystemClockAdapter implements ClockPort {
  /**
   * Creates a system clock adapter.
   */
  public SystemClockAdapter() {}

  /**
   * Returns the JVM's monotonic nanosecond counter.
   *
   * @return monotonic nanoseconds
   * @implNote Delegates to {@link System#nanoTime()}; unaffected by wall-clock adjustments.
   */
  @Override
  public long nanoTime() {
    return System.nanoTime();
  }
}
