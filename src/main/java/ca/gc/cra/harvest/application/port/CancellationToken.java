package ca.gc.cra.harvest.application.port;

import java.time.Duration;

/**
 * Cooperative stop request observed by the poll loop between cycles and between files.
 *
 * @since 0.1.0
 */
@FunctionalInterface
public interface CancellationToken {
  /**
   * Reports whether a stop has been requested.
   *
   * @return {@code true} once stop was requested
   */
  boolean isCancelled();

  /**
   * Waits up to {@code timeout} for a stop request. The default sleeps the full timeout; implementations backed
   * by a latch return as soon as the stop is requested.
   *
   * @param timeout maximum wait
   * @return {@code true} if a stop was requested by the time the wait ended
   * @throws InterruptedException if the waiting thread is interrupted
   */
  default boolean awaitCancellation(Duration timeout) throws InterruptedException {
    if (!isCancelled() && !timeout.isNegative() && !timeout.isZero()) {
      Thread.sleep(timeout.toMillis(), timeout.toNanosPart() % 1_000_000);
    }
    return isCancelled();
  }

  /** Token that is never cancelled. */
  CancellationToken NEVER = () -> false;
}
