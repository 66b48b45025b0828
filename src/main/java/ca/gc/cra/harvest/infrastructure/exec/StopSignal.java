package ca.gc.cra.harvest.infrastructure.exec;

import ca.gc.cra.harvest.application.port.CancellationToken;
import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Latch-backed {@link CancellationToken} bridging JVM shutdown to the poll loop.
 * <p><strong>Why:</strong> SIGINT/SIGTERM must stop the loop between cycles and still let the final batch commit
 * before the JVM exits.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Wake the inter-poll wait as soon as a stop is requested.</li>
 *   <li>Install a shutdown hook that requests the stop and waits, bounded, until the loop reports it finished.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Thread-safe.</p>
 *
 * @since 0.1.0
 */
public final class StopSignal implements CancellationToken {
  private static final Logger log = LoggerFactory.getLogger(StopSignal.class);

  private final CountDownLatch stopRequested = new CountDownLatch(1);
  private final CountDownLatch finished = new CountDownLatch(1);

  /**
   * Creates an untriggered signal.
   */
  public StopSignal() {}

  /** Requests the loop to stop after its current file. Idempotent. */
  public void requestStop() {
    stopRequested.countDown();
  }

  @Override
  public boolean isCancelled() {
    return stopRequested.getCount() == 0;
  }

  @Override
  public boolean awaitCancellation(Duration timeout) throws InterruptedException {
    if (timeout.isNegative() || timeout.isZero()) {
      return isCancelled();
    }
    return stopRequested.await(timeout.toNanos(), TimeUnit.NANOSECONDS);
  }

  /** Reports that the loop exited and the final flush completed (or failed). */
  public void markFinished() {
    finished.countDown();
  }

  /**
   * Waits until {@link #markFinished()} is called.
   *
   * @param timeout maximum wait
   * @return {@code true} if the loop finished within the timeout
   * @throws InterruptedException if interrupted while waiting
   */
  public boolean awaitFinished(Duration timeout) throws InterruptedException {
    return finished.await(timeout.toNanos(), TimeUnit.NANOSECONDS);
  }

  /**
   * Registers a JVM shutdown hook that requests a stop and waits up to {@code grace} for the loop to finish.
   *
   * @param name thread name of the hook
   * @param grace bounded wait for the final flush
   * @return the registered hook thread, so callers can deregister it after a normal exit
   */
  public Thread installShutdownHook(String name, Duration grace) {
    Objects.requireNonNull(grace, "grace");
    Thread hook = new Thread(() -> {
      if (finished.getCount() == 0) {
        return;
      }
      log.info("Stopping after current batch...");
      requestStop();
      try {
        if (!awaitFinished(grace)) {
          log.warn("Poll loop did not finish within {} ms; exiting", grace.toMillis());
        }
      } catch (InterruptedException ex) {
        Thread.currentThread().interrupt();
      }
    }, name);
    Runtime.getRuntime().addShutdownHook(hook);
    return hook;
  }

  /**
   * Removes a hook installed by {@link #installShutdownHook}; ignored while the JVM is already shutting down.
   *
   * @param hook hook returned by {@link #installShutdownHook}
   */
  public static void removeShutdownHook(Thread hook) {
    try {
      Runtime.getRuntime().removeShutdownHook(hook);
    } catch (IllegalStateException ex) {
      log.debug("JVM shutdown in progress; hook {} stays registered", hook.getName());
    }
  }
}
