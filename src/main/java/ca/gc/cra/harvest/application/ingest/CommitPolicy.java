package ca.gc.cra.harvest.application.ingest;

import java.time.Duration;
import java.util.Objects;

/**
 * <strong>What:</strong> Decides when buffered measurements must be committed.
 * <p>A flush is due once {@link #batchRows()} rows were accepted since the last flush, or once
 * {@link #batchInterval()} elapsed since the last flush with at least one row pending.</p>
 *
 * @param batchRows row threshold; at least 1
 * @param batchInterval time threshold; positive
 * @since 0.1.0
 */
public record CommitPolicy(int batchRows, Duration batchInterval) {
  public CommitPolicy {
    Objects.requireNonNull(batchInterval, "batchInterval");
    if (batchRows < 1) {
      throw new IllegalArgumentException("batchRows must be >= 1 (was " + batchRows + ")");
    }
    if (batchInterval.isNegative() || batchInterval.isZero()) {
      throw new IllegalArgumentException("batchInterval must be positive (was " + batchInterval + ")");
    }
  }

  /**
   * Builds the policy of a preset, optionally overriding either threshold.
   *
   * @param mode preset supplying default thresholds
   * @param rowsOverride replacement row threshold, or {@code null}
   * @param intervalOverride replacement time threshold, or {@code null}
   * @return effective policy
   */
  public static CommitPolicy of(CommitMode mode, Integer rowsOverride, Duration intervalOverride) {
    Objects.requireNonNull(mode, "mode");
    return new CommitPolicy(
        rowsOverride != null ? rowsOverride : mode.batchRows(),
        intervalOverride != null ? intervalOverride : mode.batchInterval());
  }

  /**
   * Reports whether the buffered rows must be committed now.
   *
   * @param pendingRows rows accepted since the last flush
   * @param nanosSinceLastFlush monotonic nanoseconds elapsed since the last flush
   * @return {@code true} when a threshold is reached and something is pending
   */
  public boolean flushDue(int pendingRows, long nanosSinceLastFlush) {
    if (pendingRows <= 0) {
      return false;
    }
    return pendingRows >= batchRows || nanosSinceLastFlush >= batchInterval.toNanos();
  }
}
