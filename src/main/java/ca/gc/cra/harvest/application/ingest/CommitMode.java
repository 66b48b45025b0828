package ca.gc.cra.harvest.application.ingest;

import java.time.Duration;
import java.util.Locale;

/**
 * Commit presets trading durability for throughput. The mode is only ever chosen by the operator.
 *
 * @since 0.1.0
 */
public enum CommitMode {
  /** Small batches, every commit fully synced. */
  STANDARD(250, Duration.ofSeconds(2), Durability.FULL),
  /** Larger batches for catch-up; write-ahead log with normal sync, still crash-safe. */
  BALANCED(5_000, Duration.ofSeconds(10), Durability.NORMAL),
  /** Largest batches; sync disabled, so an OS crash may lose recently committed batches. */
  AGGRESSIVE(50_000, Duration.ofSeconds(30), Durability.OFF);

  private final int batchRows;
  private final Duration batchInterval;
  private final Durability durability;

  CommitMode(int batchRows, Duration batchInterval, Durability durability) {
    this.batchRows = batchRows;
    this.batchInterval = batchInterval;
    this.durability = durability;
  }

  public int batchRows() {
    return batchRows;
  }

  public Duration batchInterval() {
    return batchInterval;
  }

  public Durability durability() {
    return durability;
  }

  /**
   * Parses a mode name case-insensitively.
   *
   * @param raw mode name such as {@code balanced}
   * @return matching mode
   * @throws IllegalArgumentException if the name is unknown
   */
  public static CommitMode parse(String raw) {
    if (raw == null || raw.isBlank()) {
      throw new IllegalArgumentException("commitMode must not be blank");
    }
    try {
      return valueOf(raw.trim().toUpperCase(Locale.ROOT));
    } catch (IllegalArgumentException ex) {
      throw new IllegalArgumentException(
          "commitMode must be one of standard|balanced|aggressive (was " + raw + ")", ex);
    }
  }

  /** How hard the store syncs each commit to stable storage. */
  public enum Durability {
    FULL,
    NORMAL,
    OFF
  }
}
