package ca.gc.cra.harvest.application.ingest;

import java.util.Locale;

/**
 * How duplicate measurements are kept out of the store.
 *
 * @since 0.1.0
 */
public enum InsertStrategy {
  /** Create the unique index and use an ignoring insert; fall back to {@link #CONDITIONAL} if the index fails. */
  AUTO,
  /** Never create the unique index; check for an existing row in the same statement as the insert. */
  CONDITIONAL;

  /**
   * Parses a strategy name case-insensitively.
   *
   * @param raw strategy name
   * @return matching strategy
   * @throws IllegalArgumentException if the name is unknown
   */
  public static InsertStrategy parse(String raw) {
    if (raw == null || raw.isBlank()) {
      throw new IllegalArgumentException("insertStrategy must not be blank");
    }
    try {
      return valueOf(raw.trim().toUpperCase(Locale.ROOT));
    } catch (IllegalArgumentException ex) {
      throw new IllegalArgumentException(
          "insertStrategy must be one of auto|conditional (was " + raw + ")", ex);
    }
  }
}
