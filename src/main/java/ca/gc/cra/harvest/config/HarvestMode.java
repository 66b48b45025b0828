package ca.gc.cra.harvest.config;

import java.util.Locale;

/**
 * CLI subcommands; each selects its own defaults and YAML section.
 *
 * @since 0.1.0
 */
public enum HarvestMode {
  /** Tail export files and persist measurements into SQLite. */
  INGEST("ingest"),
  /** Tail export files and print measurements to stdout. */
  WATCH("watch");

  private final String key;

  HarvestMode(String key) {
    this.key = key;
  }

  /** Lower-case name used for YAML sections, MDC and help text. */
  public String key() {
    return key;
  }

  /**
   * Resolves a mode by name, case-insensitively.
   *
   * @param raw mode name
   * @return matching mode
   * @throws IllegalArgumentException if the name is unknown
   */
  public static HarvestMode fromString(String raw) {
    if (raw != null) {
      String normalized = raw.trim().toLowerCase(Locale.ROOT);
      for (HarvestMode mode : values()) {
        if (mode.key.equals(normalized)) {
          return mode;
        }
      }
    }
    throw new IllegalArgumentException("Unsupported mode: " + raw);
  }
}
