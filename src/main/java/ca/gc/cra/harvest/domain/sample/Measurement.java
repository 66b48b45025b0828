package ca.gc.cra.harvest.domain.sample;

import java.util.Objects;

/**
 * <strong>What:</strong> One channel reading extracted from a data row of an instrument export file.
 * <p><strong>Why:</strong> Carries the identity {@code (timestamp, source, channel)} that the store keeps unique,
 * together with the value and its provenance.</p>
 * <p><strong>Role:</strong> Domain value produced by the tailer and consumed by measurement sinks.</p>
 * <p><strong>Thread-safety:</strong> Immutable record; safe to share.</p>
 *
 * @param timestamp first cell of the source row, kept verbatim
 * @param source logical instrument identifier derived from the file name
 * @param channel channel label bound by the header row
 * @param value finite reading; blank or non-numeric cells never produce a measurement
 * @param origin file name the value was read from
 * @since 0.1.0
 */
public record Measurement(String timestamp, String source, String channel, double value, String origin) {

  /**
   * Validates the measurement components.
   *
   * @throws NullPointerException if any textual component is {@code null}
   * @throws IllegalArgumentException if {@code value} is NaN or infinite
   */
  public Measurement {
    Objects.requireNonNull(timestamp, "timestamp");
    Objects.requireNonNull(source, "source");
    Objects.requireNonNull(channel, "channel");
    Objects.requireNonNull(origin, "origin");
    if (!Double.isFinite(value)) {
      throw new IllegalArgumentException("value must be finite (was " + value + ")");
    }
  }

  /**
   * Renders the measurement as a tab-separated line in column order
   * {@code timestamp, source, channel, value, origin}.
   *
   * @return tab-separated representation without a trailing newline
   */
  public String toTabSeparated() {
    return timestamp + '\t' + source + '\t' + channel + '\t' + value + '\t' + origin;
  }
}
