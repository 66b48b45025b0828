package ca.gc.cra.harvest.domain.schema;

import java.util.Objects;

/**
 * Binds a channel name to the absolute column index where its values appear in data rows.
 *
 * @param name trimmed, non-blank channel label from the header row
 * @param column zero-based column index in the original header (indices may be non-contiguous)
 * @since 0.1.0
 */
public record ChannelBinding(String name, int column) {

  public ChannelBinding {
    Objects.requireNonNull(name, "name");
    if (name.isBlank()) {
      throw new IllegalArgumentException("channel name must not be blank");
    }
    if (column < 0) {
      throw new IllegalArgumentException("column must be >= 0 (was " + column + ")");
    }
  }
}
