package ca.gc.cra.harvest.domain.schema;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * <strong>What:</strong> Recognizes an export file's header row and binds channel names to column positions.
 * <p><strong>Why:</strong> The column layout is not stable across export variants; data rows can only be
 * interpreted once the header has been seen.</p>
 * <p><strong>Role:</strong> Domain service shared by the initial position scan and the steady-state tail scan.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Try each {@link HeaderFormat} in declaration order.</li>
 *   <li>Skip blank header cells and keep the absolute column index of each named channel.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Stateless; safe for concurrent use.</p>
 * <p><strong>Performance:</strong> O(cells) per candidate line.</p>
 *
 * @since 0.1.0
 */
public final class SchemaDetector {

  /**
   * Creates a detector.
   */
  public SchemaDetector() {}

  /**
   * Attempts to interpret the cells of one line as a header row.
   *
   * @param cells decoded cells of one line; must not be {@code null}
   * @return the recognized header, or empty when the line is not a header
   */
  public Optional<Header> detect(List<String> cells) {
    Objects.requireNonNull(cells, "cells");
    for (HeaderFormat format : HeaderFormat.values()) {
      if (format.matches(cells)) {
        return Optional.of(new Header(format, bind(cells, format.firstChannelColumn())));
      }
    }
    return Optional.empty();
  }

  private static List<ChannelBinding> bind(List<String> cells, int firstColumn) {
    List<ChannelBinding> bindings = new ArrayList<>();
    for (int column = firstColumn; column < cells.size(); column++) {
      String name = cells.get(column).trim();
      if (name.isEmpty()) {
        continue;
      }
      bindings.add(new ChannelBinding(name, column));
    }
    return List.copyOf(bindings);
  }

  /**
   * A recognized header row.
   *
   * @param format layout that matched
   * @param bindings ordered channel bindings; may be empty when the header names no channels
   */
  public record Header(HeaderFormat format, List<ChannelBinding> bindings) {
    public Header {
      Objects.requireNonNull(format, "format");
      bindings = List.copyOf(Objects.requireNonNull(bindings, "bindings"));
    }
  }
}
