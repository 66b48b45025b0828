package ca.gc.cra.harvest.domain.schema;

import java.util.List;
import java.util.Locale;

/**
 * <strong>What:</strong> Header row layouts emitted by the known instrument export variants.
 * <p><strong>Why:</strong> Export variants disagree on the header's leading cells, so detection is a small tagged
 * choice tried in declaration order rather than ad-hoc conditionals.</p>
 * <p><strong>Role:</strong> Domain enum consumed by {@link SchemaDetector}.</p>
 * <p><strong>Thread-safety:</strong> Enum constants are immutable.</p>
 *
 * @since 0.1.0
 */
public enum HeaderFormat {
  /** First cell is the literal sweep-time leader; channels start at column 2. */
  LEADER_LITERAL(2) {
    @Override
    boolean matches(List<String> cells) {
      return !cells.isEmpty() && HEADER_LEADER.equals(cells.get(0).trim());
    }
  },
  /** Cell 1 is the row-marker label (case- and whitespace-insensitive); channels start at column 2. */
  ROW_MARKER_LABEL(2) {
    @Override
    boolean matches(List<String> cells) {
      return cells.size() > 1 && ROW_MARKER_KEY.equals(squash(cells.get(1)));
    }
  };

  /** Literal first cell of the sweep-style header. */
  public static final String HEADER_LEADER = "Scan Sweep Time (Sec)";

  /** Row-marker column label as printed by the instrument software. */
  public static final String ROW_MARKER_LABEL_TEXT = "Scan Number";

  private static final String ROW_MARKER_KEY = squash(ROW_MARKER_LABEL_TEXT);

  private final int firstChannelColumn;

  HeaderFormat(int firstChannelColumn) {
    this.firstChannelColumn = firstChannelColumn;
  }

  /**
   * Returns the first column index that may hold a channel name.
   *
   * @return zero-based column index
   */
  public int firstChannelColumn() {
    return firstChannelColumn;
  }

  /**
   * Reports whether the decoded cells form a header row of this layout.
   *
   * @param cells decoded CSV cells of one line; never {@code null}
   * @return {@code true} when the row is a header of this layout
   */
  abstract boolean matches(List<String> cells);

  private static String squash(String value) {
    StringBuilder sb = new StringBuilder(value.length());
    for (int i = 0; i < value.length(); i++) {
      char c = value.charAt(i);
      if (!Character.isWhitespace(c) && c != '\uFEFF') {
        sb.append(c);
      }
    }
    return sb.toString().toLowerCase(Locale.ROOT);
  }
}
