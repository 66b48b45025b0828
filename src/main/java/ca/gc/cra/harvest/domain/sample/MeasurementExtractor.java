package ca.gc.cra.harvest.domain.sample;

import ca.gc.cra.harvest.domain.schema.ChannelBinding;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * <strong>What:</strong> Turns one decoded data row into zero or more {@link Measurement}s.
 * <p><strong>Why:</strong> Export files interleave banner and metadata lines with data; only rows whose row-marker
 * cell is an integer are data, and partially filled rows are normal.</p>
 * <p><strong>Role:</strong> Domain service invoked by the tailer once a file's header is known.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Reject rows with fewer than two cells or a non-integer row marker.</li>
 *   <li>Emit one measurement per bound channel whose cell holds a finite number.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Stateless; safe for concurrent use.</p>
 * <p><strong>Observability:</strong> None; malformed rows and cells are expected and silently skipped.</p>
 *
 * @since 0.1.0
 */
public final class MeasurementExtractor {
  private static final int TIMESTAMP_COLUMN = 0;
  private static final int ROW_MARKER_COLUMN = 1;

  /**
   * Creates an extractor.
   */
  public MeasurementExtractor() {}

  /**
   * Extracts the measurements carried by a data row.
   *
   * @param cells decoded cells of the row; must not be {@code null}
   * @param bindings channel bindings of the file's header; must not be {@code null}
   * @param source instrument identifier of the file
   * @param origin file name recorded as provenance
   * @return measurements in binding order; empty when the row is not a data row
   */
  public List<Measurement> extract(
      List<String> cells, List<ChannelBinding> bindings, String source, String origin) {
    Objects.requireNonNull(cells, "cells");
    Objects.requireNonNull(bindings, "bindings");
    if (cells.size() <= ROW_MARKER_COLUMN || bindings.isEmpty()) {
      return List.of();
    }
    if (!isRowMarker(cells.get(ROW_MARKER_COLUMN))) {
      return List.of();
    }
    String timestamp = cells.get(TIMESTAMP_COLUMN);
    List<Measurement> out = new ArrayList<>(bindings.size());
    for (ChannelBinding binding : bindings) {
      if (binding.column() >= cells.size()) {
        continue;
      }
      Double value = parseFinite(cells.get(binding.column()));
      if (value == null) {
        continue;
      }
      out.add(new Measurement(timestamp, source, binding.name(), value, origin));
    }
    return out;
  }

  static boolean isRowMarker(String cell) {
    String trimmed = cell.trim();
    if (trimmed.isEmpty()) {
      return false;
    }
    try {
      Long.parseLong(trimmed);
      return true;
    } catch (NumberFormatException ex) {
      return false;
    }
  }

  /**
   * Parses a decimal cell, rejecting blanks, non-finite values and Java-only literal forms such as
   * {@code 1d} or hexadecimal floats.
   */
  static Double parseFinite(String cell) {
    String trimmed = cell.trim();
    if (trimmed.isEmpty()) {
      return null;
    }
    char last = trimmed.charAt(trimmed.length() - 1);
    if (last == 'd' || last == 'D' || last == 'f' || last == 'F') {
      return null;
    }
    if (trimmed.indexOf('x') >= 0 || trimmed.indexOf('X') >= 0) {
      return null;
    }
    double value;
    try {
      value = Double.parseDouble(trimmed);
    } catch (NumberFormatException ex) {
      return null;
    }
    return Double.isFinite(value) ? value : null;
  }
}
