package ca.gc.cra.harvest.domain.csv;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import org.apache.commons.csv.CSVFormat;
import org.apache.commons.csv.CSVParser;
import org.apache.commons.csv.CSVRecord;

/**
 * Splits one already-decoded export line into its cells.
 *
 * <p>Export files are plain comma-separated text with optional double-quoted cells. Each call parses a single
 * line; multi-line quoted cells are not supported by the instrument format and are treated as malformed.</p>
 *
 * @since 0.1.0
 */
public final class CsvRows {
  private static final CSVFormat FORMAT = CSVFormat.DEFAULT.builder()
      .setIgnoreEmptyLines(true)
      .setTrim(false)
      .build();

  private CsvRows() {
    // Utility
  }

  /**
   * Parses a line into cells.
   *
   * @param line decoded line without its terminator; must not be {@code null}
   * @return cells in column order, or empty when the line is blank or not well-formed CSV
   */
  public static Optional<List<String>> cells(String line) {
    Objects.requireNonNull(line, "line");
    if (line.isEmpty()) {
      return Optional.empty();
    }
    try (CSVParser parser = CSVParser.parse(line, FORMAT)) {
      List<CSVRecord> records = parser.getRecords();
      if (records.size() != 1) {
        return Optional.empty();
      }
      CSVRecord record = records.get(0);
      List<String> cells = new ArrayList<>(record.size());
      for (String value : record) {
        cells.add(value == null ? "" : value);
      }
      return Optional.of(cells);
    } catch (IOException | UncheckedIOException | IllegalStateException ex) {
      return Optional.empty();
    }
  }
}
