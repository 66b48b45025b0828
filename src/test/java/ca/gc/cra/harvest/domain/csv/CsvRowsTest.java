package ca.gc.cra.harvest.domain.csv;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;
import org.junit.jupiter.api.Test;

class CsvRowsTest {

  @Test
  void splitsPlainLineKeepingBlankCells() {
    assertEquals(List.of("a", "", "c", ""), CsvRows.cells("a,,c,").orElseThrow());
  }

  @Test
  void quotedCellsMayContainCommas() {
    assertEquals(List.of("12/03/2024 10:00:00", "101 (VDC), front", "4.5"),
        CsvRows.cells("12/03/2024 10:00:00,\"101 (VDC), front\",4.5").orElseThrow());
  }

  @Test
  void emptyLineHasNoCells() {
    assertTrue(CsvRows.cells("").isEmpty());
  }

  @Test
  void unbalancedQuoteIsRejected() {
    assertTrue(CsvRows.cells("a,\"unterminated,b").isEmpty());
  }
}
