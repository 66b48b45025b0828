package ca.gc.cra.harvest.domain.sample;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.harvest.domain.schema.ChannelBinding;
import java.util.List;
import org.junit.jupiter.api.Test;

class MeasurementExtractorTest {
  private static final List<ChannelBinding> BINDINGS =
      List.of(new ChannelBinding("A", 2), new ChannelBinding("B", 4));

  private final MeasurementExtractor extractor = new MeasurementExtractor();

  @Test
  void emitsOneMeasurementPerNumericBoundCell() {
    List<Measurement> out = extractor.extract(
        List.of("10:00:01", "7", "1.5", "ignored", "-2e3"), BINDINGS, "DAQ1", "export.csv");

    assertEquals(List.of(
        new Measurement("10:00:01", "DAQ1", "A", 1.5, "export.csv"),
        new Measurement("10:00:01", "DAQ1", "B", -2000.0, "export.csv")), out);
  }

  @Test
  void rowsWithoutIntegerRowMarkerAreDropped() {
    assertTrue(extractor.extract(List.of("t", "x", "1", "", "2"), BINDINGS, "s", "o").isEmpty());
    assertTrue(extractor.extract(List.of("t", "1.5", "1", "", "2"), BINDINGS, "s", "o").isEmpty());
    assertTrue(extractor.extract(List.of("t", " ", "1", "", "2"), BINDINGS, "s", "o").isEmpty());
    assertTrue(extractor.extract(List.of("t"), BINDINGS, "s", "o").isEmpty());
  }

  @Test
  void blankNonNumericAndShortCellsAreSkipped() {
    List<Measurement> out = extractor.extract(List.of("t", "3", "OVLD"), BINDINGS, "s", "o");
    assertTrue(out.isEmpty());

    out = extractor.extract(List.of("t", "3", " 4 "), BINDINGS, "s", "o");
    assertEquals(1, out.size());
    assertEquals(4.0, out.get(0).value());
  }

  @Test
  void nonFiniteAndJavaSuffixedLiteralsAreRejected() {
    assertNull(MeasurementExtractor.parseFinite("NaN"));
    assertNull(MeasurementExtractor.parseFinite("Infinity"));
    assertNull(MeasurementExtractor.parseFinite("1e400"));
    assertNull(MeasurementExtractor.parseFinite("1.0d"));
    assertNull(MeasurementExtractor.parseFinite("0x1p3"));
    assertEquals(0.25, MeasurementExtractor.parseFinite("+.25"));
  }

  @Test
  void rowMarkerAcceptsSignedIntegers() {
    assertTrue(MeasurementExtractor.isRowMarker(" 12 "));
    assertTrue(MeasurementExtractor.isRowMarker("-3"));
    assertFalse(MeasurementExtractor.isRowMarker("12a"));
  }

  @Test
  void measurementRejectsNonFiniteValues() {
    assertThrows(IllegalArgumentException.class,
        () -> new Measurement("t", "s", "c", Double.NaN, "o"));
  }

  @Test
  void tabSeparatedLineKeepsFieldOrder() {
    assertEquals("t\ts\tc\t1.5\to", new Measurement("t", "s", "c", 1.5, "o").toTabSeparated());
  }
}
