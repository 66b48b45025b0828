package ca.gc.cra.harvest.infrastructure.tail;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.harvest.domain.sample.Measurement;
import ca.gc.cra.harvest.domain.sample.MeasurementExtractor;
import ca.gc.cra.harvest.domain.schema.ChannelBinding;
import ca.gc.cra.harvest.domain.schema.SchemaDetector;
import ca.gc.cra.harvest.domain.tail.FileTrackingState;
import java.io.IOException;
import java.nio.channels.FileChannel;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class IncrementalTailerTest {
  private static final String BANNER = "Acquisition Date:,12/03/2024\n\n";
  private static final String HEADER = "Time,Scan Number,101 (VDC),102 (VDC)\n";

  @TempDir Path tempDir;

  private Path file;
  private RecordingMetricsPort metrics;
  private IncrementalTailer tailer;

  @BeforeEach
  void setUp() {
    file = tempDir.resolve("AutoExportTrace_DAQ 2024.csv");
    metrics = new RecordingMetricsPort();
    tailer = new IncrementalTailer(metrics);
  }

  @Test
  void backfillEmitsRowsAlreadyPresent() throws IOException {
    write(BANNER + HEADER + "10:00:00,1,1.5,2.5\n10:00:01,2,3.5,\n");
    FileTrackingState state = track(true);

    List<Measurement> out = poll(state);

    assertEquals(List.of(
        new Measurement("10:00:00", "DAQ", "101 (VDC)", 1.5, "AutoExportTrace_DAQ 2024.csv"),
        new Measurement("10:00:00", "DAQ", "102 (VDC)", 2.5, "AutoExportTrace_DAQ 2024.csv"),
        new Measurement("10:00:01", "DAQ", "101 (VDC)", 3.5, "AutoExportTrace_DAQ 2024.csv")), out);
    assertEquals(Files.size(file), state.cursor());
    assertTrue(poll(state).isEmpty());
    assertEquals(1, metrics.count("tail.header.detected"));
    assertEquals(3, metrics.count("tail.measurement.emitted"));
  }

  @Test
  void backfillInitializationStopsRightAfterHeader() throws IOException {
    write(BANNER + HEADER + "10:00:00,1,1.5,2.5\n");
    FileTrackingState state = track(true);

    assertTrue(state.headerKnown());
    assertEquals((BANNER + HEADER).length(), state.cursor());
    assertEquals(0, state.pendingLength());
  }

  @Test
  void withoutBackfillOnlyAppendedRowsAreEmitted() throws IOException {
    write(BANNER + HEADER + "10:00:00,1,1.5,2.5\n");
    FileTrackingState state = track(false);

    assertTrue(state.headerKnown());
    assertEquals(Files.size(file), state.cursor());
    assertTrue(poll(state).isEmpty());

    append("10:00:01,2,7.0,8.0\n");
    List<Measurement> out = poll(state);
    assertEquals(2, out.size());
    assertEquals("10:00:01", out.get(0).timestamp());
  }

  @Test
  void partialLineIsHeldBackUntilTerminated() throws IOException {
    write(HEADER + "10:00:00,1,1.0,2.0\n10:00:01,2,3.");
    FileTrackingState state = track(true);

    List<Measurement> first = poll(state);
    assertEquals(2, first.size());
    assertEquals(HEADER.length() + "10:00:00,1,1.0,2.0\n".length(), state.cursor());
    assertEquals("10:00:01,2,3.".length(), state.pendingLength());

    assertTrue(poll(state).isEmpty());

    append("5,4.0\n");
    List<Measurement> second = poll(state);
    assertEquals(List.of(3.5, 4.0), values(second));
    assertEquals(Files.size(file), state.cursor());
    assertEquals(0, state.pendingLength());
  }

  @Test
  void partialLineAtInitializationIsEmittedOnceCompleted() throws IOException {
    write(HEADER + "10:00:00,1,1.0,2.0\n10:00:01,2,5");
    FileTrackingState state = track(false);

    append(".0,6.0\n");
    List<Measurement> out = poll(state);

    assertEquals(List.of(5.0, 6.0), values(out));
  }

  @Test
  void headerWrittenAfterTrackingIsDetectedLater() throws IOException {
    write(BANNER);
    FileTrackingState state = track(true);
    assertFalse(state.headerKnown());

    append(HEADER + "10:00:00,1,1.0,2.0\n");
    List<Measurement> out = poll(state);

    assertTrue(state.headerKnown());
    assertEquals(2, out.size());
  }

  @Test
  void truncationResetsStateAndRediscoversHeader() throws IOException {
    write(HEADER + "10:00:00,1,1.0,2.0\n10:00:01,2,3.0,4.0\n");
    FileTrackingState state = track(true);
    assertEquals(4, poll(state).size());

    write("Time,Scan Number,Other\n09:00:00,1,9.0\n");
    List<Measurement> out = poll(state);

    assertEquals(List.of(new Measurement("09:00:00", "DAQ", "Other", 9.0, "AutoExportTrace_DAQ 2024.csv")), out);
    assertEquals(List.of(new ChannelBinding("Other", 2)), state.bindings());
    assertEquals(1, metrics.count("tail.truncation"));
  }

  @Test
  void rewriteLongerThanReadPositionIsDetected() throws IOException {
    write("T,ScanNumber,ChA,ChB\n");
    FileTrackingState state = track(true);
    assertTrue(poll(state).isEmpty());
    append("2024-01-01T00:00:00,1,3.5,2.1\n");
    assertEquals(List.of(3.5, 2.1), values(poll(state)));

    write("T,ScanNumber,ChA,ChB,ChC\n2024-01-01T00:05:00,1,7.25,8.5,9.75\n");
    List<Measurement> out = poll(state);

    assertEquals(List.of(7.25, 8.5, 9.75), values(out));
    assertEquals(List.of("ChA", "ChB", "ChC"), out.stream().map(Measurement::channel).toList());
    assertEquals(1, metrics.count("tail.truncation"));
  }

  @Test
  void sameLengthRewriteIsDetected() throws IOException {
    write("T,ScanNumber,ChA,ChB\n2024-01-01T00:00:00,1,3.5,2.1\n");
    FileTrackingState state = track(true);
    assertEquals(2, poll(state).size());
    long before = Files.size(file);

    write("T,ScanNumber,ChA,ChB\n2024-01-01T00:00:00,1,7.5,8.1\n");
    assertEquals(before, Files.size(file));

    assertEquals(List.of(7.5, 8.1), values(poll(state)));
    assertEquals(1, metrics.count("tail.truncation"));
  }

  @Test
  void appendingUnchangedContentIsNotMistakenForRewrite() throws IOException {
    write(HEADER + "10:00:00,1,1.0,2.0\n10:00:01,2,3.");
    FileTrackingState state = track(true);
    assertEquals(2, poll(state).size());

    append("5,4.0\n");

    assertEquals(List.of(3.5, 4.0), values(poll(state)));
    assertEquals(0, metrics.count("tail.truncation"));
  }

  @Test
  void headerWithCp1252DegreeSignIsStillBound() throws IOException {
    byte[] header = {'T', 'i', 'm', 'e', ',', 'S', 'c', 'a', 'n', ' ', 'N', 'u', 'm', 'b', 'e', 'r', ',',
        'T', 'e', 'm', 'p', ' ', '(', (byte) 0xB0, 'C', ')', ',', 'V', '\n'};
    Files.write(file, header);
    append("10:00:00,1,21.5,3.3\n");
    FileTrackingState state = track(true);

    List<Measurement> out = poll(state);

    assertTrue(state.headerKnown());
    assertEquals(List.of("Temp (C)", "V"), out.stream().map(Measurement::channel).toList());
    assertEquals(List.of(21.5, 3.3), values(out));
    assertEquals(1, metrics.count("tail.line.undecodable"));
  }

  @Test
  void carriageReturnOnlyLineEndsAreSplit() throws IOException {
    write("Time,Scan Number,A\r10:00:00,1,1.5\r10:00:01,2,2.5\r");
    FileTrackingState state = track(true);
    assertTrue(state.headerKnown());

    assertEquals(List.of(1.5), values(poll(state)));
    assertEquals("10:00:01,2,2.5\r".length(), state.pendingLength());

    append("10:00:02,3,3.5\r");
    assertEquals(List.of(2.5), values(poll(state)));
  }

  @Test
  void readFailureMidPollStillReportsEmittedMeasurements() throws IOException {
    String row = "10:00:00,1,1.0,2.0\n";
    write(HEADER + row + "10:00:01,2,3.0,4.0\n10:00:02,3,5.0,6.0\n");
    FileTrackingState state = track(true);
    IncrementalTailer flaky = new IncrementalTailer(new SchemaDetector(), new MeasurementExtractor(),
        new RecordingMetricsPort(), row.length() + 1,
        path -> new FailingChannel(FileChannel.open(path, StandardOpenOption.READ), 2));

    List<Measurement> first = new ArrayList<>();
    int emitted = flaky.poll(state, first::add);

    assertEquals(2, emitted);
    assertEquals(List.of(1.0, 2.0), values(first));
    assertEquals(List.of(3.0, 4.0, 5.0, 6.0), values(poll(state)));
  }

  @Test
  void sparseHeaderKeepsAbsoluteColumns() throws IOException {
    write("Time,Scan Number,A,,B\n10:00:00,1,1.0,99,2.0\n");
    FileTrackingState state = track(true);

    List<Measurement> out = poll(state);

    assertEquals(List.of("A", "B"), out.stream().map(Measurement::channel).toList());
    assertEquals(List.of(1.0, 2.0), values(out));
  }

  @Test
  void byteOrderMarkAndCrLfAreTolerated() throws IOException {
    write("\uFEFFScan Sweep Time (Sec),Scan Number,A\r\n0.5,1,1.25\r\n");
    FileTrackingState state = track(true);

    List<Measurement> out = poll(state);

    assertEquals(List.of(new Measurement("0.5", "DAQ", "A", 1.25, "AutoExportTrace_DAQ 2024.csv")), out);
  }

  @Test
  void invalidBytesAreDroppedAndLineIsCounted() throws IOException {
    write(HEADER);
    FileTrackingState state = track(true);
    Files.write(file, new byte[] {'1', '0', ',', '1', ',', (byte) 0xFF, '\n'}, StandardOpenOption.APPEND);
    append("10:00:02,3,5.0,6.0\n");

    List<Measurement> out = poll(state);

    assertEquals(List.of(5.0, 6.0), values(out));
    assertEquals(1, metrics.count("tail.line.undecodable"));
  }

  @Test
  void outputDoesNotDependOnChunkSize() throws IOException {
    StringBuilder content = new StringBuilder(BANNER).append(HEADER);
    for (int i = 1; i <= 200; i++) {
      content.append("10:").append(i).append(',').append(i).append(',').append(i * 0.5).append(",-")
          .append(i).append('\n');
    }
    content.append("10:99,201,1.0");
    write(content.toString());

    List<Measurement> reference = backfillAll(new IncrementalTailer(metrics));
    for (int chunk : new int[] {1, 3, 7, 64, 4096}) {
      IncrementalTailer small = new IncrementalTailer(
          new SchemaDetector(), new MeasurementExtractor(), new RecordingMetricsPort(), chunk);
      assertEquals(reference, backfillAll(small), "chunk size " + chunk);
    }
    assertEquals(400, reference.size());
  }

  @Test
  void appendingInSmallPiecesMatchesSingleWrite() throws IOException {
    StringBuilder content = new StringBuilder("\uFEFFAcquisition Date:,12/03/2024\r\n\r\n")
        .append("Scan Sweep Time (Sec),Scan Number,A,B\r\n");
    for (int i = 1; i <= 12; i++) {
      content.append(i * 0.25).append(',').append(i).append(',').append(i).append(".5,").append(i % 3 == 0 ? "" : "-1")
          .append("\r\n");
    }
    byte[] bytes = content.toString().getBytes(StandardCharsets.UTF_8);
    Files.write(file, bytes);
    List<Measurement> reference = poll(track(true));
    assertEquals(20, reference.size());

    for (int piece : new int[] {1, 2, 5, 13}) {
      write("");
      FileTrackingState state = track(true);
      List<Measurement> out = new ArrayList<>();
      for (int from = 0; from < bytes.length; from += piece) {
        int to = Math.min(bytes.length, from + piece);
        Files.write(file, Arrays.copyOfRange(bytes, from, to), StandardOpenOption.APPEND);
        out.addAll(poll(state));
      }
      assertEquals(reference, out, "piece size " + piece);
      assertEquals(bytes.length, state.cursor());
    }
  }

  @Test
  void missingFileYieldsNothing() throws IOException {
    write(HEADER);
    FileTrackingState state = track(true);
    Files.delete(file);

    assertTrue(poll(state).isEmpty());
  }

  private List<Measurement> backfillAll(IncrementalTailer t) {
    FileTrackingState state = new FileTrackingState(file, "DAQ");
    t.initialize(state, true);
    List<Measurement> out = new ArrayList<>();
    t.poll(state, out::add);
    return out;
  }

  private FileTrackingState track(boolean backfill) {
    FileTrackingState state = new FileTrackingState(file, "DAQ");
    tailer.initialize(state, backfill);
    return state;
  }

  private List<Measurement> poll(FileTrackingState state) {
    List<Measurement> out = new ArrayList<>();
    int emitted = tailer.poll(state, out::add);
    assertEquals(out.size(), emitted);
    return out;
  }

  private static List<Double> values(List<Measurement> measurements) {
    return measurements.stream().map(Measurement::value).toList();
  }

  private void write(String content) throws IOException {
    Files.writeString(file, content, StandardCharsets.UTF_8);
  }

  private void append(String content) throws IOException {
    Files.writeString(file, content, StandardCharsets.UTF_8, StandardOpenOption.APPEND);
  }
}
