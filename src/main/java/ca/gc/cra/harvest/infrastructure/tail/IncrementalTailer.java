package ca.gc.cra.harvest.infrastructure.tail;

import ca.gc.cra.harvest.application.port.MeasurementSink;
import ca.gc.cra.harvest.application.port.MetricsPort;
import ca.gc.cra.harvest.domain.csv.CsvRows;
import ca.gc.cra.harvest.domain.csv.LineDecoder;
import ca.gc.cra.harvest.domain.sample.Measurement;
import ca.gc.cra.harvest.domain.sample.MeasurementExtractor;
import ca.gc.cra.harvest.domain.schema.SchemaDetector;
import ca.gc.cra.harvest.domain.tail.FileTrackingState;
import ca.gc.cra.harvest.logging.Logs;
import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.channels.FileChannel;
import java.nio.file.AccessDeniedException;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.Arrays;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Reads the bytes appended to one export file since the previous poll and turns complete
 * lines into measurements.
 * <p><strong>Why:</strong> Export files grow while the instrument is running; re-reading them from the start would
 * be wasteful and would re-emit rows.</p>
 * <p><strong>Role:</strong> Infrastructure adapter driven by {@link ExportFileSet}; mutates the
 * {@link FileTrackingState} it is handed.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Detect truncation, or a rewrite of bytes already consumed, and reset the file to discovery from
 *   byte 0.</li>
 *   <li>Hold back an unterminated final line until its terminator arrives.</li>
 *   <li>Offer lines to the {@link SchemaDetector} until a header is bound, then to the
 *   {@link MeasurementExtractor}.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Not thread-safe; owns a reusable decoder and read buffer.</p>
 * <p><strong>Performance:</strong> Reads in fixed-size chunks so a large backlog never needs to fit in memory.</p>
 * <p><strong>Observability:</strong> Emits {@code tail.truncation}, {@code tail.line.undecodable},
 * {@code tail.header.detected} and {@code tail.measurement.emitted}.</p>
 *
 * @since 0.1.0
 */
public final class IncrementalTailer {
  private static final Logger log = LoggerFactory.getLogger(IncrementalTailer.class);
  private static final int DEFAULT_CHUNK_BYTES = 1 << 20;
  private static final byte LINE_FEED = '\n';
  private static final byte CARRIAGE_RETURN = '\r';

  private final SchemaDetector detector;
  private final MeasurementExtractor extractor;
  private final MetricsPort metrics;
  private final LineDecoder decoder = new LineDecoder();
  private final int chunkBytes;
  private final ChannelOpener opener;

  /**
   * Creates a tailer with the default detector and extractor.
   *
   * @param metrics metrics sink; must not be {@code null}
   */
  public IncrementalTailer(MetricsPort metrics) {
    this(new SchemaDetector(), new MeasurementExtractor(), metrics, DEFAULT_CHUNK_BYTES);
  }

  IncrementalTailer(
      SchemaDetector detector, MeasurementExtractor extractor, MetricsPort metrics, int chunkBytes) {
    this(detector, extractor, metrics, chunkBytes, path -> FileChannel.open(path, StandardOpenOption.READ));
  }

  IncrementalTailer(
      SchemaDetector detector,
      MeasurementExtractor extractor,
      MetricsPort metrics,
      int chunkBytes,
      ChannelOpener opener) {
    this.detector = Objects.requireNonNull(detector, "detector");
    this.extractor = Objects.requireNonNull(extractor, "extractor");
    this.metrics = Objects.requireNonNull(metrics, "metrics");
    if (chunkBytes <= 0) {
      throw new IllegalArgumentException("chunkBytes must be positive");
    }
    this.chunkBytes = chunkBytes;
    this.opener = Objects.requireNonNull(opener, "opener");
  }

  /**
   * Establishes the initial position of a newly tracked file by scanning it from byte 0 for a header.
   *
   * <p>With {@code backfill} the cursor stops right after the header so the next poll emits every existing data
   * row. Without it the whole file is scanned, the header (if any) is bound, and the cursor ends at the last
   * complete line so only rows appended later are emitted. No measurements are emitted by this call.</p>
   *
   * @param state freshly created tracking state positioned at 0; must not be {@code null}
   * @param backfill whether pre-existing data rows should be emitted by subsequent polls
   */
  public void initialize(FileTrackingState state, boolean backfill) {
    Objects.requireNonNull(state, "state");
    Pass pass = backfill ? Pass.SEEK_HEADER : Pass.SKIP_TO_END;
    try {
      read(state, pass, MeasurementSink.DISCARD);
    } catch (NoSuchFileException | AccessDeniedException ex) {
      log.debug("Export file {} not readable during initial scan: {}", state.path(), ex.toString());
    } catch (IOException ex) {
      log.debug("Initial scan of {} failed; retrying on next poll", state.path(), ex);
    }
    log.debug("Initialized {}", state);
  }

  /**
   * Emits the measurements carried by lines completed since the previous call.
   *
   * <p>A missing or unreadable file leaves the state as it was after the last successfully processed chunk. The
   * returned count includes measurements emitted before a read failure.</p>
   *
   * @param state tracking state of the file; must not be {@code null}
   * @param sink receiver of measurements in row order; must not be {@code null}
   * @return number of measurements emitted
   */
  public int poll(FileTrackingState state, MeasurementSink sink) {
    Objects.requireNonNull(state, "state");
    CountingSink counting = new CountingSink(Objects.requireNonNull(sink, "sink"));
    try {
      read(state, Pass.EMIT, counting);
    } catch (NoSuchFileException | AccessDeniedException ex) {
      log.debug("Export file {} not readable this cycle: {}", state.path(), ex.toString());
    } catch (IOException ex) {
      log.debug("Failed to read {} after {} measurements; will retry next cycle",
          state.path(), counting.count(), ex);
    }
    return counting.count();
  }

  private void read(FileTrackingState state, Pass pass, MeasurementSink sink) throws IOException {
    try (FileChannel channel = opener.open(state.path())) {
      long size = channel.size();
      if (size < state.readPosition()) {
        log.info("Export file {} shrank to {} bytes (read position {}); rediscovering header",
            state.path(), size, state.readPosition());
        metrics.increment("tail.truncation");
        state.reset();
      } else if (!stillHoldsConsumedBytes(channel, state)) {
        log.info("Export file {} was rewritten before read position {}; rediscovering header",
            state.path(), state.readPosition());
        metrics.increment("tail.truncation");
        state.reset();
      }
      ByteBuffer buffer = ByteBuffer.allocate(chunkBytes);
      long position = state.readPosition();
      while (position < size) {
        buffer.clear();
        int limit = (int) Math.min(chunkBytes, size - position);
        buffer.limit(limit);
        int n = channel.read(buffer, position);
        if (n <= 0) {
          break;
        }
        position += n;
        if (consume(state, pass, sink, buffer.array(), n)) {
          break;
        }
      }
    }
  }

  /** Compares the bytes around the cursor with those read earlier. Catches truncate-then-rewrite between polls. */
  private static boolean stillHoldsConsumedBytes(FileChannel channel, FileTrackingState state) throws IOException {
    byte[] expected = state.expectedContent();
    if (expected.length == 0) {
      return true;
    }
    ByteBuffer actual = ByteBuffer.allocate(expected.length);
    long offset = state.verificationOffset();
    while (actual.hasRemaining()) {
      int n = channel.read(actual, offset + actual.position());
      if (n <= 0) {
        return false;
      }
    }
    return Arrays.equals(expected, actual.array());
  }

  /**
   * Processes the pending tail followed by {@code length} freshly read bytes. On return the cursor covers every
   * complete line handled and the pending tail holds the remainder. Lines end with LF, CRLF or a lone CR; a CR
   * that is the last byte available is held back until the next byte shows which one it is.
   *
   * @return whether reading should stop
   */
  private boolean consume(
      FileTrackingState state, Pass pass, MeasurementSink sink, byte[] fresh, int length) {
    byte[] data = join(state.pendingTail(), fresh, length);
    int lineStart = 0;
    for (int i = 0; i < data.length; i++) {
      byte b = data[i];
      if (b != LINE_FEED && b != CARRIAGE_RETURN) {
        continue;
      }
      if (b == CARRIAGE_RETURN) {
        if (i + 1 == data.length) {
          break;
        }
        if (data[i + 1] == LINE_FEED) {
          continue;
        }
      }
      boolean wasDiscovering = !state.headerKnown();
      if (wasDiscovering || pass == Pass.EMIT) {
        handleLine(state, sink, data, lineStart, i - lineStart, state.cursor() + lineStart);
      }
      lineStart = i + 1;
      if (pass == Pass.SEEK_HEADER && wasDiscovering && state.headerKnown()) {
        state.advance(data, lineStart);
        state.holdBack(new byte[0]);
        return true;
      }
    }
    state.advance(data, lineStart);
    state.holdBack(Arrays.copyOfRange(data, lineStart, data.length));
    return false;
  }

  private void handleLine(
      FileTrackingState state, MeasurementSink sink, byte[] data, int offset, int length, long fileOffset) {
    LineDecoder.DecodedLine line = decoder.decode(data, offset, length);
    if (line.repaired()) {
      metrics.increment("tail.line.undecodable");
      log.debug("Dropped invalid UTF-8 bytes from line at offset {} of {}", fileOffset, state.path());
    }
    Optional<List<String>> cells = CsvRows.cells(line.text());
    if (cells.isEmpty()) {
      return;
    }
    if (!state.headerKnown()) {
      Optional<SchemaDetector.Header> header = detector.detect(cells.get());
      if (header.isPresent()) {
        state.bindHeader(header.get().bindings());
        metrics.increment("tail.header.detected");
        log.info("Header detected in {} ({}, {} channels)",
            state.path().getFileName(), header.get().format(), header.get().bindings().size());
        log.debug("Header line: {}", Logs.preview(line.text()));
      }
      return;
    }
    List<Measurement> measurements =
        extractor.extract(cells.get(), state.bindings(), state.source(), state.origin());
    for (Measurement measurement : measurements) {
      sink.accept(measurement);
      metrics.increment("tail.measurement.emitted");
    }
  }

  private static byte[] join(byte[] pending, byte[] fresh, int length) {
    byte[] data = new byte[pending.length + length];
    System.arraycopy(pending, 0, data, 0, pending.length);
    System.arraycopy(fresh, 0, data, pending.length, length);
    return data;
  }

  private enum Pass {
    /** Emit measurements for every complete data row. */
    EMIT,
    /** Stop right after the header line; used for backfill initialization. */
    SEEK_HEADER,
    /** Bind the header if present and skip every other complete line. */
    SKIP_TO_END
  }

  @FunctionalInterface
  interface ChannelOpener {
    FileChannel open(Path path) throws IOException;
  }

  private static final class CountingSink implements MeasurementSink {
    private final MeasurementSink delegate;
    private int count;

    CountingSink(MeasurementSink delegate) {
      this.delegate = delegate;
    }

    @Override
    public void accept(Measurement measurement) {
      delegate.accept(measurement);
      count++;
    }

    int count() {
      return count;
    }
  }
}
