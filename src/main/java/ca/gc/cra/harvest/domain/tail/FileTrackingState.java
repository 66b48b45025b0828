package ca.gc.cra.harvest.domain.tail;

import ca.gc.cra.harvest.domain.schema.ChannelBinding;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.List;
import java.util.Objects;

/**
 * <strong>What:</strong> Per-file read position, header bindings and held-back partial line.
 * <p><strong>Why:</strong> Lets each poll read only newly appended bytes without re-emitting or losing rows.</p>
 * <p><strong>Role:</strong> Mutable domain state owned by the export file set and mutated only by the tailer while it
 * processes the corresponding file.</p>
 * <p><strong>Invariants:</strong>
 * <ul>
 *   <li>{@link #cursor()} always sits on the byte following a line terminator, or at 0.</li>
 *   <li>{@link #pendingTail()} holds the bytes between the cursor and the last byte read; they never contain a
 *   complete line terminator.</li>
 *   <li>{@link #anchor()} holds the last bytes of the file before the cursor, at most {@value #ANCHOR_BYTES}.</li>
 *   <li>Bindings are empty while {@link TrackingPhase#DISCOVERING} and frozen while {@link TrackingPhase#TAILING}.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Not thread-safe; confined to the polling thread.</p>
 *
 * @since 0.1.0
 */
public final class FileTrackingState {
  /** Upper bound on the number of consumed bytes remembered before the cursor. */
  public static final int ANCHOR_BYTES = 64;

  private static final byte[] EMPTY = new byte[0];

  private final Path path;
  private final String source;
  private final String origin;

  private TrackingPhase phase = TrackingPhase.DISCOVERING;
  private List<ChannelBinding> bindings = List.of();
  private long cursor;
  private byte[] pendingTail = EMPTY;
  private byte[] anchor = EMPTY;

  /**
   * Creates a discovering state positioned at the start of the file.
   *
   * @param path tracked file; must not be {@code null}
   * @param source instrument identifier derived from the file name
   */
  public FileTrackingState(Path path, String source) {
    this.path = Objects.requireNonNull(path, "path");
    this.source = Objects.requireNonNull(source, "source");
    Path fileName = path.getFileName();
    this.origin = fileName == null ? path.toString() : fileName.toString();
  }

  public Path path() {
    return path;
  }

  public String source() {
    return source;
  }

  /** File name used as measurement provenance. */
  public String origin() {
    return origin;
  }

  public TrackingPhase phase() {
    return phase;
  }

  public boolean headerKnown() {
    return phase == TrackingPhase.TAILING;
  }

  public List<ChannelBinding> bindings() {
    return bindings;
  }

  public long cursor() {
    return cursor;
  }

  /**
   * Returns a copy of the held-back bytes of an unterminated final line.
   *
   * @return copy of the pending bytes; empty when the last read ended on a line feed
   */
  public byte[] pendingTail() {
    return pendingTail.length == 0 ? EMPTY : Arrays.copyOf(pendingTail, pendingTail.length);
  }

  public int pendingLength() {
    return pendingTail.length;
  }

  /**
   * Returns a copy of the consumed bytes that end at the cursor.
   *
   * @return up to {@value #ANCHOR_BYTES} bytes; empty at offset 0
   */
  public byte[] anchor() {
    return anchor.length == 0 ? EMPTY : Arrays.copyOf(anchor, anchor.length);
  }

  /**
   * Returns the bytes the file must still hold from {@link #verificationOffset()} for this state to be valid: the
   * anchor followed by the pending tail.
   *
   * @return expected bytes; empty when nothing has been read yet
   */
  public byte[] expectedContent() {
    byte[] expected = Arrays.copyOf(anchor, anchor.length + pendingTail.length);
    System.arraycopy(pendingTail, 0, expected, anchor.length, pendingTail.length);
    return expected;
  }

  /**
   * Returns the file offset at which {@link #expectedContent()} starts.
   *
   * @return cursor minus the anchor length
   */
  public long verificationOffset() {
    return cursor - anchor.length;
  }

  /**
   * Returns the first file offset that has not yet been read, i.e. the cursor plus the pending bytes.
   *
   * @return next read offset
   */
  public long readPosition() {
    return cursor + pendingTail.length;
  }

  /**
   * Freezes the header bindings and switches to {@link TrackingPhase#TAILING}.
   *
   * @param channelBindings bindings recognized by the schema detector
   * @throws IllegalStateException if a header is already bound
   */
  public void bindHeader(List<ChannelBinding> channelBindings) {
    if (phase == TrackingPhase.TAILING) {
      throw new IllegalStateException("header already bound for " + path);
    }
    this.bindings = List.copyOf(Objects.requireNonNull(channelBindings, "channelBindings"));
    this.phase = TrackingPhase.TAILING;
  }

  /**
   * Moves the cursor forward over completed lines.
   *
   * @param data bytes starting at the current cursor
   * @param length number of leading bytes of {@code data} that form complete lines; must lie within {@code data}
   */
  public void advance(byte[] data, int length) {
    Objects.requireNonNull(data, "data");
    if (length < 0 || length > data.length) {
      throw new IllegalArgumentException("length must be within [0, " + data.length + "] (was " + length + ")");
    }
    if (length == 0) {
      return;
    }
    cursor += length;
    if (length >= ANCHOR_BYTES) {
      anchor = Arrays.copyOfRange(data, length - ANCHOR_BYTES, length);
      return;
    }
    int kept = Math.min(anchor.length, ANCHOR_BYTES - length);
    byte[] next = new byte[kept + length];
    System.arraycopy(anchor, anchor.length - kept, next, 0, kept);
    System.arraycopy(data, 0, next, kept, length);
    anchor = next;
  }

  /**
   * Replaces the held-back partial line.
   *
   * @param fragment bytes after the last line feed; copied
   */
  public void holdBack(byte[] fragment) {
    Objects.requireNonNull(fragment, "fragment");
    this.pendingTail = fragment.length == 0 ? EMPTY : Arrays.copyOf(fragment, fragment.length);
  }

  /**
   * Returns to {@link TrackingPhase#DISCOVERING} at offset 0 with no bindings and no pending bytes.
   */
  public void reset() {
    this.phase = TrackingPhase.DISCOVERING;
    this.bindings = List.of();
    this.cursor = 0L;
    this.pendingTail = EMPTY;
    this.anchor = EMPTY;
  }

  @Override
  public String toString() {
    return "FileTrackingState{path=" + path
        + ", source=" + source
        + ", phase=" + phase
        + ", channels=" + bindings.size()
        + ", cursor=" + cursor
        + ", pending=" + pendingTail.length + '}';
  }
}
