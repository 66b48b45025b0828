package ca.gc.cra.harvest.domain.csv;

import java.nio.ByteBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.CharsetDecoder;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;

/**
 * Decodes raw line bytes as UTF-8, dropping a leading byte-order marker.
 *
 * <p>Bytes that are not valid UTF-8 (a cp1252 degree sign in a channel label, for instance) are dropped and the rest
 * of the line is kept; such lines are flagged as repaired.</p>
 *
 * <p>Instances hold reusable {@link CharsetDecoder}s and are therefore not thread-safe; the tailer owns one.</p>
 *
 * @since 0.1.0
 */
public final class LineDecoder {
  private static final char BOM = '\uFEFF';

  private final CharsetDecoder strict = StandardCharsets.UTF_8.newDecoder()
      .onMalformedInput(CodingErrorAction.REPORT)
      .onUnmappableCharacter(CodingErrorAction.REPORT);
  private final CharsetDecoder lenient = StandardCharsets.UTF_8.newDecoder()
      .onMalformedInput(CodingErrorAction.IGNORE)
      .onUnmappableCharacter(CodingErrorAction.IGNORE);

  /**
   * Decodes {@code length} bytes starting at {@code offset}, stripping one trailing carriage return.
   *
   * @param bytes source buffer
   * @param offset first byte of the line
   * @param length number of bytes in the line, excluding the line feed
   * @return decoded text, with {@link DecodedLine#repaired()} set when invalid bytes had to be dropped
   */
  public DecodedLine decode(byte[] bytes, int offset, int length) {
    int effective = length;
    if (effective > 0 && bytes[offset + effective - 1] == '\r') {
      effective--;
    }
    String text;
    boolean repaired = false;
    try {
      strict.reset();
      text = strict.decode(ByteBuffer.wrap(bytes, offset, effective)).toString();
    } catch (CharacterCodingException ex) {
      repaired = true;
      text = decodeLeniently(bytes, offset, effective);
    }
    if (!text.isEmpty() && text.charAt(0) == BOM) {
      text = text.substring(1);
    }
    return new DecodedLine(text, repaired);
  }

  private String decodeLeniently(byte[] bytes, int offset, int length) {
    lenient.reset();
    try {
      return lenient.decode(ByteBuffer.wrap(bytes, offset, length)).toString();
    } catch (CharacterCodingException ex) {
      throw new IllegalStateException("UTF-8 decoder configured to ignore errors reported one", ex);
    }
  }

  /**
   * Text of one line.
   *
   * @param text decoded characters without terminator or byte-order marker
   * @param repaired whether invalid UTF-8 bytes were dropped
   */
  public record DecodedLine(String text, boolean repaired) {}
}
