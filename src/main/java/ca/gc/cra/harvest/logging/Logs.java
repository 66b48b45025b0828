package ca.gc.cra.harvest.logging;

import java.nio.ByteBuffer;
import java.nio.CharBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.CharsetDecoder;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;

/**
 * <strong>What:</strong> Bounds text copied from export files into log messages.
 * <p><strong>Why:</strong> Header and data lines can be thousands of columns wide; debug logs keep only a preview.</p>
 * <p><strong>Thread-safety:</strong> Stateless utilities safe for concurrent use.</p>
 *
 * @implNote Decoding uses {@link CodingErrorAction#IGNORE} so truncation mid-codepoint does not throw.
 * @since 0.1.0
 * @see LoggingConfigurator
 */
public final class Logs {
  /** Default preview budget for file lines. */
  public static final int LINE_PREVIEW_BYTES = 160;

  private static final String NULL_PLACEHOLDER = "<null>";

  private Logs() {
    // Utility
  }

  /**
   * Truncates a string to the requested UTF-8 byte length, appending the original length.
   *
   * @param value string to truncate; {@code null} results in {@code "<null>"}
   * @param maxBytes maximum number of bytes to retain; must be positive
   * @return truncated string when the input exceeds {@code maxBytes}; otherwise the original value
   * @throws IllegalArgumentException if {@code maxBytes} is not positive
   */
  public static String truncate(String value, int maxBytes) {
    if (value == null) {
      return NULL_PLACEHOLDER;
    }
    if (maxBytes <= 0) {
      throw new IllegalArgumentException("maxBytes must be positive");
    }
    byte[] bytes = value.getBytes(StandardCharsets.UTF_8);
    if (bytes.length <= maxBytes) {
      return value;
    }
    CharsetDecoder decoder = StandardCharsets.UTF_8.newDecoder()
        .onMalformedInput(CodingErrorAction.IGNORE)
        .onUnmappableCharacter(CodingErrorAction.IGNORE);
    try {
      CharBuffer buffer = decoder.decode(ByteBuffer.wrap(bytes, 0, maxBytes));
      return buffer + "... (truncated, " + maxBytes + " of " + bytes.length + " bytes)";
    } catch (CharacterCodingException ex) {
      String lossy = new String(bytes, 0, maxBytes, StandardCharsets.UTF_8);
      return lossy + "... (truncated)";
    }
  }

  /**
   * Shortcut for {@link #truncate(String, int)} with {@link #LINE_PREVIEW_BYTES}.
   *
   * @param line decoded file line
   * @return bounded preview
   */
  public static String preview(String line) {
    return truncate(line, LINE_PREVIEW_BYTES);
  }
}
