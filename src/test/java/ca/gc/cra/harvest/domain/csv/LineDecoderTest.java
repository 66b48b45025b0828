package ca.gc.cra.harvest.domain.csv;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.nio.charset.StandardCharsets;
import org.junit.jupiter.api.Test;

class LineDecoderTest {
  private final LineDecoder decoder = new LineDecoder();

  @Test
  void stripsCarriageReturnAndByteOrderMark() {
    byte[] bytes = "\uFEFFScan Number,1\r".getBytes(StandardCharsets.UTF_8);

    LineDecoder.DecodedLine line = decoder.decode(bytes, 0, bytes.length);

    assertEquals("Scan Number,1", line.text());
    assertFalse(line.repaired());
  }

  @Test
  void decodesSliceOnly() {
    byte[] bytes = "xxabcxx".getBytes(StandardCharsets.UTF_8);

    assertEquals("abc", decoder.decode(bytes, 2, 3).text());
  }

  @Test
  void invalidBytesAreDroppedAndLineKept() {
    byte[] bytes = {'o', 'k', (byte) 0xC3, (byte) 0x28};

    LineDecoder.DecodedLine line = decoder.decode(bytes, 0, bytes.length);

    assertEquals("ok(", line.text());
    assertTrue(line.repaired());
  }

  @Test
  void cp1252DegreeSignInLabelIsDropped() {
    byte[] bytes = {'T', 'e', 'm', 'p', ' ', '(', (byte) 0xB0, 'C', ')', '\r'};

    LineDecoder.DecodedLine line = decoder.decode(bytes, 0, bytes.length);

    assertEquals("Temp (C)", line.text());
    assertTrue(line.repaired());
  }

  @Test
  void decoderRecoversAfterRepairedLine() {
    byte[] bad = {(byte) 0xFF};
    byte[] good = "1,2".getBytes(StandardCharsets.UTF_8);

    assertEquals("", decoder.decode(bad, 0, 1).text());
    LineDecoder.DecodedLine line = decoder.decode(good, 0, good.length);
    assertEquals("1,2", line.text());
    assertFalse(line.repaired());
  }
}
