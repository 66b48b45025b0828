package ca.gc.cra.harvest.validation;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import org.junit.jupiter.api.Test;

class NumbersTest {

  @Test
  void requireRangeReturnsValueWithinBounds() {
    assertEquals(10, Numbers.requireRange("batchRows", 10, 1, 64));
    assertEquals(0.5, Numbers.requireRange("interval", 0.5, 0.01, 86_400));
  }

  @Test
  void requireRangeRejectsValuesOutsideBounds() {
    assertThrows(IllegalArgumentException.class, () -> Numbers.requireRange("batchRows", 0, 1, 64));
    assertThrows(IllegalArgumentException.class, () -> Numbers.requireRange("batchRows", 65, 1, 64));
  }

  @Test
  void decimalRangeRejectsNonFiniteValues() {
    assertThrows(IllegalArgumentException.class,
        () -> Numbers.requireRange("interval", Double.NaN, 0.01, 86_400));
  }
}
