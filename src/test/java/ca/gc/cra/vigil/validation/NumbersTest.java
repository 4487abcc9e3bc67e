package ca.gc.cra.vigil.validation;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import org.junit.jupiter.api.Test;

class NumbersTest {

  @Test
  void requireRangeReturnsValueWithinBounds() {
    assertEquals(64L, Numbers.requireRange("bufferSize", 64, 1, 4096));
    assertEquals(0.5d, Numbers.requireRange("scale", 0.5d, 0.01d, 8d));
  }

  @Test
  void requireRangeRejectsValuesOutsideBounds() {
    IllegalArgumentException ex =
        assertThrows(IllegalArgumentException.class, () -> Numbers.requireRange("bufferSize", 0, 1, 4096));
    assertTrue(ex.getMessage().startsWith("bufferSize must be between"));
    assertThrows(IllegalArgumentException.class, () -> Numbers.requireRange("scale", Double.NaN, 0d, 1d));
  }

  @Test
  void requirePositiveRejectsZeroAndInfinity() {
    assertEquals(30d, Numbers.requirePositive("fps", 30d));
    assertThrows(IllegalArgumentException.class, () -> Numbers.requirePositive("fps", 0d));
    assertThrows(IllegalArgumentException.class, () -> Numbers.requirePositive("fps", Double.POSITIVE_INFINITY));
  }
}
