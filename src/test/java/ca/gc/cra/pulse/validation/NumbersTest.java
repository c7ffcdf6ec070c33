package ca.gc.cra.pulse.validation;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import org.junit.jupiter.api.Test;

class NumbersTest {

  @Test
  void requireRangeReturnsValueWithinBounds() {
    assertEquals(50.0, Numbers.requireRange("percentile", 50.0, 0, 100));
    assertEquals(7L, Numbers.requireRange("limit", 7, 0, 10));
  }

  @Test
  void requireRangeRejectsValuesOutsideBounds() {
    assertThrows(IllegalArgumentException.class, () -> Numbers.requireRange("percentile", 100.5, 0, 100));
    assertThrows(IllegalArgumentException.class, () -> Numbers.requireRange("percentile", -1.0, 0, 100));
  }

  @Test
  void requireRangeRejectsNaN() {
    assertThrows(IllegalArgumentException.class, () -> Numbers.requireRange("percentile", Double.NaN, 0, 100));
  }

  @Test
  void requirePositiveRejectsZero() {
    IllegalArgumentException ex =
        assertThrows(IllegalArgumentException.class, () -> Numbers.requirePositive("window", 0));
    assertTrue(ex.getMessage().startsWith("window must be positive"));
  }

  @Test
  void requireNonNegativeAcceptsZeroAndRejectsInfinity() {
    assertEquals(0L, Numbers.requireNonNegative("limit", 0));
    assertThrows(IllegalArgumentException.class,
        () -> Numbers.requireNonNegative("threshold", Double.POSITIVE_INFINITY));
    assertThrows(IllegalArgumentException.class, () -> Numbers.requireNonNegative("limit", -1));
  }
}
