package ca.gc.cra.pulse.domain.util;

import static org.junit.jupiter.api.Assertions.assertEquals;

import org.junit.jupiter.api.Test;

class RoundingTest {

  @Test
  void percentageRoundsToOneDecimal() {
    assertEquals(66.7, Rounding.percentage(2, 3));
    assertEquals(33.3, Rounding.percentage(1, 3));
    assertEquals(100.0, Rounding.percentage(5, 5));
  }

  @Test
  void percentageOfEmptyWholeIsZero() {
    assertEquals(0.0, Rounding.percentage(0, 0));
    assertEquals(0.0, Rounding.percentage(4, 0));
  }

  @Test
  void growthFromZeroBaseline() {
    assertEquals(100.0, Rounding.growth(12, 0));
    assertEquals(0.0, Rounding.growth(0, 0));
  }

  @Test
  void growthIsSignedPercentChange() {
    assertEquals(50.0, Rounding.growth(150, 100));
    assertEquals(-25.0, Rounding.growth(75, 100));
    assertEquals(-100.0, Rounding.growth(0, 40));
  }

  @Test
  void decimalHelpers() {
    assertEquals(1.2, Rounding.oneDecimal(1.24));
    assertEquals(1.25, Rounding.twoDecimals(1.2549));
    assertEquals(3L, Rounding.whole(2.5));
  }
}
