package ca.gc.cra.trace.validation;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import org.junit.jupiter.api.Test;

class NumbersTest {

  @Test
  void requireRangeReturnsValueWithinBounds() {
    assertEquals(8, Numbers.requireRange("hashLength", 8, 4, 64));
  }

  @Test
  void requireRangeRejectsValuesBelowMinimum() {
    assertThrows(IllegalArgumentException.class, () -> Numbers.requireRange("hashLength", 3, 4, 64));
  }

  @Test
  void requireRangeRejectsValuesAboveMaximum() {
    assertThrows(IllegalArgumentException.class, () -> Numbers.requireRange("parseParallelism", 65, 1, 64));
  }
}
