package dev.ito.validation;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import org.junit.jupiter.api.Test;

class NumbersTest {
  @Test
  void parsesWithinRange() {
    assertEquals(250L, Numbers.parseInRange("pollIntervalMillis", " 250 ", 10, 60_000));
  }

  @Test
  void rejectsOutOfRangeAndGarbage() {
    IllegalArgumentException range = assertThrows(IllegalArgumentException.class,
        () -> Numbers.parseInRange("last", "-1", 0, 100));
    assertTrue(range.getMessage().startsWith("last must be between 0 and 100"));
    assertThrows(IllegalArgumentException.class, () -> Numbers.parseInRange("last", "ten", 0, 100));
    assertThrows(IllegalArgumentException.class, () -> Numbers.parseInRange("last", "", 0, 100));
  }
}
