package dev.ito.validation;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;

import org.junit.jupiter.api.Test;

class StringsTest {
  @Test
  void requireNonBlankTrims() {
    assertEquals("add-login", Strings.requireNonBlank("change", "  add-login "));
  }

  @Test
  void requireNonBlankRejectsBlankAndControlCharacters() {
    IllegalArgumentException blank =
        assertThrows(IllegalArgumentException.class, () -> Strings.requireNonBlank("change", " "));
    assertEquals("change must not be blank", blank.getMessage());
    assertThrows(IllegalArgumentException.class, () -> Strings.requireNonBlank(null, "a\u0007b"));
    assertThrows(NullPointerException.class, () -> Strings.requireNonBlank("change", null));
  }

  @Test
  void blankToNull() {
    assertNull(Strings.blankToNull("   "));
    assertNull(Strings.blankToNull(null));
    assertEquals("x", Strings.blankToNull(" x "));
  }
}
