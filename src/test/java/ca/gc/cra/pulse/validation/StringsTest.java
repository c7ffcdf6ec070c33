package ca.gc.cra.pulse.validation;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;

import org.junit.jupiter.api.Test;

class StringsTest {

  @Test
  void requireNonBlankTrimsValue() {
    assertEquals("visitor-1", Strings.requireNonBlank("userId", "  visitor-1 "));
  }

  @Test
  void requireNonBlankRejectsBlankAndControlCharacters() {
    assertThrows(IllegalArgumentException.class, () -> Strings.requireNonBlank("userId", "   "));
    assertThrows(IllegalArgumentException.class, () -> Strings.requireNonBlank("userId", "a\u0007b"));
    assertThrows(NullPointerException.class, () -> Strings.requireNonBlank("userId", null));
  }

  @Test
  void trimToNullCollapsesBlankInput() {
    assertNull(Strings.trimToNull(null));
    assertNull(Strings.trimToNull(" \t"));
    assertEquals("en-CA", Strings.trimToNull(" en-CA "));
  }
}
