package ca.gc.cra.pulse.logging;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import org.junit.jupiter.api.Test;

class LogsTest {

  @Test
  void shortValuesAreUnchanged() {
    assertEquals("curl/8.4.0", Logs.truncate("curl/8.4.0", 128));
    assertEquals("<null>", Logs.truncate(null, 16));
  }

  @Test
  void longValuesAreCutAtByteLimit() {
    String truncated = Logs.truncate("abcdefghij", 4);

    assertEquals("abcd... (truncated, 4 of 10 bytes)", truncated);
  }

  @Test
  void multiByteCharactersAreNotSplit() {
    String truncated = Logs.truncate("ééé", 3);

    assertTrue(truncated.startsWith("é..."));
    assertTrue(truncated.endsWith("(truncated, 3 of 6 bytes)"));
  }

  @Test
  void rejectsNonPositiveLimit() {
    assertThrows(IllegalArgumentException.class, () -> Logs.truncate("x", 0));
  }
}
