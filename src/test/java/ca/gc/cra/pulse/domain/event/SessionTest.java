package ca.gc.cra.pulse.domain.event;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.time.Instant;
import java.util.List;
import org.junit.jupiter.api.Test;

class SessionTest {
  private static final Instant START = Instant.parse("2024-03-01T10:00:00Z");

  @Test
  void singlePageSessionBounces() {
    EventRecord view = EventRecord.builder(START, "s1", "/").build();
    Session session = new Session("s1", "u1", START, START.plusSeconds(5), List.of(view), null);

    assertTrue(session.bounced());
    assertFalse(session.isConverted());
    assertEquals(5.0, session.durationSeconds().orElseThrow());
  }

  @Test
  void openSessionHasNoDuration() {
    Session session = new Session("s2", null, START, null, null, true);

    assertFalse(session.isClosed());
    assertTrue(session.duration().isEmpty());
    assertTrue(session.pageViews().isEmpty());
    assertTrue(session.isConverted());
  }

  @Test
  void endBeforeStartIsRejected() {
    assertThrows(IllegalArgumentException.class,
        () -> new Session("s3", "u1", START, START.minusSeconds(1), List.of(), false));
  }
}
