package ca.gc.cra.pulse.domain.event;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.time.Instant;
import org.junit.jupiter.api.Test;

class EventRecordTest {
  private static final Instant TS = Instant.parse("2024-03-01T10:15:00Z");

  @Test
  void builderNormalizesBlankOptionalFields() {
    EventRecord event = EventRecord.builder(TS, "s1", "/pricing")
        .userId("  ")
        .geo(" Canada ", "", null)
        .language(" fr-CA ")
        .build();

    assertNull(event.userId());
    assertEquals("Canada", event.country());
    assertNull(event.region());
    assertEquals("fr-CA", event.language());
    assertFalse(event.hasCoordinates());
    assertFalse(event.isExit());
  }

  @Test
  void coordinatesAndExitFlag() {
    EventRecord event = EventRecord.builder(TS, "s1", "/").coordinates(45.42, -75.69).exitPage(true).build();

    assertTrue(event.hasCoordinates());
    assertTrue(event.isExit());
  }

  @Test
  void rejectsBlankSessionAndNegativeDuration() {
    assertThrows(IllegalArgumentException.class, () -> EventRecord.builder(TS, " ", "/").build());
    assertThrows(IllegalArgumentException.class,
        () -> EventRecord.builder(TS, "s1", "/").duration(-1).build());
  }
}
