package ca.gc.cra.pulse.domain.event;

import ca.gc.cra.pulse.validation.Strings;
import java.time.Instant;
import java.util.Objects;

/**
 * Goal or custom event attributed to a visit.
 *
 * @param sessionId visit the conversion belongs to; never blank
 * @param timestamp conversion instant; never {@code null}
 * @param eventType event name (e.g. {@code signup}); never blank
 * @param value optional monetary or scalar value
 *
 * @since 0.1.0
 */
public record ConversionEvent(String sessionId, Instant timestamp, String eventType, Double value) {

  /**
   * Validates constructor invariants.
   */
  public ConversionEvent {
    sessionId = Strings.requireNonBlank("sessionId", sessionId);
    timestamp = Objects.requireNonNull(timestamp, "timestamp");
    eventType = Strings.requireNonBlank("eventType", eventType);
  }
}
