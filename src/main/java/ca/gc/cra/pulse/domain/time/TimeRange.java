package ca.gc.cra.pulse.domain.time;

import java.time.Instant;
import java.util.Objects;

/**
 * Closed time interval; both ends are inclusive.
 *
 * @param start first included instant
 * @param end last included instant; never before {@code start}
 *
 * @since 0.1.0
 */
public record TimeRange(Instant start, Instant end) {

  /**
   * Validates constructor invariants.
   *
   * @throws IllegalArgumentException if {@code end} precedes {@code start}
   */
  public TimeRange {
    Objects.requireNonNull(start, "start");
    Objects.requireNonNull(end, "end");
    if (end.isBefore(start)) {
      throw new IllegalArgumentException("end must not precede start (was " + start + " .. " + end + ")");
    }
  }

  public boolean contains(Instant instant) {
    return !instant.isBefore(start) && !instant.isAfter(end);
  }
}
