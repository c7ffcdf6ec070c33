package ca.gc.cra.pulse.domain.time;

import java.time.Instant;
import java.util.Objects;

/**
 * Timestamped scalar sample.
 *
 * @param timestamp sample instant
 * @param value sample value
 *
 * @since 0.1.0
 */
public record TimeSeriesPoint(Instant timestamp, double value) {

  public TimeSeriesPoint {
    Objects.requireNonNull(timestamp, "timestamp");
  }
}
