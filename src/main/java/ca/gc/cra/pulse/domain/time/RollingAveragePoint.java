package ca.gc.cra.pulse.domain.time;

import java.time.Instant;
import java.util.Objects;

/**
 * One point of a trailing rolling average over buckets.
 *
 * @param start bucket start
 * @param value the bucket's own metric value
 * @param rollingAverage mean over the trailing window, rounded to one decimal
 *
 * @since 0.1.0
 */
public record RollingAveragePoint(Instant start, long value, double rollingAverage) {

  public RollingAveragePoint {
    Objects.requireNonNull(start, "start");
  }

  public String period() {
    return start.toString();
  }
}
