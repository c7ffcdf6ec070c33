package ca.gc.cra.pulse.domain.metrics;

import java.util.Objects;

/**
 * Period-over-period comparison of a scalar metric.
 *
 * @param change absolute difference {@code current - previous}
 * @param changePercent growth percentage, one decimal
 * @param trend direction of the change
 *
 * @since 0.1.0
 */
public record Comparison(double change, double changePercent, Trend trend) {

  public Comparison {
    trend = Objects.requireNonNull(trend, "trend");
  }

  /** Direction of a change. */
  public enum Trend {
    UP,
    DOWN,
    FLAT
  }
}
