package ca.gc.cra.pulse.domain.metrics;

import java.util.Objects;

/**
 * Mean and percentiles of a measured quantity (load time, session duration, ...).
 *
 * @param metric metric name
 * @param value mean, one decimal
 * @param p50 median
 * @param p75 75th percentile
 * @param p95 95th percentile
 *
 * @since 0.1.0
 */
public record PerformanceMetrics(String metric, double value, double p50, double p75, double p95) {

  public PerformanceMetrics {
    metric = Objects.requireNonNull(metric, "metric");
  }
}
