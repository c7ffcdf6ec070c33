package ca.gc.cra.pulse.domain.metrics;

import java.util.Objects;

/**
 * A path whose pageviews grew between two periods.
 *
 * @param path request path
 * @param current pageviews in the current period
 * @param previous pageviews in the previous period
 * @param growth percentage growth, whole number; {@code 100} for new paths
 *
 * @since 0.1.0
 */
public record TrendingPage(String path, long current, long previous, double growth) {

  public TrendingPage {
    path = Objects.requireNonNull(path, "path");
  }
}
