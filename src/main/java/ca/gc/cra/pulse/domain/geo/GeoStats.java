package ca.gc.cra.pulse.domain.geo;

import java.util.Objects;

/**
 * One row of a country, region or city breakdown.
 *
 * @param location breakdown key, e.g. {@code Canada}, {@code Canada - Ontario} or {@code Ottawa, Canada}
 * @param visitors distinct visitors
 * @param pageViews pageviews
 * @param sessions distinct sessions
 *
 * @since 0.1.0
 */
public record GeoStats(String location, long visitors, long pageViews, long sessions) {

  /**
   * Validates constructor invariants.
   */
  public GeoStats {
    location = Objects.requireNonNull(location, "location");
  }
}
