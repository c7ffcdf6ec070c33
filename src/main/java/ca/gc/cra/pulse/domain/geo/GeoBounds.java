package ca.gc.cra.pulse.domain.geo;

/**
 * Axis-aligned bounding box; edges are inclusive.
 *
 * @param north maximum latitude
 * @param south minimum latitude
 * @param east maximum longitude
 * @param west minimum longitude
 *
 * @since 0.1.0
 */
public record GeoBounds(double north, double south, double east, double west) {

  /**
   * Validates constructor invariants.
   */
  public GeoBounds {
    if (south > north) {
      throw new IllegalArgumentException("south must be <= north (was " + south + " > " + north + ")");
    }
  }

  /**
   * Returns whether a point lies inside the box, edges included.
   *
   * @param point candidate point
   * @return {@code true} when contained
   */
  public boolean contains(Coordinates point) {
    return point.latitude() <= north
        && point.latitude() >= south
        && point.longitude() <= east
        && point.longitude() >= west;
  }
}
