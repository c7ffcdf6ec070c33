package ca.gc.cra.pulse.domain.geo;

/**
 * Latitude/longitude pair in decimal degrees.
 *
 * <p>Construction does not validate ranges; callers that need valid points check
 * {@link #isValid()} first.</p>
 *
 * @param latitude degrees north, valid range {@code [-90, 90]}
 * @param longitude degrees east, valid range {@code [-180, 180]}
 *
 * @since 0.1.0
 */
public record Coordinates(double latitude, double longitude) {

  /**
   * Returns whether both components are finite and inside their inclusive ranges.
   *
   * @return {@code true} for a point on the globe
   */
  public boolean isValid() {
    return latitude >= -90 && latitude <= 90 && longitude >= -180 && longitude <= 180;
  }
}
