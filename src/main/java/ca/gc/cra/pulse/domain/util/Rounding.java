package ca.gc.cra.pulse.domain.util;

/**
 * Rounding helpers shared by every statistic PULSE reports.
 *
 * <p>All helpers round half-up (ties toward positive infinity, matching {@link Math#round(double)}). Ratios are
 * zero-safe: a zero denominator yields {@code 0} instead of {@code NaN}.</p>
 *
 * @since 0.1.0
 */
public final class Rounding {
  private Rounding() {
    // Utility
  }

  /**
   * Rounds to one decimal place.
   *
   * @param value raw value
   * @return value rounded half-up to one decimal
   */
  public static double oneDecimal(double value) {
    return Math.round(value * 10) / 10.0;
  }

  /**
   * Rounds to two decimal places.
   *
   * @param value raw value
   * @return value rounded half-up to two decimals
   */
  public static double twoDecimals(double value) {
    return Math.round(value * 100) / 100.0;
  }

  /**
   * Rounds to a whole number, used for second-granularity durations.
   *
   * @param value raw value
   * @return value rounded half-up to the nearest integer
   */
  public static long whole(double value) {
    return Math.round(value);
  }

  /**
   * Computes {@code part / whole} as a percentage rounded to one decimal place.
   *
   * @param part numerator count
   * @param whole denominator count
   * @return percentage in {@code [0, 100]} for sane inputs; {@code 0} when {@code whole == 0}
   */
  public static double percentage(long part, long whole) {
    if (whole == 0) {
      return 0;
    }
    return Math.round(((double) part / whole) * 100 * 10) / 10.0;
  }

  /**
   * Computes the percentage change from {@code previous} to {@code current}, rounded to one decimal.
   *
   * <p>A zero baseline reports {@code 100} when {@code current} is positive and {@code 0} otherwise.</p>
   *
   * @param current value for the current period
   * @param previous value for the baseline period
   * @return growth percentage
   */
  public static double growth(double current, double previous) {
    if (previous == 0) {
      return current > 0 ? 100 : 0;
    }
    return Math.round(((current - previous) / previous) * 100 * 10) / 10.0;
  }
}
