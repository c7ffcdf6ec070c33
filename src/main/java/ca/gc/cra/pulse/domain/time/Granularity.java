package ca.gc.cra.pulse.domain.time;

import ca.gc.cra.pulse.validation.Numbers;
import java.util.Locale;
import java.util.Objects;

/**
 * Bucket width for time aggregation: a calendar period, or a custom window in minutes.
 *
 * @param period calendar unit; never {@code null}
 * @param windowMinutes window width for {@link TimePeriod#CUSTOM}; {@code 0} for calendar periods
 *
 * @since 0.1.0
 */
public record Granularity(TimePeriod period, long windowMinutes) {
  private static final Granularity HOUR = new Granularity(TimePeriod.HOUR, 0);
  private static final Granularity DAY = new Granularity(TimePeriod.DAY, 0);
  private static final Granularity WEEK = new Granularity(TimePeriod.WEEK, 0);
  private static final Granularity MONTH = new Granularity(TimePeriod.MONTH, 0);
  private static final Granularity YEAR = new Granularity(TimePeriod.YEAR, 0);

  /** Largest custom window whose width still fits in a {@code long} of milliseconds. */
  public static final long MAX_WINDOW_MINUTES = Long.MAX_VALUE / 60_000L;

  /**
   * Validates constructor invariants.
   *
   * @throws IllegalArgumentException if a custom window is outside {@code [1, MAX_WINDOW_MINUTES]} or a calendar
   *     period carries a window
   */
  public Granularity {
    Objects.requireNonNull(period, "period");
    if (period == TimePeriod.CUSTOM) {
      Numbers.requireRange("windowMinutes", windowMinutes, 1, MAX_WINDOW_MINUTES);
    } else if (windowMinutes != 0) {
      throw new IllegalArgumentException(
          "windowMinutes must be 0 for " + period + " (was " + windowMinutes + ")");
    }
  }

  public static Granularity hour() {
    return HOUR;
  }

  public static Granularity day() {
    return DAY;
  }

  public static Granularity week() {
    return WEEK;
  }

  public static Granularity month() {
    return MONTH;
  }

  public static Granularity year() {
    return YEAR;
  }

  /**
   * Creates a fixed-width window aligned to the epoch.
   *
   * @param minutes window width; must be positive and at most {@link #MAX_WINDOW_MINUTES}
   * @return custom granularity
   * @throws IllegalArgumentException if {@code minutes} is out of range
   */
  public static Granularity customMinutes(long minutes) {
    return new Granularity(TimePeriod.CUSTOM, minutes);
  }

  /**
   * Parses {@code hour}, {@code day}, {@code week}, {@code month}, {@code year} or a number of minutes.
   *
   * @param text granularity name or positive minute count
   * @return parsed granularity
   * @throws IllegalArgumentException if the text is neither
   */
  public static Granularity parse(String text) {
    Objects.requireNonNull(text, "granularity");
    String normalized = text.trim().toLowerCase(Locale.ROOT);
    switch (normalized) {
      case "hour":
        return HOUR;
      case "day":
        return DAY;
      case "week":
        return WEEK;
      case "month":
        return MONTH;
      case "year":
        return YEAR;
      default:
        try {
          return customMinutes(Long.parseLong(normalized));
        } catch (NumberFormatException ex) {
          throw new IllegalArgumentException("Unknown granularity: " + text, ex);
        }
    }
  }

  /**
   * Returns the custom window in milliseconds.
   *
   * @return window width; {@code 0} for calendar periods
   */
  public long windowMillis() {
    return windowMinutes * 60_000L;
  }

  @Override
  public String toString() {
    return period == TimePeriod.CUSTOM ? windowMinutes + "m" : period.name().toLowerCase(Locale.ROOT);
  }
}
