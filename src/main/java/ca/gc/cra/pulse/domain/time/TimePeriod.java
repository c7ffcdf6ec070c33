package ca.gc.cra.pulse.domain.time;

/**
 * Calendar unit used to bucket events. {@link #CUSTOM} buckets use a fixed window in minutes.
 *
 * @since 0.1.0
 */
public enum TimePeriod {
  HOUR,
  DAY,
  WEEK,
  MONTH,
  YEAR,
  CUSTOM
}
