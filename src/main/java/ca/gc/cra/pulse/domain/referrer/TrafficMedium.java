package ca.gc.cra.pulse.domain.referrer;

/**
 * Medium labels assigned by the referrer classifier.
 *
 * <p>Campaign-tagged referrers may carry any {@code utm_medium} value, so mediums are plain strings rather than
 * a closed enum; these constants cover the values the classifier itself assigns.</p>
 *
 * @since 0.1.0
 */
public final class TrafficMedium {
  public static final String DIRECT = "direct";
  public static final String SEARCH = "search";
  public static final String SOCIAL = "social";
  public static final String REFERRAL = "referral";
  public static final String INTERNAL = "internal";
  public static final String EMAIL = "email";

  /** Source label reported for traffic without a usable referrer. */
  public static final String DIRECT_SOURCE = "(direct)";

  private TrafficMedium() {
    // Utility
  }
}
