package ca.gc.cra.pulse.domain.referrer;

import java.util.Objects;

/**
 * Classification of a single referrer URL.
 *
 * @param source traffic source label (search engine, network, host or {@code utm_source}); never {@code null}
 * @param medium medium label, see {@link TrafficMedium}; never {@code null}
 * @param campaign {@code utm_campaign} value; {@code null} when absent
 * @param searchTerm decoded search query for search-engine referrers; {@code null} when absent
 * @param internal {@code true} when the referrer host matches the site's own host
 *
 * @since 0.1.0
 */
public record ReferrerInfo(String source, String medium, String campaign, String searchTerm, boolean internal) {

  private static final ReferrerInfo DIRECT =
      new ReferrerInfo(TrafficMedium.DIRECT_SOURCE, TrafficMedium.DIRECT, null, null, false);

  /**
   * Validates constructor invariants.
   */
  public ReferrerInfo {
    source = Objects.requireNonNull(source, "source");
    medium = Objects.requireNonNull(medium, "medium");
  }

  /**
   * Returns the classification used for empty or unparseable referrers.
   *
   * @return direct traffic
   */
  public static ReferrerInfo direct() {
    return DIRECT;
  }

  public boolean isDirect() {
    return TrafficMedium.DIRECT.equals(medium);
  }

  public boolean isSearch() {
    return TrafficMedium.SEARCH.equals(medium);
  }

  public boolean isSocial() {
    return TrafficMedium.SOCIAL.equals(medium);
  }
}
