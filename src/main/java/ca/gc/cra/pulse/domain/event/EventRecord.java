package ca.gc.cra.pulse.domain.event;

import ca.gc.cra.pulse.validation.Numbers;
import ca.gc.cra.pulse.validation.Strings;
import java.time.Instant;
import java.util.Objects;

/**
 * Immutable pageview record handed to the engine by the ingestion layer.
 *
 * <p>Geo attributes are already resolved and visitor identifiers already anonymized; the engine never sees raw
 * IP addresses.</p>
 * <p><strong>Thread-safety:</strong> Records are immutable and safe to share across threads.</p>
 *
 * @param timestamp pageview instant in UTC; never {@code null}
 * @param sessionId opaque visit identifier; never blank
 * @param userId optional anonymized visitor identifier; blank values normalize to {@code null}
 * @param path request path; never {@code null}
 * @param referrer optional referrer URL; may be {@code null}
 * @param userAgent optional user-agent header; may be {@code null}
 * @param country optional resolved country name
 * @param region optional resolved region name
 * @param city optional resolved city name
 * @param latitude optional latitude in decimal degrees
 * @param longitude optional longitude in decimal degrees
 * @param duration optional seconds spent on this page; never negative
 * @param exitPage optional flag marking the last page of the visit
 * @param language optional browser language tag (e.g. {@code en-CA})
 *
 * @since 0.1.0
 */
public record EventRecord(
    Instant timestamp,
    String sessionId,
    String userId,
    String path,
    String referrer,
    String userAgent,
    String country,
    String region,
    String city,
    Double latitude,
    Double longitude,
    Double duration,
    Boolean exitPage,
    String language) {

  /**
   * Validates constructor invariants and normalizes optional text fields.
   */
  public EventRecord {
    timestamp = Objects.requireNonNull(timestamp, "timestamp");
    sessionId = Strings.requireNonBlank("sessionId", sessionId);
    path = Objects.requireNonNull(path, "path");
    userId = Strings.trimToNull(userId);
    country = Strings.trimToNull(country);
    region = Strings.trimToNull(region);
    city = Strings.trimToNull(city);
    language = Strings.trimToNull(language);
    if (duration != null) {
      Numbers.requireNonNegative("duration", duration);
    }
  }

  /**
   * Returns whether the ingestion layer marked this pageview as the visit's exit page.
   *
   * @return {@code true} only when {@link #exitPage()} is explicitly {@code true}
   */
  public boolean isExit() {
    return Boolean.TRUE.equals(exitPage);
  }

  /**
   * Returns whether both coordinates are present.
   *
   * @return {@code true} when latitude and longitude are non-null
   */
  public boolean hasCoordinates() {
    return latitude != null && longitude != null;
  }

  /**
   * Starts a builder for a record with the mandatory fields populated.
   *
   * @param timestamp pageview instant
   * @param sessionId visit identifier
   * @param path request path
   * @return mutable builder
   */
  public static Builder builder(Instant timestamp, String sessionId, String path) {
    return new Builder(timestamp, sessionId, path);
  }

  /**
   * Mutable builder for {@link EventRecord}; not thread-safe.
   */
  public static final class Builder {
    private final Instant timestamp;
    private final String sessionId;
    private final String path;
    private String userId;
    private String referrer;
    private String userAgent;
    private String country;
    private String region;
    private String city;
    private Double latitude;
    private Double longitude;
    private Double duration;
    private Boolean exitPage;
    private String language;

    private Builder(Instant timestamp, String sessionId, String path) {
      this.timestamp = timestamp;
      this.sessionId = sessionId;
      this.path = path;
    }

    public Builder userId(String userId) {
      this.userId = userId;
      return this;
    }

    public Builder referrer(String referrer) {
      this.referrer = referrer;
      return this;
    }

    public Builder userAgent(String userAgent) {
      this.userAgent = userAgent;
      return this;
    }

    public Builder geo(String country, String region, String city) {
      this.country = country;
      this.region = region;
      this.city = city;
      return this;
    }

    public Builder coordinates(double latitude, double longitude) {
      this.latitude = latitude;
      this.longitude = longitude;
      return this;
    }

    public Builder duration(double seconds) {
      this.duration = seconds;
      return this;
    }

    public Builder exitPage(boolean exitPage) {
      this.exitPage = exitPage;
      return this;
    }

    public Builder language(String language) {
      this.language = language;
      return this;
    }

    public EventRecord build() {
      return new EventRecord(
          timestamp,
          sessionId,
          userId,
          path,
          referrer,
          userAgent,
          country,
          region,
          city,
          latitude,
          longitude,
          duration,
          exitPage,
          language);
    }
  }
}
