package ca.gc.cra.pulse.domain.geo;

import ca.gc.cra.pulse.domain.event.EventRecord;
import ca.gc.cra.pulse.validation.Strings;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Resolved geographic attributes of one pageview.
 *
 * @param id identifier used by clustering to mark records processed; never blank
 * @param country optional country name
 * @param countryCode optional ISO 3166-1 alpha-2 code
 * @param region optional region or province
 * @param city optional city
 * @param latitude optional latitude
 * @param longitude optional longitude
 * @param timezone optional IANA zone id
 *
 * @since 0.1.0
 */
public record GeoLocation(
    String id,
    String country,
    String countryCode,
    String region,
    String city,
    Double latitude,
    Double longitude,
    String timezone) {

  /**
   * Validates constructor invariants and normalizes optional text fields.
   */
  public GeoLocation {
    id = Strings.requireNonBlank("id", id);
    country = Strings.trimToNull(country);
    countryCode = Strings.trimToNull(countryCode);
    region = Strings.trimToNull(region);
    city = Strings.trimToNull(city);
    timezone = Strings.trimToNull(timezone);
  }

  /**
   * Projects pageviews onto geo records, assigning ids {@code event-0}, {@code event-1}, ... in order.
   *
   * @param events pageviews; must not be {@code null}
   * @return one location per event
   */
  public static List<GeoLocation> fromEvents(List<EventRecord> events) {
    Objects.requireNonNull(events, "events");
    List<GeoLocation> locations = new ArrayList<>(events.size());
    for (int i = 0; i < events.size(); i++) {
      EventRecord event = events.get(i);
      locations.add(new GeoLocation(
          "event-" + i,
          event.country(),
          null,
          event.region(),
          event.city(),
          event.latitude(),
          event.longitude(),
          null));
    }
    return locations;
  }

  public boolean hasCoordinates() {
    return latitude != null && longitude != null;
  }

  /**
   * Returns the coordinates when both components are present.
   *
   * @return coordinates or empty
   */
  public Optional<Coordinates> coordinates() {
    return hasCoordinates() ? Optional.of(new Coordinates(latitude, longitude)) : Optional.empty();
  }
}
