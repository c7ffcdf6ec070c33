package ca.gc.cra.pulse.application.geo;

import ca.gc.cra.pulse.domain.geo.Coordinates;
import ca.gc.cra.pulse.domain.geo.GeoBounds;
import ca.gc.cra.pulse.domain.geo.GeoCluster;
import ca.gc.cra.pulse.domain.geo.GeoLocation;
import ca.gc.cra.pulse.domain.geo.GeoStats;
import ca.gc.cra.pulse.domain.util.Rounding;
import ca.gc.cra.pulse.validation.Numbers;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.function.Function;

/**
 * <strong>What:</strong> Aggregates resolved geo attributes into country, region and city breakdowns.
 * <p><strong>Why:</strong> Drives the map and location tables of the dashboard.</p>
 * <p><strong>Role:</strong> Leaf application service.</p>
 * <p><strong>Thread-safety:</strong> Stateless; each call owns its accumulator map.</p>
 * <p><strong>Performance:</strong> Breakdowns are O(n log n); clustering is O(n<sup>2</sup>) distance checks.</p>
 *
 * @since 0.1.0
 */
public final class GeoAggregator {
  /** Mean Earth radius in kilometres. */
  public static final double EARTH_RADIUS_KM = 6371;
  /** Label for records without a country. */
  public static final String UNKNOWN_COUNTRY = "Unknown";
  /** Zone reported when a location carries none. */
  public static final String DEFAULT_TIMEZONE = "UTC";

  /**
   * Breaks pageviews down by country; records without a country count as {@value #UNKNOWN_COUNTRY}.
   *
   * @param locations geo records; must not be {@code null}
   * @return rows sorted by pageviews descending
   */
  public List<GeoStats> aggregateByCountry(List<GeoLocation> locations) {
    return aggregate(locations, GeoAggregator::countryOf);
  }

  /**
   * Breaks pageviews down by {@code "{country} - {region}"}; records without a region are skipped.
   *
   * @param locations geo records; must not be {@code null}
   * @return rows sorted by pageviews descending
   */
  public List<GeoStats> aggregateByRegion(List<GeoLocation> locations) {
    return aggregate(locations, loc -> loc.region() == null ? null : countryOf(loc) + " - " + loc.region());
  }

  /**
   * Breaks pageviews down by {@code "{city}, {country}"}; records without a city are skipped.
   *
   * @param locations geo records; must not be {@code null}
   * @return rows sorted by pageviews descending
   */
  public List<GeoStats> aggregateByCity(List<GeoLocation> locations) {
    return aggregate(locations, loc -> loc.city() == null ? null : loc.city() + ", " + countryOf(loc));
  }

  /**
   * Computes each country's share of pageviews.
   *
   * @param locations geo records; must not be {@code null}
   * @return country to percentage (one decimal) in first-seen order; empty for empty input
   */
  public Map<String, Double> countryDistribution(List<GeoLocation> locations) {
    Objects.requireNonNull(locations, "locations");
    Map<String, Long> counts = new LinkedHashMap<>();
    for (GeoLocation location : locations) {
      counts.merge(countryOf(location), 1L, Long::sum);
    }
    Map<String, Double> distribution = new LinkedHashMap<>();
    counts.forEach((country, count) ->
        distribution.put(country, Rounding.percentage(count, locations.size())));
    return distribution;
  }

  /**
   * Returns the {@code limit} countries with the most pageviews.
   *
   * @param locations geo records
   * @param limit maximum rows; must be non-negative
   * @return at most {@code limit} rows
   */
  public List<GeoStats> topCountries(List<GeoLocation> locations, int limit) {
    Numbers.requireNonNegative("limit", limit);
    List<GeoStats> countries = aggregateByCountry(locations);
    return countries.subList(0, Math.min(limit, countries.size()));
  }

  /**
   * Keeps records with the given ISO country code (exact match).
   *
   * @param locations geo records; must not be {@code null}
   * @param countryCode code to keep
   * @return matching records in input order
   */
  public List<GeoLocation> filterByCountryCode(List<GeoLocation> locations, String countryCode) {
    Objects.requireNonNull(locations, "locations");
    List<GeoLocation> matches = new ArrayList<>();
    for (GeoLocation location : locations) {
      if (Objects.equals(location.countryCode(), countryCode)) {
        matches.add(location);
      }
    }
    return matches;
  }

  /**
   * Great-circle distance using the Haversine formula.
   *
   * @param from first point
   * @param to second point
   * @return kilometres rounded to one decimal; {@code 0} for identical points
   * @throws IllegalArgumentException if either point is outside the valid coordinate ranges
   */
  public double calculateDistance(Coordinates from, Coordinates to) {
    requireValid("from", from);
    requireValid("to", to);
    double lat1 = Math.toRadians(from.latitude());
    double lat2 = Math.toRadians(to.latitude());
    double deltaLat = Math.toRadians(to.latitude() - from.latitude());
    double deltaLon = Math.toRadians(to.longitude() - from.longitude());

    double a = Math.sin(deltaLat / 2) * Math.sin(deltaLat / 2)
        + Math.cos(lat1) * Math.cos(lat2) * Math.sin(deltaLon / 2) * Math.sin(deltaLon / 2);
    double c = 2 * Math.atan2(Math.sqrt(a), Math.sqrt(1 - a));
    return Rounding.oneDecimal(EARTH_RADIUS_KM * c);
  }

  public boolean isWithinBounds(Coordinates point, GeoBounds bounds) {
    return bounds.contains(point);
  }

  public boolean isValidCoordinates(double latitude, double longitude) {
    return new Coordinates(latitude, longitude).isValid();
  }

  /**
   * Returns the location's zone id.
   *
   * @param location geo record
   * @return zone id or {@value #DEFAULT_TIMEZONE}
   */
  public String timezoneOf(GeoLocation location) {
    return location.timezone() == null ? DEFAULT_TIMEZONE : location.timezone();
  }

  /**
   * Greedy single-pass clustering.
   *
   * <p>Each unprocessed location with coordinates seeds a cluster and absorbs every other unprocessed
   * location within {@code maxDistanceKm} of the seed. Locations without coordinates are ignored.</p>
   *
   * @param locations geo records with unique ids; must not be {@code null}
   * @param maxDistanceKm inclusive radius around each seed; must be non-negative
   * @return clusters in seed order
   */
  public List<GeoCluster> groupNearbyLocations(List<GeoLocation> locations, double maxDistanceKm) {
    Objects.requireNonNull(locations, "locations");
    Numbers.requireNonNegative("maxDistanceKm", maxDistanceKm);
    List<GeoCluster> clusters = new ArrayList<>();
    Set<String> processed = new HashSet<>();
    for (GeoLocation seed : locations) {
      if (processed.contains(seed.id()) || !hasValidCoordinates(seed)) {
        continue;
      }
      Coordinates origin = new Coordinates(seed.latitude(), seed.longitude());
      List<GeoLocation> members = new ArrayList<>();
      members.add(seed);
      processed.add(seed.id());
      for (GeoLocation candidate : locations) {
        if (processed.contains(candidate.id()) || !hasValidCoordinates(candidate)) {
          continue;
        }
        Coordinates point = new Coordinates(candidate.latitude(), candidate.longitude());
        if (calculateDistance(origin, point) <= maxDistanceKm) {
          members.add(candidate);
          processed.add(candidate.id());
        }
      }
      clusters.add(new GeoCluster(seed.id(), members));
    }
    return clusters;
  }

  private static List<GeoStats> aggregate(List<GeoLocation> locations, Function<GeoLocation, String> keyOf) {
    Objects.requireNonNull(locations, "locations");
    Map<String, Accumulator> groups = new LinkedHashMap<>();
    for (GeoLocation location : locations) {
      String key = keyOf.apply(location);
      if (key != null) {
        groups.computeIfAbsent(key, k -> new Accumulator()).add(location);
      }
    }
    List<GeoStats> rows = new ArrayList<>(groups.size());
    groups.forEach((key, acc) -> rows.add(new GeoStats(key, acc.ids.size(), acc.pageViews, acc.ids.size())));
    rows.sort(Comparator.comparingLong(GeoStats::pageViews).reversed());
    return List.copyOf(rows);
  }

  private static String countryOf(GeoLocation location) {
    return location.country() == null ? UNKNOWN_COUNTRY : location.country();
  }

  private static boolean hasValidCoordinates(GeoLocation location) {
    return location.coordinates().map(Coordinates::isValid).orElse(false);
  }

  private static void requireValid(String name, Coordinates point) {
    Objects.requireNonNull(point, name);
    if (!point.isValid()) {
      throw new IllegalArgumentException(name + " must be valid coordinates (was " + point + ")");
    }
  }

  /** Per-key accumulator; record ids stand in for visitor and session identity. */
  private static final class Accumulator {
    private final Set<String> ids = new HashSet<>();
    private long pageViews;

    void add(GeoLocation location) {
      ids.add(location.id());
      pageViews++;
    }
  }
}
