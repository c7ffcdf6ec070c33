package ca.gc.cra.pulse.domain.geo;

import java.util.List;
import java.util.Objects;

/**
 * Group of nearby locations seeded by the first unclustered location encountered.
 *
 * @param seedId id of the seed location
 * @param members seed first, then absorbed locations in input order
 *
 * @since 0.1.0
 */
public record GeoCluster(String seedId, List<GeoLocation> members) {

  /**
   * Validates constructor invariants and copies the member list.
   */
  public GeoCluster {
    seedId = Objects.requireNonNull(seedId, "seedId");
    members = List.copyOf(members);
  }

  public int size() {
    return members.size();
  }
}
