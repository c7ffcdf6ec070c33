package ca.gc.cra.pulse.domain.time;

import java.time.Instant;
import java.util.Objects;

/**
 * Counts for one time bucket.
 *
 * @param start bucket start in UTC; also the bucket's identity
 * @param pageViews events in the bucket
 * @param uniqueVisitors distinct non-empty visitor ids in the bucket
 * @param sessions distinct session ids in the bucket
 *
 * @since 0.1.0
 */
public record AggregatedBucket(Instant start, long pageViews, long uniqueVisitors, long sessions) {

  /**
   * Validates constructor invariants.
   */
  public AggregatedBucket {
    Objects.requireNonNull(start, "start");
    if (pageViews < 0 || uniqueVisitors < 0 || sessions < 0) {
      throw new IllegalArgumentException("bucket counts must be non-negative");
    }
  }

  /**
   * Creates a bucket with all counts zero, used for gap filling.
   *
   * @param start bucket start
   * @return empty bucket
   */
  public static AggregatedBucket empty(Instant start) {
    return new AggregatedBucket(start, 0, 0, 0);
  }

  /**
   * Returns the canonical period key, the ISO-8601 form of {@link #start()} (e.g. {@code 2024-01-15T10:00:00Z}).
   *
   * @return period key
   */
  public String period() {
    return start.toString();
  }

  public boolean isEmpty() {
    return pageViews == 0 && uniqueVisitors == 0 && sessions == 0;
  }

  /**
   * Sums counts field by field. Visitor and session counts are added, not de-duplicated.
   *
   * @param other bucket with the same start
   * @return summed bucket
   */
  public AggregatedBucket plus(AggregatedBucket other) {
    if (!start.equals(other.start)) {
      throw new IllegalArgumentException("cannot merge buckets " + period() + " and " + other.period());
    }
    return new AggregatedBucket(
        start, pageViews + other.pageViews, uniqueVisitors + other.uniqueVisitors, sessions + other.sessions);
  }
}
