package ca.gc.cra.pulse.domain.event;

import ca.gc.cra.pulse.validation.Strings;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Immutable visit assembled by the session layer and consumed read-only by the metrics calculator.
 *
 * <p>The pageview list keeps insertion (chronological) order and is never reordered. The bounce flag is not
 * stored; {@link #bounced()} always derives it from the pageview count.</p>
 *
 * @param id visit identifier; never blank
 * @param userId optional anonymized visitor identifier
 * @param startTime first activity instant; never {@code null}
 * @param endTime last activity instant; {@code null} while the visit is still open
 * @param pageViews pageviews in chronological order; never {@code null}
 * @param converted optional conversion flag; {@code null} when unknown
 *
 * @since 0.1.0
 */
public record Session(
    String id,
    String userId,
    Instant startTime,
    Instant endTime,
    List<EventRecord> pageViews,
    Boolean converted) {

  /**
   * Validates constructor invariants and defensively copies the pageview list.
   */
  public Session {
    id = Strings.requireNonBlank("id", id);
    userId = Strings.trimToNull(userId);
    startTime = Objects.requireNonNull(startTime, "startTime");
    pageViews = pageViews == null ? List.of() : List.copyOf(pageViews);
    if (endTime != null && endTime.isBefore(startTime)) {
      throw new IllegalArgumentException("endTime must not precede startTime for session " + id);
    }
  }

  /**
   * Returns whether the visit bounced, i.e. recorded at most one pageview.
   *
   * @return {@code true} iff {@code pageViews().size() <= 1}
   */
  public boolean bounced() {
    return pageViews.size() <= 1;
  }

  /**
   * Returns whether the visit is known to have converted.
   *
   * @return {@code true} only when {@link #converted()} is explicitly {@code true}
   */
  public boolean isConverted() {
    return Boolean.TRUE.equals(converted);
  }

  /**
   * Returns whether the visit has been closed.
   *
   * @return {@code true} when {@link #endTime()} is present
   */
  public boolean isClosed() {
    return endTime != null;
  }

  /**
   * Returns the visit duration for closed visits.
   *
   * @return duration between start and end; empty while the visit is open
   */
  public Optional<Duration> duration() {
    return endTime == null ? Optional.empty() : Optional.of(Duration.between(startTime, endTime));
  }

  /**
   * Returns the visit duration in (fractional) seconds for closed visits.
   *
   * @return seconds between start and end; empty while the visit is open
   */
  public Optional<Double> durationSeconds() {
    return duration().map(d -> d.toMillis() / 1000.0);
  }
}
