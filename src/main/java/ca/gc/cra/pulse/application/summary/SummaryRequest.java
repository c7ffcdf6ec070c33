package ca.gc.cra.pulse.application.summary;

import ca.gc.cra.pulse.domain.event.ConversionEvent;
import ca.gc.cra.pulse.domain.event.EventRecord;
import ca.gc.cra.pulse.domain.event.Session;
import ca.gc.cra.pulse.domain.time.Granularity;
import ca.gc.cra.pulse.domain.time.TimeRange;
import java.util.List;
import java.util.Objects;

/**
 * Input of one dashboard summary. Collections are copied so callers may reuse their own lists.
 *
 * @param events pageviews of the site; never {@code null}
 * @param sessions visits assembled from those pageviews; never {@code null}
 * @param conversions goal events; never {@code null}, empty leaves the conversion rate unset
 * @param granularity bucket width of the chart series; never {@code null}
 * @param range optional inclusive reporting window; {@code null} reports everything supplied
 * @param currentHost optional site host used to recognise internal referrers
 *
 * @since 0.1.0
 */
public record SummaryRequest(
    List<EventRecord> events,
    List<Session> sessions,
    List<ConversionEvent> conversions,
    Granularity granularity,
    TimeRange range,
    String currentHost) {

  /**
   * Validates constructor invariants and copies collections.
   */
  public SummaryRequest {
    events = List.copyOf(Objects.requireNonNull(events, "events"));
    sessions = List.copyOf(Objects.requireNonNull(sessions, "sessions"));
    conversions = List.copyOf(Objects.requireNonNull(conversions, "conversions"));
    Objects.requireNonNull(granularity, "granularity");
  }

  /**
   * Creates a request without conversions, range or host.
   *
   * @param events pageviews
   * @param sessions sessions
   * @param granularity series granularity
   * @return request
   */
  public static SummaryRequest of(List<EventRecord> events, List<Session> sessions, Granularity granularity) {
    return new SummaryRequest(events, sessions, List.of(), granularity, null, null);
  }
}
