package ca.gc.cra.pulse.application.time;

import ca.gc.cra.pulse.domain.event.EventRecord;
import ca.gc.cra.pulse.domain.time.AggregatedBucket;
import ca.gc.cra.pulse.domain.time.BucketMetric;
import ca.gc.cra.pulse.domain.time.Granularity;
import ca.gc.cra.pulse.domain.time.RollingAveragePoint;
import ca.gc.cra.pulse.domain.time.TimeRange;
import ca.gc.cra.pulse.domain.util.Rounding;
import ca.gc.cra.pulse.validation.Numbers;
import java.time.DayOfWeek;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.time.temporal.ChronoUnit;
import java.time.temporal.TemporalAdjusters;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.TreeMap;

/**
 * <strong>What:</strong> Buckets pageviews by hour, day, week, month, year or a custom window and derives series
 * statistics over the buckets.
 * <p><strong>Why:</strong> Produces the chart series of the dashboard, including zero buckets for quiet periods.</p>
 * <p><strong>Role:</strong> Application service; owns bucket-key derivation for every granularity.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Group events into UTC buckets keyed by their start instant.</li>
 *   <li>Fill gaps, merge datasets, rank periods and compute rolling averages and growth.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Immutable after construction; each call owns its accumulator map and
 * returns an immutable sorted list.</p>
 * <p><strong>Performance:</strong> O(n log b) for n events and b buckets.</p>
 *
 * @implNote Weeks start on the configured day (Sunday unless overridden). Buckets are always returned in
 * ascending start order.
 * @since 0.1.0
 */
public final class TimePeriodAggregator {
  /** Week start used when none is configured. */
  public static final DayOfWeek DEFAULT_WEEK_START = DayOfWeek.SUNDAY;

  private final DayOfWeek weekStart;

  /** Creates an aggregator whose weeks start on Sunday. */
  public TimePeriodAggregator() {
    this(DEFAULT_WEEK_START);
  }

  /**
   * Creates an aggregator with an explicit week start.
   *
   * @param weekStart first day of each week bucket; must not be {@code null}
   */
  public TimePeriodAggregator(DayOfWeek weekStart) {
    this.weekStart = Objects.requireNonNull(weekStart, "weekStart");
  }

  public DayOfWeek weekStart() {
    return weekStart;
  }

  /**
   * Aggregates all events.
   *
   * @param events pageviews; must not be {@code null}
   * @param granularity bucket width
   * @return buckets in ascending start order
   */
  public List<AggregatedBucket> aggregate(List<EventRecord> events, Granularity granularity) {
    return aggregate(events, granularity, null);
  }

  /**
   * Aggregates events falling inside an optional range.
   *
   * @param events pageviews; must not be {@code null}
   * @param granularity bucket width; must not be {@code null}
   * @param range inclusive filter; {@code null} keeps every event
   * @return buckets in ascending start order; empty when nothing passes the filter
   */
  public List<AggregatedBucket> aggregate(List<EventRecord> events, Granularity granularity, TimeRange range) {
    Objects.requireNonNull(events, "events");
    Objects.requireNonNull(granularity, "granularity");
    Map<Instant, BucketAccumulator> buckets = new TreeMap<>();
    for (EventRecord event : events) {
      if (range != null && !range.contains(event.timestamp())) {
        continue;
      }
      Instant start = bucketStart(event.timestamp(), granularity);
      buckets.computeIfAbsent(start, BucketAccumulator::new).add(event);
    }
    List<AggregatedBucket> result = new ArrayList<>(buckets.size());
    for (BucketAccumulator accumulator : buckets.values()) {
      result.add(accumulator.toBucket());
    }
    return List.copyOf(result);
  }

  public List<AggregatedBucket> aggregateByHour(List<EventRecord> events, TimeRange range) {
    return aggregate(events, Granularity.hour(), range);
  }

  public List<AggregatedBucket> aggregateByDay(List<EventRecord> events, TimeRange range) {
    return aggregate(events, Granularity.day(), range);
  }

  public List<AggregatedBucket> aggregateByWeek(List<EventRecord> events, TimeRange range) {
    return aggregate(events, Granularity.week(), range);
  }

  public List<AggregatedBucket> aggregateByMonth(List<EventRecord> events, TimeRange range) {
    return aggregate(events, Granularity.month(), range);
  }

  /**
   * Aggregates into epoch-aligned windows of a fixed number of minutes.
   *
   * @param events pageviews
   * @param windowMinutes window width; must be positive
   * @param range optional inclusive filter
   * @return buckets in ascending start order
   * @throws IllegalArgumentException if {@code windowMinutes <= 0}
   */
  public List<AggregatedBucket> aggregateByCustomWindow(
      List<EventRecord> events, long windowMinutes, TimeRange range) {
    return aggregate(events, Granularity.customMinutes(windowMinutes), range);
  }

  /**
   * Returns the start of the bucket containing {@code timestamp}.
   *
   * @param timestamp instant to bucket
   * @param granularity bucket width
   * @return bucket start in UTC
   */
  public Instant bucketStart(Instant timestamp, Granularity granularity) {
    ZonedDateTime utc = timestamp.atZone(ZoneOffset.UTC);
    switch (granularity.period()) {
      case HOUR:
        return utc.truncatedTo(ChronoUnit.HOURS).toInstant();
      case DAY:
        return utc.truncatedTo(ChronoUnit.DAYS).toInstant();
      case WEEK:
        LocalDate first = utc.toLocalDate().with(TemporalAdjusters.previousOrSame(weekStart));
        return first.atStartOfDay(ZoneOffset.UTC).toInstant();
      case MONTH:
        return utc.toLocalDate().withDayOfMonth(1).atStartOfDay(ZoneOffset.UTC).toInstant();
      case YEAR:
        return utc.toLocalDate().withDayOfYear(1).atStartOfDay(ZoneOffset.UTC).toInstant();
      case CUSTOM:
        long windowMillis = granularity.windowMillis();
        return Instant.ofEpochMilli(Math.floorDiv(timestamp.toEpochMilli(), windowMillis) * windowMillis);
      default:
        throw new IllegalStateException("Unhandled period " + granularity.period());
    }
  }

  /**
   * Returns the start of the bucket following the one starting at {@code bucketStart}.
   *
   * @param bucketStart aligned bucket start
   * @param granularity bucket width
   * @return next bucket start
   */
  public Instant nextBucketStart(Instant bucketStart, Granularity granularity) {
    ZonedDateTime utc = bucketStart.atZone(ZoneOffset.UTC);
    switch (granularity.period()) {
      case HOUR:
        return utc.plusHours(1).toInstant();
      case DAY:
        return utc.plusDays(1).toInstant();
      case WEEK:
        return utc.plusWeeks(1).toInstant();
      case MONTH:
        return utc.plusMonths(1).toInstant();
      case YEAR:
        return utc.plusYears(1).toInstant();
      case CUSTOM:
        return bucketStart.plusMillis(granularity.windowMillis());
      default:
        throw new IllegalStateException("Unhandled period " + granularity.period());
    }
  }

  /**
   * Inserts zero buckets for every step of {@code range} missing from {@code buckets}.
   *
   * <p>Existing buckets are kept unchanged, including any that fall outside the range. An empty input stays
   * empty: there is nothing to chart yet.</p>
   *
   * @param buckets aggregated buckets; must not be {@code null}
   * @param granularity granularity the buckets were aggregated with
   * @param range range to cover; must not be {@code null}
   * @return buckets in ascending start order
   */
  public List<AggregatedBucket> fillMissingPeriods(
      List<AggregatedBucket> buckets, Granularity granularity, TimeRange range) {
    Objects.requireNonNull(buckets, "buckets");
    Objects.requireNonNull(granularity, "granularity");
    Objects.requireNonNull(range, "range");
    if (buckets.isEmpty()) {
      return List.of();
    }
    Map<Instant, AggregatedBucket> filled = new TreeMap<>();
    for (AggregatedBucket bucket : buckets) {
      filled.put(bucket.start(), bucket);
    }
    Instant cursor = bucketStart(range.start(), granularity);
    while (!cursor.isAfter(range.end())) {
      filled.putIfAbsent(cursor, AggregatedBucket.empty(cursor));
      cursor = nextBucketStart(cursor, granularity);
    }
    return List.copyOf(filled.values());
  }

  /**
   * Sums buckets sharing a start across datasets.
   *
   * @param datasets bucket lists; must not be {@code null}
   * @return merged buckets in ascending start order
   */
  public List<AggregatedBucket> merge(Collection<? extends List<AggregatedBucket>> datasets) {
    Objects.requireNonNull(datasets, "datasets");
    Map<Instant, AggregatedBucket> merged = new TreeMap<>();
    for (List<AggregatedBucket> dataset : datasets) {
      for (AggregatedBucket bucket : dataset) {
        merged.merge(bucket.start(), bucket, AggregatedBucket::plus);
      }
    }
    return List.copyOf(merged.values());
  }

  /**
   * Trailing rolling average; the window shrinks near the start of the series.
   *
   * @param buckets buckets in chart order; not modified
   * @param windowSize number of buckets per window; must be positive
   * @param metric count to average
   * @return one point per bucket, averages rounded to one decimal
   * @throws IllegalArgumentException if {@code windowSize <= 0}
   */
  public List<RollingAveragePoint> rollingAverage(
      List<AggregatedBucket> buckets, int windowSize, BucketMetric metric) {
    Objects.requireNonNull(buckets, "buckets");
    Objects.requireNonNull(metric, "metric");
    Numbers.requirePositive("windowSize", windowSize);
    List<RollingAveragePoint> points = new ArrayList<>(buckets.size());
    long windowSum = 0;
    for (int i = 0; i < buckets.size(); i++) {
      long value = metric.of(buckets.get(i));
      windowSum += value;
      if (i >= windowSize) {
        windowSum -= metric.of(buckets.get(i - windowSize));
      }
      int width = Math.min(i + 1, windowSize);
      points.add(new RollingAveragePoint(
          buckets.get(i).start(), value, Rounding.oneDecimal((double) windowSum / width)));
    }
    return List.copyOf(points);
  }

  /**
   * Percentage change of pageviews between two buckets.
   *
   * @param current current bucket
   * @param previous baseline bucket
   * @return growth percentage, one decimal
   */
  public double growthRate(AggregatedBucket current, AggregatedBucket previous) {
    return growthRate(current.pageViews(), previous.pageViews());
  }

  /**
   * Percentage change from {@code previous} to {@code current}; {@code 100} from a zero baseline, {@code 0}
   * when both are zero.
   *
   * @param current current value
   * @param previous baseline value
   * @return growth percentage, one decimal
   */
  public double growthRate(long current, long previous) {
    return Rounding.growth(current, previous);
  }

  /**
   * Returns the {@code limit} busiest buckets.
   *
   * @param buckets buckets; not modified
   * @param limit maximum rows; must be non-negative
   * @return buckets by pageviews descending, ties in input order
   */
  public List<AggregatedBucket> topPeriods(List<AggregatedBucket> buckets, int limit) {
    Objects.requireNonNull(buckets, "buckets");
    Numbers.requireNonNegative("limit", limit);
    List<AggregatedBucket> sorted = new ArrayList<>(buckets);
    sorted.sort(Comparator.comparingLong(AggregatedBucket::pageViews).reversed());
    return List.copyOf(sorted.subList(0, Math.min(limit, sorted.size())));
  }

  private static final class BucketAccumulator {
    private final Instant start;
    private final Set<String> visitors = new HashSet<>();
    private final Set<String> sessions = new HashSet<>();
    private long pageViews;

    BucketAccumulator(Instant start) {
      this.start = start;
    }

    void add(EventRecord event) {
      pageViews++;
      sessions.add(event.sessionId());
      if (event.userId() != null) {
        visitors.add(event.userId());
      }
    }

    AggregatedBucket toBucket() {
      return new AggregatedBucket(start, pageViews, visitors.size(), sessions.size());
    }
  }
}
