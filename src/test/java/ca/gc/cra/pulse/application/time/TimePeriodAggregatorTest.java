package ca.gc.cra.pulse.application.time;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.pulse.domain.event.EventRecord;
import ca.gc.cra.pulse.domain.time.AggregatedBucket;
import ca.gc.cra.pulse.domain.time.BucketMetric;
import ca.gc.cra.pulse.domain.time.Granularity;
import ca.gc.cra.pulse.domain.time.RollingAveragePoint;
import ca.gc.cra.pulse.domain.time.TimeRange;
import java.time.DayOfWeek;
import java.time.Instant;
import java.util.List;
import java.util.stream.Collectors;
import org.junit.jupiter.api.Test;

class TimePeriodAggregatorTest {
  private final TimePeriodAggregator aggregator = new TimePeriodAggregator();

  private static Instant at(String iso) {
    return Instant.parse(iso);
  }

  private static EventRecord view(String iso, String session, String user) {
    return EventRecord.builder(at(iso), session, "/").userId(user).build();
  }

  private static AggregatedBucket bucket(String iso, long pageViews) {
    return new AggregatedBucket(at(iso), pageViews, pageViews, pageViews);
  }

  private final List<EventRecord> morning = List.of(
      view("2024-03-06T10:05:00Z", "s1", "u1"),
      view("2024-03-06T10:40:00Z", "s2", "u2"),
      view("2024-03-06T11:10:00Z", "s1", "u1"));

  @Test
  void hourlyBucketsCountPageViewsVisitorsAndSessions() {
    List<AggregatedBucket> buckets = aggregator.aggregateByHour(morning, null);

    assertEquals(List.of(
        new AggregatedBucket(at("2024-03-06T10:00:00Z"), 2, 2, 2),
        new AggregatedBucket(at("2024-03-06T11:00:00Z"), 1, 1, 1)), buckets);
    assertEquals("2024-03-06T10:00:00Z", buckets.get(0).period());
  }

  @Test
  void bucketPageViewsSumToInput() {
    long total = aggregator.aggregateByDay(morning, null).stream().mapToLong(AggregatedBucket::pageViews).sum();

    assertEquals(morning.size(), total);
  }

  @Test
  void weekAndMonthHelpersUseCalendarStarts() {
    List<AggregatedBucket> weeks = aggregator.aggregateByWeek(morning, null);
    List<AggregatedBucket> months = aggregator.aggregateByMonth(morning, null);

    assertEquals(List.of(new AggregatedBucket(at("2024-03-03T00:00:00Z"), 3, 2, 2)), weeks);
    assertEquals(List.of(new AggregatedBucket(at("2024-03-01T00:00:00Z"), 3, 2, 2)), months);
  }

  @Test
  void rangeExcludesOutsideEvents() {
    TimeRange range = new TimeRange(at("2024-03-06T10:30:00Z"), at("2024-03-06T11:10:00Z"));

    List<AggregatedBucket> buckets = aggregator.aggregateByHour(morning, range);

    assertEquals(2, buckets.stream().mapToLong(AggregatedBucket::pageViews).sum());
  }

  @Test
  void anonymousViewsCountSessionsButNotVisitors() {
    List<AggregatedBucket> buckets = aggregator.aggregate(
        List.of(view("2024-03-06T10:05:00Z", "s9", null)), Granularity.hour());

    assertEquals(new AggregatedBucket(at("2024-03-06T10:00:00Z"), 1, 0, 1), buckets.get(0));
  }

  @Test
  void weeksStartOnSundayByDefault() {
    assertEquals(DayOfWeek.SUNDAY, aggregator.weekStart());
    assertEquals(at("2024-03-03T00:00:00Z"), aggregator.bucketStart(at("2024-03-06T15:00:00Z"), Granularity.week()));
    assertEquals(at("2024-03-03T00:00:00Z"), aggregator.bucketStart(at("2024-03-03T00:00:00Z"), Granularity.week()));
  }

  @Test
  void mondayWeeks() {
    TimePeriodAggregator monday = new TimePeriodAggregator(DayOfWeek.MONDAY);

    assertEquals(at("2024-03-04T00:00:00Z"), monday.bucketStart(at("2024-03-06T15:00:00Z"), Granularity.week()));
    assertEquals(at("2024-02-26T00:00:00Z"), monday.bucketStart(at("2024-03-03T23:59:59Z"), Granularity.week()));
  }

  @Test
  void monthYearAndCustomBuckets() {
    Instant ts = at("2024-03-06T10:47:13Z");

    assertEquals(at("2024-03-01T00:00:00Z"), aggregator.bucketStart(ts, Granularity.month()));
    assertEquals(at("2024-01-01T00:00:00Z"), aggregator.bucketStart(ts, Granularity.year()));
    assertEquals(at("2024-03-06T10:45:00Z"), aggregator.bucketStart(ts, Granularity.customMinutes(15)));
    assertEquals(at("2024-04-01T00:00:00Z"), aggregator.nextBucketStart(at("2024-03-01T00:00:00Z"), Granularity.month()));
  }

  @Test
  void customWindowAggregation() {
    List<AggregatedBucket> buckets = aggregator.aggregateByCustomWindow(morning, 30, null);

    assertEquals(List.of(at("2024-03-06T10:00:00Z"), at("2024-03-06T10:30:00Z"), at("2024-03-06T11:00:00Z")),
        buckets.stream().map(AggregatedBucket::start).collect(Collectors.toList()));
    assertThrows(IllegalArgumentException.class, () -> aggregator.aggregateByCustomWindow(morning, 0, null));
  }

  @Test
  void fillMissingPeriodsInsertsZeroBuckets() {
    List<AggregatedBucket> sparse = List.of(bucket("2024-03-06T10:00:00Z", 4), bucket("2024-03-06T13:00:00Z", 1));
    TimeRange range = new TimeRange(at("2024-03-06T10:00:00Z"), at("2024-03-06T13:30:00Z"));

    List<AggregatedBucket> filled = aggregator.fillMissingPeriods(sparse, Granularity.hour(), range);

    assertEquals(4, filled.size());
    assertTrue(filled.get(1).isEmpty());
    assertTrue(filled.get(2).isEmpty());
    List<AggregatedBucket> withoutZeros = filled.stream().filter(b -> !b.isEmpty()).collect(Collectors.toList());
    assertEquals(sparse, withoutZeros);
  }

  @Test
  void fillMissingPeriodsOfNothingIsNothing() {
    TimeRange range = new TimeRange(at("2024-03-06T00:00:00Z"), at("2024-03-07T00:00:00Z"));

    assertTrue(aggregator.fillMissingPeriods(List.of(), Granularity.hour(), range).isEmpty());
  }

  @Test
  void mergeSumsMatchingStarts() {
    List<AggregatedBucket> merged = aggregator.merge(List.of(
        List.of(bucket("2024-03-06T10:00:00Z", 2), bucket("2024-03-06T11:00:00Z", 1)),
        List.of(bucket("2024-03-06T10:00:00Z", 3))));

    assertEquals(List.of(bucket("2024-03-06T10:00:00Z", 5), bucket("2024-03-06T11:00:00Z", 1)), merged);
  }

  @Test
  void rollingAverageOverPageViews() {
    List<AggregatedBucket> buckets = List.of(
        bucket("2024-03-01T00:00:00Z", 10), bucket("2024-03-02T00:00:00Z", 20), bucket("2024-03-03T00:00:00Z", 0),
        bucket("2024-03-04T00:00:00Z", 5));

    List<RollingAveragePoint> points = aggregator.rollingAverage(buckets, 3, BucketMetric.PAGE_VIEWS);

    assertEquals(List.of(10.0, 15.0, 10.0, 8.3),
        points.stream().map(RollingAveragePoint::rollingAverage).collect(Collectors.toList()));
    assertEquals(5, points.get(3).value());
  }

  @Test
  void rollingAverageWithWindowOneIsIdentity() {
    List<AggregatedBucket> buckets = List.of(bucket("2024-03-01T00:00:00Z", 7), bucket("2024-03-02T00:00:00Z", 3));

    List<RollingAveragePoint> points = aggregator.rollingAverage(buckets, 1, BucketMetric.SESSIONS);

    assertEquals(7.0, points.get(0).rollingAverage());
    assertEquals(3.0, points.get(1).rollingAverage());
    assertThrows(IllegalArgumentException.class, () -> aggregator.rollingAverage(buckets, 0, BucketMetric.SESSIONS));
  }

  @Test
  void growthRates() {
    assertEquals(50.0, aggregator.growthRate(bucket("2024-03-02T00:00:00Z", 150), bucket("2024-03-01T00:00:00Z", 100)));
    assertEquals(100.0, aggregator.growthRate(5, 0));
    assertEquals(0.0, aggregator.growthRate(0, 0));
    assertEquals(-100.0, aggregator.growthRate(0, 8));
  }

  @Test
  void topPeriodsByPageViews() {
    List<AggregatedBucket> buckets = List.of(
        bucket("2024-03-01T00:00:00Z", 1), bucket("2024-03-02T00:00:00Z", 9), bucket("2024-03-03T00:00:00Z", 4));

    List<AggregatedBucket> top = aggregator.topPeriods(buckets, 2);

    assertEquals(List.of(9L, 4L), top.stream().map(AggregatedBucket::pageViews).collect(Collectors.toList()));
  }
}
