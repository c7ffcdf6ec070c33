package ca.gc.cra.pulse.application.metrics;

import ca.gc.cra.pulse.domain.event.ConversionEvent;
import ca.gc.cra.pulse.domain.event.EventRecord;
import ca.gc.cra.pulse.domain.event.Session;
import ca.gc.cra.pulse.domain.metrics.AnomalyReport;
import ca.gc.cra.pulse.domain.metrics.Comparison;
import ca.gc.cra.pulse.domain.metrics.DurationBuckets;
import ca.gc.cra.pulse.domain.metrics.MetricsSummary;
import ca.gc.cra.pulse.domain.metrics.PerformanceMetrics;
import ca.gc.cra.pulse.domain.metrics.TimeMetrics;
import ca.gc.cra.pulse.domain.metrics.TrendingPage;
import ca.gc.cra.pulse.domain.metrics.VisitorRatio;
import ca.gc.cra.pulse.domain.util.Rounding;
import ca.gc.cra.pulse.validation.Numbers;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Comparator;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.SortedMap;
import java.util.TreeMap;

/**
 * <strong>What:</strong> Derives engagement, duration, conversion and distribution statistics from sessions,
 * pageviews and conversion events.
 * <p><strong>Why:</strong> Supplies every scalar metric shown on the dashboard.</p>
 * <p><strong>Role:</strong> Application service; pure functions over caller-owned collections.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Ratios are zero-safe and rounded half-up to one decimal.</li>
 *   <li>Durations only consider closed sessions and are reported in whole seconds.</li>
 *   <li>Inputs are never mutated; sorting happens on copies.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Stateless; safe for concurrent use.</p>
 * <p><strong>Performance:</strong> Linear except percentiles and medians, which sort a copy.</p>
 *
 * @since 0.1.0
 */
public final class MetricsCalculator {
  /** Default z-score above which a value is anomalous. */
  public static final double DEFAULT_ANOMALY_THRESHOLD = 2.0;
  /** Default minimum growth percentage for trending pages. */
  public static final double DEFAULT_TRENDING_GROWTH = 50.0;

  private static final int PAGE_VIEW_POINTS = 5;
  private static final int PAGE_VIEW_CAP = 30;
  private static final int MINUTE_POINTS = 4;
  private static final int DURATION_CAP = 40;
  private static final int CONVERSION_POINTS = 30;
  private static final int MAX_SCORE = 100;

  /**
   * Percentage of sessions with at most one pageview.
   *
   * @param sessions sessions; must not be {@code null}
   * @return bounce rate, one decimal; {@code 0} for no sessions
   */
  public double bounceRate(List<Session> sessions) {
    Objects.requireNonNull(sessions, "sessions");
    long bounced = sessions.stream().filter(Session::bounced).count();
    return Rounding.percentage(bounced, sessions.size());
  }

  /**
   * Mean duration of closed sessions. Open sessions are excluded from numerator and denominator.
   *
   * @param sessions sessions; must not be {@code null}
   * @return whole seconds; {@code 0} when no session is closed
   */
  public long averageSessionDuration(List<Session> sessions) {
    double[] durations = closedDurations(sessions);
    return durations.length == 0 ? 0 : Rounding.whole(sum(durations) / durations.length);
  }

  /**
   * Median duration of closed sessions.
   *
   * @param sessions sessions; must not be {@code null}
   * @return whole seconds; {@code 0} when no session is closed
   */
  public long medianSessionDuration(List<Session> sessions) {
    return Rounding.whole(median(closedDurations(sessions)));
  }

  /**
   * Mean pageviews per session.
   *
   * @param sessions sessions; must not be {@code null}
   * @return one decimal; {@code 0} for no sessions
   */
  public double averagePageViewsPerSession(List<Session> sessions) {
    Objects.requireNonNull(sessions, "sessions");
    if (sessions.isEmpty()) {
      return 0;
    }
    long pageViews = 0;
    for (Session session : sessions) {
      pageViews += session.pageViews().size();
    }
    return Rounding.oneDecimal((double) pageViews / sessions.size());
  }

  /**
   * Percentage of sessions whose id appears among the conversion events.
   *
   * @param sessions sessions; must not be {@code null}
   * @param conversions conversion events; must not be {@code null}
   * @return one decimal; {@code 0} for no sessions
   */
  public double conversionRate(List<Session> sessions, List<ConversionEvent> conversions) {
    Objects.requireNonNull(sessions, "sessions");
    Objects.requireNonNull(conversions, "conversions");
    Set<String> converted = new HashSet<>();
    for (ConversionEvent conversion : conversions) {
      converted.add(conversion.sessionId());
    }
    long hits = sessions.stream().filter(s -> converted.contains(s.id())).count();
    return Rounding.percentage(hits, sessions.size());
  }

  /**
   * Percentage of pageviews for {@code path} marked as exit pages.
   *
   * @param pageViews pageviews; must not be {@code null}
   * @param path exact path to inspect
   * @return one decimal; {@code 0} when the path has no pageviews
   */
  public double exitRate(List<EventRecord> pageViews, String path) {
    Objects.requireNonNull(pageViews, "pageViews");
    long views = 0;
    long exits = 0;
    for (EventRecord pageView : pageViews) {
      if (pageView.path().equals(path)) {
        views++;
        if (pageView.isExit()) {
          exits++;
        }
      }
    }
    return Rounding.percentage(exits, views);
  }

  /**
   * Mean time on page over pageviews that carry a duration.
   *
   * @param pageViews pageviews; must not be {@code null}
   * @return whole seconds; {@code 0} when none carries a duration
   */
  public long averageTimeOnPage(List<EventRecord> pageViews) {
    double[] durations = pageDurations(pageViews);
    return durations.length == 0 ? 0 : Rounding.whole(sum(durations) / durations.length);
  }

  /**
   * Counts distinct visitor ids.
   *
   * @param pageViews pageviews; must not be {@code null}
   * @return distinct non-blank user ids
   */
  public long uniqueVisitors(List<EventRecord> pageViews) {
    Objects.requireNonNull(pageViews, "pageViews");
    Set<String> visitors = new HashSet<>();
    for (EventRecord pageView : pageViews) {
      if (pageView.userId() != null) {
        visitors.add(pageView.userId());
      }
    }
    return visitors.size();
  }

  /**
   * Percentage of identified visitors with more than one session.
   *
   * @param sessions sessions; sessions without a user id are ignored
   * @return one decimal; {@code 0} when no session carries a user id
   */
  public double returnVisitorRate(List<Session> sessions) {
    VisitorRatio ratio = visitorRatio(sessions);
    return Rounding.percentage(ratio.returningVisitors(), ratio.total());
  }

  /**
   * Counts identified visitors with one session versus several.
   *
   * @param sessions sessions; must not be {@code null}
   * @return new and returning visitor counts
   */
  public VisitorRatio visitorRatio(List<Session> sessions) {
    Objects.requireNonNull(sessions, "sessions");
    Map<String, Integer> sessionsPerUser = new LinkedHashMap<>();
    for (Session session : sessions) {
      if (session.userId() != null) {
        sessionsPerUser.merge(session.userId(), 1, Integer::sum);
      }
    }
    long returning = sessionsPerUser.values().stream().filter(count -> count > 1).count();
    return new VisitorRatio(sessionsPerUser.size() - returning, returning);
  }

  /**
   * Builds the headline totals without a conversion rate.
   *
   * @param pageViews pageviews
   * @param sessions sessions
   * @return summary
   */
  public MetricsSummary summary(List<EventRecord> pageViews, List<Session> sessions) {
    Objects.requireNonNull(pageViews, "pageViews");
    Objects.requireNonNull(sessions, "sessions");
    return new MetricsSummary(
        pageViews.size(),
        uniqueVisitors(pageViews),
        sessions.size(),
        bounceRate(sessions),
        averageSessionDuration(sessions),
        averagePageViewsPerSession(sessions),
        null);
  }

  /**
   * Builds the headline totals including the conversion rate.
   *
   * @param pageViews pageviews
   * @param sessions sessions
   * @param conversions conversion events
   * @return summary with {@link MetricsSummary#conversionRate()} set
   */
  public MetricsSummary summary(
      List<EventRecord> pageViews, List<Session> sessions, List<ConversionEvent> conversions) {
    return summary(pageViews, sessions).withConversionRate(conversionRate(sessions, conversions));
  }

  /**
   * Linear-interpolation percentile (R-7): index {@code p/100 * (n-1)} interpolated between its neighbours.
   *
   * @param values samples; not modified
   * @param p percentile in {@code [0, 100]}
   * @return percentile rounded to one decimal; {@code 0} for no samples
   * @throws IllegalArgumentException if {@code p} is outside {@code [0, 100]}
   */
  public double percentile(List<Double> values, double p) {
    Objects.requireNonNull(values, "values");
    Numbers.requireRange("percentile", p, 0, 100);
    if (values.isEmpty()) {
      return 0;
    }
    double[] sorted = new double[values.size()];
    for (int i = 0; i < sorted.length; i++) {
      sorted[i] = values.get(i);
    }
    Arrays.sort(sorted);
    double index = (p / 100) * (sorted.length - 1);
    int lower = (int) Math.floor(index);
    int upper = (int) Math.ceil(index);
    double weight = index - lower;
    return Rounding.oneDecimal(sorted[lower] * (1 - weight) + sorted[upper] * weight);
  }

  /**
   * Mean and p50/p75/p95 of a measured quantity.
   *
   * @param values samples; not modified
   * @param metricName label carried into the result
   * @return performance metrics; all zero for no samples
   */
  public PerformanceMetrics performanceMetrics(List<Double> values, String metricName) {
    Objects.requireNonNull(values, "values");
    double mean = 0;
    if (!values.isEmpty()) {
      double total = 0;
      for (double value : values) {
        total += value;
      }
      mean = Rounding.oneDecimal(total / values.size());
    }
    return new PerformanceMetrics(
        metricName, mean, percentile(values, 50), percentile(values, 75), percentile(values, 95));
  }

  /**
   * Scores a session from 0 to 100: 5 points per pageview (max 30), 4 points per minute of a closed session
   * (max 40), and 30 points for a conversion.
   *
   * @param session session to score
   * @return score in {@code [0, 100]}
   */
  public long engagementScore(Session session) {
    Objects.requireNonNull(session, "session");
    double score = Math.min(session.pageViews().size() * PAGE_VIEW_POINTS, PAGE_VIEW_CAP);
    if (session.isClosed()) {
      double minutes = session.duration().orElseThrow().toMillis() / 60_000.0;
      score += Math.min(minutes * MINUTE_POINTS, DURATION_CAP);
    }
    if (session.isConverted()) {
      score += CONVERSION_POINTS;
    }
    return Math.min(Rounding.whole(score), MAX_SCORE);
  }

  /**
   * Mean engagement score.
   *
   * @param sessions sessions; must not be {@code null}
   * @return one decimal; {@code 0} for no sessions
   */
  public double sessionQuality(List<Session> sessions) {
    Objects.requireNonNull(sessions, "sessions");
    if (sessions.isEmpty()) {
      return 0;
    }
    long total = 0;
    for (Session session : sessions) {
      total += engagementScore(session);
    }
    return Rounding.oneDecimal((double) total / sessions.size());
  }

  public List<TrendingPage> trendingPages(List<EventRecord> current, List<EventRecord> previous) {
    return trendingPages(current, previous, DEFAULT_TRENDING_GROWTH);
  }

  /**
   * Paths whose pageviews grew by at least {@code minGrowth} percent. Paths absent from the previous period
   * always trend with growth {@code 100}.
   *
   * @param current pageviews of the current period
   * @param previous pageviews of the previous period
   * @param minGrowth minimum whole-percent growth for existing paths
   * @return trending pages by growth descending
   */
  public List<TrendingPage> trendingPages(List<EventRecord> current, List<EventRecord> previous, double minGrowth) {
    Map<String, Long> currentCounts = countByPath(current);
    Map<String, Long> previousCounts = countByPath(previous);
    List<TrendingPage> trending = new ArrayList<>();
    currentCounts.forEach((path, now) -> {
      long before = previousCounts.getOrDefault(path, 0L);
      if (before == 0) {
        trending.add(new TrendingPage(path, now, 0, 100));
      } else {
        double growth = Rounding.whole(((double) (now - before) / before) * 100);
        if (growth >= minGrowth) {
          trending.add(new TrendingPage(path, now, before, growth));
        }
      }
    });
    trending.sort(Comparator.comparingDouble(TrendingPage::growth).reversed());
    return List.copyOf(trending);
  }

  /**
   * Average, median and total time on page over pageviews that carry a duration.
   *
   * @param pageViews pageviews; must not be {@code null}
   * @return time metrics; all zero when none carries a duration
   */
  public TimeMetrics timeMetrics(List<EventRecord> pageViews) {
    double[] durations = pageDurations(pageViews);
    double total = sum(durations);
    long average = durations.length == 0 ? 0 : Rounding.whole(total / durations.length);
    return new TimeMetrics(average, Rounding.whole(median(durations)), total);
  }

  /**
   * Compares a metric between two periods.
   *
   * @param current current value
   * @param previous baseline value
   * @return absolute change, growth percentage and trend
   */
  public Comparison compare(double current, double previous) {
    double change = current - previous;
    Comparison.Trend trend = change > 0
        ? Comparison.Trend.UP
        : change < 0 ? Comparison.Trend.DOWN : Comparison.Trend.FLAT;
    return new Comparison(change, Rounding.growth(current, previous), trend);
  }

  /**
   * Counts sessions per pageview count.
   *
   * @param sessions sessions; must not be {@code null}
   * @return pageview count to number of sessions, ascending by pageview count
   */
  public SortedMap<Integer, Long> pagesPerSessionDistribution(List<Session> sessions) {
    Objects.requireNonNull(sessions, "sessions");
    SortedMap<Integer, Long> distribution = new TreeMap<>();
    for (Session session : sessions) {
      distribution.merge(session.pageViews().size(), 1L, Long::sum);
    }
    return distribution;
  }

  /**
   * Counts closed sessions per duration band.
   *
   * @param sessions sessions; open sessions are ignored
   * @return band counts
   */
  public DurationBuckets durationBuckets(List<Session> sessions) {
    long[] bands = new long[5];
    for (double seconds : closedDurations(sessions)) {
      if (seconds < 30) {
        bands[0]++;
      } else if (seconds < 60) {
        bands[1]++;
      } else if (seconds < 180) {
        bands[2]++;
      } else if (seconds < 600) {
        bands[3]++;
      } else {
        bands[4]++;
      }
    }
    return new DurationBuckets(bands[0], bands[1], bands[2], bands[3], bands[4]);
  }

  public AnomalyReport detectAnomalies(List<Double> values) {
    return detectAnomalies(values, DEFAULT_ANOMALY_THRESHOLD);
  }

  /**
   * Flags values whose z-score exceeds {@code threshold}. The standard deviation is floored at {@code 1} so a
   * flat series never divides by zero.
   *
   * @param values samples; not modified
   * @param threshold z-score limit; must be non-negative
   * @return anomalies in input order with the rounded mean and standard deviation
   * @throws IllegalArgumentException if {@code threshold} is negative
   */
  public AnomalyReport detectAnomalies(List<Double> values, double threshold) {
    Objects.requireNonNull(values, "values");
    Numbers.requireNonNegative("threshold", threshold);
    if (values.isEmpty()) {
      return AnomalyReport.EMPTY;
    }
    double total = 0;
    for (double value : values) {
      total += value;
    }
    double mean = total / values.size();
    double squares = 0;
    for (double value : values) {
      squares += (value - mean) * (value - mean);
    }
    double stdDev = Math.sqrt(squares / values.size());
    double divisor = Math.max(stdDev, 1);
    List<Double> anomalies = new ArrayList<>();
    for (Double value : values) {
      if (Math.abs(value - mean) / divisor > threshold) {
        anomalies.add(value);
      }
    }
    return new AnomalyReport(anomalies, Rounding.oneDecimal(mean), Rounding.oneDecimal(stdDev));
  }

  private static double[] closedDurations(List<Session> sessions) {
    Objects.requireNonNull(sessions, "sessions");
    return sessions.stream()
        .map(Session::durationSeconds)
        .flatMap(Optional::stream)
        .mapToDouble(Double::doubleValue)
        .toArray();
  }

  private static double[] pageDurations(List<EventRecord> pageViews) {
    Objects.requireNonNull(pageViews, "pageViews");
    return pageViews.stream()
        .map(EventRecord::duration)
        .filter(Objects::nonNull)
        .mapToDouble(Double::doubleValue)
        .toArray();
  }

  private static Map<String, Long> countByPath(List<EventRecord> pageViews) {
    Objects.requireNonNull(pageViews, "pageViews");
    Map<String, Long> counts = new LinkedHashMap<>();
    for (EventRecord pageView : pageViews) {
      counts.merge(pageView.path(), 1L, Long::sum);
    }
    return counts;
  }

  private static double sum(double[] values) {
    double total = 0;
    for (double value : values) {
      total += value;
    }
    return total;
  }

  /** Median of a copy; {@code 0} for no values. */
  private static double median(double[] values) {
    if (values.length == 0) {
      return 0;
    }
    double[] sorted = values.clone();
    Arrays.sort(sorted);
    int mid = sorted.length / 2;
    return sorted.length % 2 == 0 ? (sorted[mid - 1] + sorted[mid]) / 2 : sorted[mid];
  }
}
