package ca.gc.cra.pulse.application.time;

import ca.gc.cra.pulse.domain.time.Granularity;
import ca.gc.cra.pulse.domain.time.TimeSeriesPoint;
import ca.gc.cra.pulse.domain.util.Rounding;
import ca.gc.cra.pulse.validation.Numbers;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;

/**
 * Resampling, gap filling and smoothing for scalar time series such as load times or realtime counters.
 *
 * <p>Stateless; every method returns a new list and leaves its input untouched.</p>
 *
 * @since 0.1.0
 */
public final class TimeSeriesAggregator {

  /**
   * Averages samples per epoch-aligned interval.
   *
   * @param points samples in any order
   * @param intervalMinutes interval width; must be positive and at most {@link Granularity#MAX_WINDOW_MINUTES}
   * @return one point per non-empty interval, stamped with the interval start, ascending
   */
  public List<TimeSeriesPoint> resample(List<TimeSeriesPoint> points, long intervalMinutes) {
    Objects.requireNonNull(points, "points");
    long intervalMillis =
        Numbers.requireRange("intervalMinutes", intervalMinutes, 1, Granularity.MAX_WINDOW_MINUTES) * 60_000L;
    Map<Long, double[]> sums = new TreeMap<>();
    for (TimeSeriesPoint point : points) {
      long start = Math.floorDiv(point.timestamp().toEpochMilli(), intervalMillis) * intervalMillis;
      double[] acc = sums.computeIfAbsent(start, k -> new double[2]);
      acc[0] += point.value();
      acc[1]++;
    }
    List<TimeSeriesPoint> resampled = new ArrayList<>(sums.size());
    sums.forEach((start, acc) -> resampled.add(new TimeSeriesPoint(Instant.ofEpochMilli(start), acc[0] / acc[1])));
    return List.copyOf(resampled);
  }

  /**
   * Inserts zero-valued points between consecutive samples that are more than one interval apart.
   *
   * <p>For a gap of {@code g} intervals, {@code floor(g) - 1} points are inserted at whole-interval offsets from
   * the earlier sample.</p>
   *
   * @param points samples in ascending time order
   * @param intervalMinutes expected spacing; must be positive and at most {@link Granularity#MAX_WINDOW_MINUTES}
   * @return samples with zero points inserted
   */
  public List<TimeSeriesPoint> fillGaps(List<TimeSeriesPoint> points, long intervalMinutes) {
    Objects.requireNonNull(points, "points");
    long intervalMillis =
        Numbers.requireRange("intervalMinutes", intervalMinutes, 1, Granularity.MAX_WINDOW_MINUTES) * 60_000L;
    if (points.isEmpty()) {
      return List.of();
    }
    List<TimeSeriesPoint> filled = new ArrayList<>(points.size());
    for (int i = 0; i < points.size() - 1; i++) {
      TimeSeriesPoint current = points.get(i);
      filled.add(current);
      long currentMillis = current.timestamp().toEpochMilli();
      long gap = points.get(i + 1).timestamp().toEpochMilli() - currentMillis;
      if (gap > intervalMillis) {
        long steps = gap / intervalMillis;
        for (long j = 1; j < steps; j++) {
          filled.add(new TimeSeriesPoint(Instant.ofEpochMilli(currentMillis + j * intervalMillis), 0));
        }
      }
    }
    filled.add(points.get(points.size() - 1));
    return List.copyOf(filled);
  }

  /**
   * Trailing rolling average over samples.
   *
   * @param points samples in chart order
   * @param windowSize samples per window; must be positive
   * @return one point per sample with the averaged value rounded to two decimals
   */
  public List<TimeSeriesPoint> rollingAverage(List<TimeSeriesPoint> points, int windowSize) {
    Objects.requireNonNull(points, "points");
    Numbers.requirePositive("windowSize", windowSize);
    List<TimeSeriesPoint> smoothed = new ArrayList<>(points.size());
    for (int i = 0; i < points.size(); i++) {
      int from = Math.max(0, i - windowSize + 1);
      double sum = 0;
      for (int j = from; j <= i; j++) {
        sum += points.get(j).value();
      }
      smoothed.add(new TimeSeriesPoint(points.get(i).timestamp(), Rounding.twoDecimals(sum / (i - from + 1))));
    }
    return List.copyOf(smoothed);
  }
}
