package ca.gc.cra.pulse.domain.metrics;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Closed sessions counted by duration band. Lower bounds are inclusive.
 *
 * @param under30s {@code [0s, 30s)}
 * @param from30sTo1m {@code [30s, 1m)}
 * @param from1mTo3m {@code [1m, 3m)}
 * @param from3mTo10m {@code [3m, 10m)}
 * @param over10m {@code 10m} and longer
 *
 * @since 0.1.0
 */
public record DurationBuckets(long under30s, long from30sTo1m, long from1mTo3m, long from3mTo10m, long over10m) {

  /**
   * Returns the bands keyed by their display label, shortest first.
   *
   * @return {@code 0-30s}, {@code 30s-1m}, {@code 1m-3m}, {@code 3m-10m}, {@code 10m+}
   */
  public Map<String, Long> asMap() {
    Map<String, Long> bands = new LinkedHashMap<>();
    bands.put("0-30s", under30s);
    bands.put("30s-1m", from30sTo1m);
    bands.put("1m-3m", from1mTo3m);
    bands.put("3m-10m", from3mTo10m);
    bands.put("10m+", over10m);
    return bands;
  }
}
