package ca.gc.cra.pulse.domain.metrics;

import java.util.List;

/**
 * Outcome of z-score anomaly detection.
 *
 * @param anomalies flagged values in input order
 * @param mean population mean, one decimal
 * @param stdDev population standard deviation, one decimal
 *
 * @since 0.1.0
 */
public record AnomalyReport(List<Double> anomalies, double mean, double stdDev) {

  /** Report for an empty series. */
  public static final AnomalyReport EMPTY = new AnomalyReport(List.of(), 0, 0);

  public AnomalyReport {
    anomalies = List.copyOf(anomalies);
  }

  public boolean hasAnomalies() {
    return !anomalies.isEmpty();
  }
}
