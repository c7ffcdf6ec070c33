package ca.gc.cra.pulse.application.port;

/**
 * <strong>What:</strong> Port abstracting PULSE metric emission.
 * <p><strong>Why:</strong> Lets the summary use case record request counts and latencies without binding to a
 * vendor SDK.</p>
 * <p><strong>Role:</strong> Application port implemented by {@code OpenTelemetryMetricsAdapter} and
 * {@code NoOpMetricsAdapter}.</p>
 * <p><strong>Thread-safety:</strong> Implementations must tolerate concurrent summaries.</p>
 * <p><strong>Observability:</strong> Defines the metric name contract (e.g., {@code pulse.summary.latencyNanos}).</p>
 *
 * @implNote Metric keys must not be {@code null}; adapters may normalize names.
 * @since 0.1.0
 */
public interface MetricsPort {
  /**
   * Increments the named counter by one.
   *
   * @param key dotted metric name (e.g., {@code pulse.summary.requests}); must not be {@code null}
   */
  void increment(String key);

  /**
   * Records one sample of a histogram-style metric.
   *
   * @param key dotted metric name; must not be {@code null}
   * @param value observed value, such as nanoseconds or a count
   */
  void observe(String key, long value);

  /** Metrics implementation that ignores all updates. */
  MetricsPort NO_OP = new MetricsPort() {
    @Override public void increment(String key) {}

    @Override public void observe(String key, long value) {}
  };
}
