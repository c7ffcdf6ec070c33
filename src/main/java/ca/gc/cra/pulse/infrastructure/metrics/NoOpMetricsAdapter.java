package ca.gc.cra.pulse.infrastructure.metrics;

import ca.gc.cra.pulse.application.port.MetricsPort;

/**
 * Metrics adapter used when {@code metrics.exporter} is {@code none}. Discards every update.
 *
 * @since 0.1.0
 */
public final class NoOpMetricsAdapter implements MetricsPort {

  @Override
  public void increment(String key) {}

  @Override
  public void observe(String key, long value) {}
}
