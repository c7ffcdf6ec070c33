/**
 * Metric adapters implementing {@link ca.gc.cra.pulse.application.port.MetricsPort}.
 * <p><strong>Concurrency:</strong> Adapters are thread-safe; instruments are cached in concurrent maps.</p>
 * <p><strong>Observability:</strong> Exports through OpenTelemetry OTLP when enabled.</p>
 */
package ca.gc.cra.pulse.infrastructure.metrics;
