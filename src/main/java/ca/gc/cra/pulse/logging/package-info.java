/**
 * <strong>Purpose:</strong> Logging utilities that tune verbosity and bound caller-supplied strings before they
 * reach a log line.
 * <p><strong>Concurrency:</strong> Stateless helpers.
 * <p><strong>Observability:</strong> Coordinates with SLF4J/Logback; no custom metrics.
 *
 * @since 0.1.0
 */
package ca.gc.cra.pulse.logging;
