/**
 * <strong>Purpose:</strong> Validation helpers used by engine operations and configuration bootstrap.
 * <p><strong>Pipeline role:</strong> Enforces input contracts (window sizes, percentiles, limits, identifiers)
 * before any statistic is computed.
 * <p><strong>Concurrency:</strong> Stateless utilities safe for concurrent invocation.
 * <p><strong>Performance:</strong> Branch-only checks; no allocations beyond intermediate strings.
 * <p><strong>Observability:</strong> No direct metrics or logging; failures surface via {@link IllegalArgumentException}.
 *
 * @since 0.1.0
 */
package ca.gc.cra.pulse.validation;
