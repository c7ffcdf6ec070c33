/**
 * Adapters binding PULSE ports to OpenTelemetry and JSON output.
 */
package ca.gc.cra.pulse.infrastructure;
