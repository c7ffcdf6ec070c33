/**
 * Domain utility classes for numeric rounding.
 * <p><strong>Role:</strong> Shared by classifiers, aggregators and the metrics calculator so every percentage is
 * rounded the same way.</p>
 * <p><strong>Concurrency:</strong> Utilities are stateless; safe to call concurrently.</p>
 */
package ca.gc.cra.pulse.domain.util;
