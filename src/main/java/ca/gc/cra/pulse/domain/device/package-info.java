/**
 * Device classification results derived from user-agent strings.
 * <p><strong>Role:</strong> Output of the user-agent classifier; input to device, browser and OS breakdowns.</p>
 * <p><strong>Concurrency:</strong> Immutable values.</p>
 */
package ca.gc.cra.pulse.domain.device;
