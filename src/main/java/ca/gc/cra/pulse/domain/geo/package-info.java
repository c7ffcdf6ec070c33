/**
 * Geographic value types: locations, coordinates, bounding boxes, breakdown rows and clusters.
 * <p><strong>Concurrency:</strong> Immutable values.</p>
 */
package ca.gc.cra.pulse.domain.geo;
