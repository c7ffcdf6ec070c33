/**
 * Geographic aggregation: breakdowns, distances and clustering over resolved geo attributes.
 * <p><strong>Concurrency:</strong> Stateless services.</p>
 */
package ca.gc.cra.pulse.application.geo;
