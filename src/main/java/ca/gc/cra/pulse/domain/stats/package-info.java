/**
 * Ranked breakdown rows shared by every classifier and aggregator.
 */
package ca.gc.cra.pulse.domain.stats;
