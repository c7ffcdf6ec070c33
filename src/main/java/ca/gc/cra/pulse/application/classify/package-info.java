/**
 * Pure classifiers for user-agent strings and referrer URLs.
 * <p><strong>Role:</strong> Leaves of the aggregation pipeline; every breakdown by device, browser, OS, source
 * or medium starts here.</p>
 * <p><strong>Concurrency:</strong> Stateless; rule tables are immutable.</p>
 * <p><strong>Error handling:</strong> Soft input (blank or malformed strings) maps to fallback values and never
 * throws.</p>
 */
package ca.gc.cra.pulse.application.classify;
