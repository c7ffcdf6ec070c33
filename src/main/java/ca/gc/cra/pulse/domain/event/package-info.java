/**
 * Event-level domain types: pageview records, visits and conversion events.
 * <p><strong>Role:</strong> Input shapes crossing the boundary from the ingestion and session layers.</p>
 * <p><strong>Concurrency:</strong> Records are immutable; safe to share across threads.</p>
 * <p><strong>Security:</strong> Visitor identifiers arrive already anonymized; no raw IP address is modelled.</p>
 */
package ca.gc.cra.pulse.domain.event;
