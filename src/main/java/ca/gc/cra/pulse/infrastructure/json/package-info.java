/**
 * JSON rendering of dashboard results using Jackson's streaming generator.
 */
package ca.gc.cra.pulse.infrastructure.json;
