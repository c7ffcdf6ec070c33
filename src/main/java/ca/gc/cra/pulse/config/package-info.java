/**
 * Engine configuration, YAML loading and composition root wiring.
 * <p><strong>Role:</strong> Bootstrap layer selecting metric adapters and logging verbosity.</p>
 * <p><strong>Concurrency:</strong> Configuration objects are immutable; safe to share.</p>
 * <p><strong>Security:</strong> YAML is parsed with SnakeYAML's safe constructor; no environment variables are
 * read.</p>
 */
package ca.gc.cra.pulse.config;
