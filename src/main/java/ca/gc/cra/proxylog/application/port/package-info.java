/**
 * Ports used by the analysis pipeline: line parsing, line reading, metrics and rendering.
 * <p><strong>Role:</strong> Boundaries between the application layer and infrastructure adapters.</p>
 */
package ca.gc.cra.proxylog.application.port;
