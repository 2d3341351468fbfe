/**
 * Structured representation of HAProxy log lines.
 * <p>Timers and status codes that HAProxy logs as {@code -1} are modelled as empty
 * {@code Optional*} values.</p>
 */
package ca.gc.cra.proxylog.domain.log;
