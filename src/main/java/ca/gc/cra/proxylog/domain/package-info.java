/**
 * Core domain model for PROXYLOG: parsed log records, parse failures and time windows.
 * <p><strong>Role:</strong> Domain layer with no infrastructure dependencies.</p>
 * <p><strong>Concurrency:</strong> Types are immutable; safe to share across threads.</p>
 */
package ca.gc.cra.proxylog.domain;
