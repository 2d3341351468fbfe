/**
 * {@code ReportRenderer} adapters: aligned plain text and Jackson-streamed JSON.
 *
 * @since 0.1.0
 */
package ca.gc.cra.proxylog.infrastructure.report;
