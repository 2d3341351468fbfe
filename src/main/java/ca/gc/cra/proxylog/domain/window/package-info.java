/**
 * Time-window selection of log records.
 */
package ca.gc.cra.proxylog.domain.window;
