/**
 * Filters shipped with PROXYLOG, registered through
 * {@link ca.gc.cra.proxylog.application.filter.builtin.BuiltInFilters}.
 */
package ca.gc.cra.proxylog.application.filter.builtin;
